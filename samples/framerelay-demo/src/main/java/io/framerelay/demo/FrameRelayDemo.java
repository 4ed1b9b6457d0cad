package io.framerelay.demo;

import io.framerelay.BoundingBox;
import io.framerelay.DetectionException;
import io.framerelay.Detector;
import io.framerelay.Frame;
import io.framerelay.FrameSource;
import io.framerelay.RawFrame;
import io.framerelay.channel.memory.InMemoryBroker;
import io.framerelay.channel.memory.InMemoryChannelClient;
import io.framerelay.consumer.ConsumerPipeline;
import io.framerelay.producer.ProducerPipeline;
import io.framerelay.retry.ExponentialBackoffRetryPolicy;
import io.framerelay.sink.DeduplicatingResultSink;
import io.framerelay.supervisor.HealthStatus;
import io.framerelay.supervisor.Supervisor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Streams synthetic frames through the in-memory broker to a brightness detector,
 * with a short broker outage in the middle.
 * <p>
 * Run with: mvn -pl samples/framerelay-demo exec:java
 */
public final class FrameRelayDemo {

    private static final int FRAME_COUNT = 200;
    private static final int WIDTH = 32;
    private static final int HEIGHT = 24;

    public static void main(String[] args) throws Exception {
        // 1. In-memory broker shared by both pipelines
        InMemoryBroker broker = new InMemoryBroker();
        InMemoryChannelClient client = new InMemoryChannelClient(broker);

        // 2. Supervisor wiring a camera producer and a detector consumer
        try (Supervisor supervisor = Supervisor.builder()
                .producer(ProducerPipeline.builder()
                        .channelClient(client)
                        .frameSource(new SyntheticCamera(FRAME_COUNT, 100))
                        .sourceId("cam0")
                        .queueCapacity(16)
                        .reconnectPolicy(new ExponentialBackoffRetryPolicy(50, 500)))
                .consumer(ConsumerPipeline.builder()
                        .channelClient(client)
                        .detector(new BrightnessDetector(160))
                        .sink(new DeduplicatingResultSink(detection -> {
                            if (!detection.isEmpty()) {
                                System.out.println("[Detection] " + detection.sourceId() + "#"
                                        + detection.frameSequenceNumber() + " attempt="
                                        + detection.attemptCount() + " boxes=" + detection.boxes());
                            }
                        }, 1000))
                        .prefetchLimit(4)
                        .maxAttempts(3)
                        .reconnectPolicy(new ExponentialBackoffRetryPolicy(50, 500)))
                .build()) {

            System.out.println("=== Frame Relay Demo ===\n");
            supervisor.start();

            // 3. Simulate a broker outage
            Thread.sleep(500);
            System.out.println("\n[Broker] going down");
            broker.setAvailable(false);
            Thread.sleep(300);
            System.out.println("[Broker] back up\n");
            broker.setAvailable(true);

            // 4. Wait for the stream to end and the consumer to catch up
            supervisor.producer().orElseThrow().awaitCompletion(Duration.ofSeconds(30));
            broker.awaitIdle("frames", Duration.ofSeconds(30));

            HealthStatus health = supervisor.health();
            System.out.println("\n=== Summary ===");
            System.out.println("Published:    " + health.framesPublished());
            System.out.println("Dropped:      " + health.framesDropped());
            System.out.println("Failed:       " + health.framesFailed());
            System.out.println("Acked:        " + health.deliveriesAcked());
            System.out.println("Dead-letters: " + health.deliveriesDead());
            System.out.println("Failures:     " + health.failuresReported());
        }
    }

    /**
     * Gray-scale frames at a fixed rate with a bright square drifting across every few
     * frames.
     */
    static final class SyntheticCamera implements FrameSource {
        private final int frames;
        private final long intervalMs;
        private int produced;

        SyntheticCamera(int frames, int fps) {
            this.frames = frames;
            this.intervalMs = 1000L / fps;
        }

        @Override
        public Optional<RawFrame> nextFrame() {
            if (produced >= frames) {
                return Optional.empty();
            }
            try {
                Thread.sleep(intervalMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Optional.empty();
            }
            byte[] pixels = new byte[WIDTH * HEIGHT];
            for (int i = 0; i < pixels.length; i++) {
                pixels[i] = (byte) ThreadLocalRandom.current().nextInt(0, 80);
            }
            if (produced % 5 == 0) {
                int left = produced % (WIDTH - 4);
                for (int y = 8; y < 12; y++) {
                    for (int x = left; x < left + 4; x++) {
                        pixels[y * WIDTH + x] = (byte) 250;
                    }
                }
            }
            produced++;
            return Optional.of(RawFrame.of(pixels));
        }

        @Override
        public void close() {
            System.out.println("[Camera] closed after " + produced + " frame(s)");
        }
    }

    /** Boxes the bright pixels of a frame; fails transiently now and then. */
    static final class BrightnessDetector implements Detector {
        private final int threshold;
        private final AtomicInteger calls = new AtomicInteger();

        BrightnessDetector(int threshold) {
            this.threshold = threshold;
        }

        @Override
        public List<BoundingBox> detect(Frame frame) throws DetectionException {
            if (calls.incrementAndGet() % 37 == 0) {
                throw DetectionException.transientFailure("accelerator busy");
            }
            byte[] pixels = frame.payload();
            int minX = WIDTH;
            int minY = HEIGHT;
            int maxX = -1;
            int maxY = -1;
            int bright = 0;
            for (int i = 0; i < pixels.length; i++) {
                if ((pixels[i] & 0xFF) >= threshold) {
                    int x = i % WIDTH;
                    int y = i / WIDTH;
                    minX = Math.min(minX, x);
                    minY = Math.min(minY, y);
                    maxX = Math.max(maxX, x);
                    maxY = Math.max(maxY, y);
                    bright++;
                }
            }
            if (bright == 0) {
                return List.of();
            }
            double confidence = Math.min(1.0, bright / 16.0);
            return List.of(new BoundingBox("bright", confidence, minX, minY, maxX - minX + 1, maxY - minY + 1));
        }
    }
}
