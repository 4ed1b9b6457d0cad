package io.framerelay.producer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-capacity ring of slots between capture and publish.
 *
 * <p>{@link #offer(Object)} never blocks: when every slot is taken the oldest element is
 * overwritten in place and handed back to the caller, so memory stays bounded by the
 * capacity whatever the consumer side does.
 *
 * <p>This class is thread-safe.
 *
 * @param <T> element type
 */
public final class DropOldestBuffer<T> {
  private final Object[] slots;
  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notEmpty = lock.newCondition();
  private int head;
  private int size;
  private int highWaterMark;

  public DropOldestBuffer(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be > 0, got: " + capacity);
    }
    this.slots = new Object[capacity];
  }

  /**
   * Appends an element, evicting the oldest one if the buffer is full.
   *
   * @param item element to append
   * @return the evicted element, or {@code null} if nothing was evicted
   */
  public T offer(T item) {
    if (item == null) {
      throw new NullPointerException("item");
    }
    lock.lock();
    try {
      T evicted = null;
      if (size == slots.length) {
        evicted = elementAt(head);
        slots[head] = item;
        head = (head + 1) % slots.length;
      } else {
        slots[(head + size) % slots.length] = item;
        size++;
        highWaterMark = Math.max(highWaterMark, size);
      }
      notEmpty.signal();
      return evicted;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes the oldest element, waiting up to the timeout for one to arrive.
   *
   * @param timeout maximum wait
   * @param unit    unit of {@code timeout}
   * @return the oldest element, or {@code null} on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public T poll(long timeout, TimeUnit unit) throws InterruptedException {
    long remaining = unit.toNanos(timeout);
    lock.lock();
    try {
      while (size == 0) {
        if (remaining <= 0) {
          return null;
        }
        remaining = notEmpty.awaitNanos(remaining);
      }
      return removeHead();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Removes and returns every buffered element, oldest first.
   *
   * @return drained elements
   */
  public List<T> drain() {
    lock.lock();
    try {
      List<T> drained = new ArrayList<>(size);
      while (size > 0) {
        drained.add(removeHead());
      }
      return drained;
    } finally {
      lock.unlock();
    }
  }

  public int size() {
    lock.lock();
    try {
      return size;
    } finally {
      lock.unlock();
    }
  }

  public boolean isEmpty() {
    return size() == 0;
  }

  public int capacity() {
    return slots.length;
  }

  /**
   * Largest number of elements ever held at once. Never exceeds {@link #capacity()}.
   *
   * @return high-water mark
   */
  public int highWaterMark() {
    lock.lock();
    try {
      return highWaterMark;
    } finally {
      lock.unlock();
    }
  }

  private T removeHead() {
    T item = elementAt(head);
    slots[head] = null;
    head = (head + 1) % slots.length;
    size--;
    return item;
  }

  @SuppressWarnings("unchecked")
  private T elementAt(int index) {
    return (T) slots[index];
  }
}
