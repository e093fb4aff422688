package com.pervasivecode.utils.channels.sync;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A counting barrier that lets threads wait until a number of outstanding units of work have all
 * been marked as done.
 * <p>
 * Callers {@link #add()} once per unit of work they hand out, and whoever finishes a unit calls
 * {@link #done()}. {@link #await()} returns once the count is zero. The count is independent of
 * how the work is run: tasks in a {@link com.pervasivecode.utils.channels.executors.ThreadPool},
 * plain threads, or anything else.
 */
public class WaitGroup {
  private final AtomicLong count;

  // Only used to park waiters. The count itself is updated atomically without the lock.
  private final Lock lock = new ReentrantLock();
  private final Condition reachedZero = lock.newCondition();

  /** Create a WaitGroup with a count of zero. */
  public WaitGroup() {
    this(0);
  }

  /**
   * Create a WaitGroup with a count of outstanding units of work.
   *
   * @param initialCount The number of units of work that are already outstanding.
   */
  public WaitGroup(long initialCount) {
    checkArgument(initialCount >= 0, "initialCount cannot be negative. Got %s", initialCount);
    this.count = new AtomicLong(initialCount);
  }

  /**
   * Record one more outstanding unit of work.
   *
   * @return The new count.
   */
  public long add() {
    return count.incrementAndGet();
  }

  /**
   * Record that one unit of work has finished. If this brings the count to zero, every thread
   * blocked in {@link #await()} is released.
   *
   * @return The new count.
   * @throws IllegalStateException if the count is already zero, meaning that done() has been called
   *         more times than add(). The count is left at zero.
   */
  public long done() {
    long current;
    do {
      current = count.get();
      if (current <= 0) {
        throw new IllegalStateException("done() was called more times than add().");
      }
    } while (!count.compareAndSet(current, current - 1));

    long newCount = current - 1;
    if (newCount == 0) {
      lock.lock();
      try {
        reachedZero.signalAll();
      } finally {
        lock.unlock();
      }
    }
    return newCount;
  }

  /**
   * @return The current count of outstanding units of work.
   */
  public long count() {
    return count.get();
  }

  /**
   * Block until the count is zero. Returns immediately if it already is.
   *
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  public void await() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (count.get() > 0) {
        reachedZero.await();
      }
    } finally {
      lock.unlock();
    }
  }

  /**
   * Block until the count is zero, then call the supplied function and return its result.
   *
   * @param then The function to call once the count is zero.
   * @return The value returned by {@code then}.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   * @throws Exception if {@code then} throws.
   */
  public <V> V await(Callable<V> then) throws Exception {
    checkNotNull(then);
    await();
    return then.call();
  }
}
