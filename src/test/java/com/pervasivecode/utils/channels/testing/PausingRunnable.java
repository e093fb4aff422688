package com.pervasivecode.utils.channels.testing;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A Runnable that pauses at the start of {@link #run()} until {@link #unpause()} is called, so that
 * tests can keep a worker thread busy for as long as they need to.
 */
public class PausingRunnable implements Runnable {
  private final CountDownLatch notYetPaused = new CountDownLatch(1);
  private final CountDownLatch canFinish = new CountDownLatch(1);
  private final CountDownLatch finished = new CountDownLatch(1);

  @Override
  public void run() {
    if (notYetPaused.getCount() < 1) {
      throw new IllegalStateException("This instance can only be run once.");
    }
    notYetPaused.countDown();
    try {
      canFinish.await();
    } catch (@SuppressWarnings("unused") InterruptedException e) {
      // Treat interruption as being unpaused.
    }
    finished.countDown();
  }

  /** Has a thread started running this task and paused? */
  public boolean hasPaused() {
    return notYetPaused.getCount() == 0;
  }

  /**
   * Block until a thread has started running this task, or until the timeout expires.
   *
   * @return true if the task paused before the timeout expired.
   */
  public boolean waitUntilPaused(long amount, TimeUnit unit) throws InterruptedException {
    return notYetPaused.await(amount, unit);
  }

  /** Release a paused task so that it can finish. */
  public void unpause() {
    canFinish.countDown();
  }

  /** Has this task finished running? */
  public boolean hasFinished() {
    return finished.getCount() == 0;
  }
}
