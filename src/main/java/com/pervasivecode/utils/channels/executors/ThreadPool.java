package com.pervasivecode.utils.channels.executors;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import com.pervasivecode.utils.channels.channel.BlockingChannel;
import com.pervasivecode.utils.channels.channel.Channels;

/**
 * A fixed set of worker threads that run tasks taken from a {@link BlockingChannel}.
 * <p>
 * Submitting a task wraps it in a {@link FutureTask} and puts that into the task channel. When the
 * channel is bounded and full, {@link #submit} blocks the submitting thread until a worker takes a
 * task, so a fast producer is throttled to the pace of the workers rather than having its tasks
 * rejected. Anything a task throws is captured in its Future, and the worker that ran it goes on to
 * the next task.
 * <p>
 * Workers start when the pool is constructed and run until {@link #stop()} is called. Stopping
 * closes the task channel and joins every worker. Tasks that are still queued when stopping begins
 * are never run, and their Futures never complete. A task submitted while {@link #stop()} is
 * running may be dropped the same way.
 */
public class ThreadPool implements Executor, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(ThreadPool.class);

  private final int numThreads;
  private final BlockingChannel<FutureTask<?>> tasks;
  private final AtomicBoolean isRunning = new AtomicBoolean(true);
  private final ImmutableList<Thread> workers;

  /** Create a pool with the default configuration; see {@link ThreadPoolConfig#builder()}. */
  public ThreadPool() {
    this(ThreadPoolConfig.builder().build());
  }

  /**
   * Create a pool with the specified number of workers, sharing a task channel that holds one
   * waiting task.
   *
   * @param numThreads The number of worker threads to start.
   */
  public ThreadPool(int numThreads) {
    this(ThreadPoolConfig.builder().setNumThreads(numThreads).build());
  }

  /**
   * Create a pool with the specified configuration, and start its worker threads.
   *
   * @param config An object containing configuration information for the ThreadPool instance being
   *        created.
   */
  public ThreadPool(ThreadPoolConfig config) {
    // Note: validation of config values is done in ThreadPoolConfig.Builder#build(), so we don't
    // need to do it here.
    checkNotNull(config);
    this.numThreads = config.numThreads();
    this.tasks = Channels.create(config.storageKind(), config.queueSize());

    ThreadFactory threadFactory = new ThreadFactoryBuilder() //
        .setNameFormat(config.nameFormat()) //
        .build();

    List<Thread> started = new ArrayList<>(numThreads);
    try {
      for (int i = 0; i < numThreads; i++) {
        Thread worker = threadFactory.newThread(this::runWorker);
        worker.start();
        started.add(worker);
      }
    } catch (RuntimeException | Error e) {
      // Don't leave the workers that did start running with nobody to stop them.
      isRunning.set(false);
      tasks.close();
      joinAll(started);
      throw e;
    }
    this.workers = ImmutableList.copyOf(started);
    logger.debug("Started {} worker threads.", numThreads);
  }

  private void runWorker() {
    while (isRunning.get()) {
      Optional<FutureTask<?>> taken;
      try {
        taken = tasks.take();
      } catch (@SuppressWarnings("unused") InterruptedException ie) {
        // Workers are stopped by closing the task channel, not by interruption.
        continue;
      }
      if (!taken.isPresent() || !isRunning.get()) {
        break;
      }
      taken.get().run();
      // A task may leave its thread interrupted; clear that so the next take() is not affected.
      Thread.interrupted();
    }
    logger.debug("Worker {} is exiting.", Thread.currentThread().getName());
  }

  /**
   * Submit a task for execution, blocking while the task channel is full.
   *
   * @param task The task to run.
   * @return A Future that will hold the task's result, or whatever it threw.
   * @throws RejectedExecutionException if the pool has been stopped, or if the calling thread was
   *         interrupted while blocked waiting for room in the task channel.
   */
  public <T> Future<T> submit(Callable<T> task) {
    FutureTask<T> wrapped = new FutureTask<>(checkNotNull(task));
    enqueue(wrapped);
    return wrapped;
  }

  /**
   * Submit a task for execution, blocking while the task channel is full.
   *
   * @param task The task to run.
   * @return A Future that will hold null, or whatever the task threw.
   * @throws RejectedExecutionException if the pool has been stopped, or if the calling thread was
   *         interrupted while blocked waiting for room in the task channel.
   */
  public Future<?> submit(Runnable task) {
    FutureTask<Void> wrapped = new FutureTask<Void>(checkNotNull(task), null);
    enqueue(wrapped);
    return wrapped;
  }

  @Override
  public void execute(Runnable command) {
    submit(command);
  }

  private void enqueue(FutureTask<?> task) {
    rejectIfStopped();
    final boolean accepted;
    try {
      accepted = tasks.put(task);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new RejectedExecutionException(ie);
    }
    if (!accepted) {
      logger.debug("The pool was stopped while a task was being submitted; the task was dropped.");
    }
  }

  private void rejectIfStopped() {
    if (!isRunning.get()) {
      throw new RejectedExecutionException("The thread pool has been stopped already.");
    }
  }

  /**
   * Stop accepting tasks, close the task channel, and wait for every worker thread to exit. A worker
   * that is running a task finishes that task first. Queued tasks that no worker has started are
   * abandoned.
   * <p>
   * This method can be called more than once; every call returns once the workers have exited. If
   * it is called by a task running on one of this pool's workers, that worker is not waited for,
   * and exits after the task returns.
   */
  public void stop() {
    boolean isFirstStop = isRunning.compareAndSet(true, false);
    if (isFirstStop) {
      logger.debug("Stopping {} worker threads.", numThreads);
      tasks.close();
    }
    joinAll(workers);
    if (isFirstStop) {
      int numAbandoned = tasks.size();
      if (numAbandoned > 0) {
        logger.debug("{} queued tasks were abandoned without running.", numAbandoned);
      }
    }
  }

  private static void joinAll(List<Thread> threads) {
    Thread current = Thread.currentThread();
    for (Thread thread : threads) {
      if (thread != current) {
        Uninterruptibles.joinUninterruptibly(thread);
      }
    }
  }

  /** Equivalent to {@link #stop()}. */
  @Override
  public void close() {
    stop();
  }

  /**
   * @return the number of worker threads, which is fixed for the lifetime of the pool.
   */
  public int numThreads() {
    return numThreads;
  }

  /**
   * @return true until {@link #stop()} has been called.
   */
  public boolean isRunning() {
    return isRunning.get();
  }

  /**
   * The number of submitted tasks waiting in the task channel for a worker.
   * <p>
   * This is exposed only so that tests can observe the channel's backpressure.
   */
  int queuedTaskCount() {
    return tasks.size();
  }
}
