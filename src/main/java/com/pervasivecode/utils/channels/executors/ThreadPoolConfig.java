package com.pervasivecode.utils.channels.executors;

import static com.google.common.base.Preconditions.checkState;
import com.google.auto.value.AutoValue;
import com.pervasivecode.utils.channels.storage.StorageKind;

/** This object holds configuration information for a {@link ThreadPool} instance. */
@AutoValue
public abstract class ThreadPoolConfig {
  public static final int DEFAULT_QUEUE_SIZE = 1;
  public static final String DEFAULT_NAME_FORMAT = "channel-pool-worker-%d";

  protected ThreadPoolConfig() {}

  /**
   * Create an object that will build a {@link ThreadPoolConfig} instance. The builder starts out
   * populated with defaults: one worker per available processor, a ring buffer task queue holding
   * {@value #DEFAULT_QUEUE_SIZE} task, and {@value #DEFAULT_NAME_FORMAT} as the thread name format.
   *
   * @return a config builder holding the default values.
   */
  public static ThreadPoolConfig.Builder builder() {
    return new AutoValue_ThreadPoolConfig.Builder() //
        .setNumThreads(Runtime.getRuntime().availableProcessors()) //
        .setQueueSize(DEFAULT_QUEUE_SIZE) //
        .setStorageKind(StorageKind.RING_BUFFER) //
        .setNameFormat(DEFAULT_NAME_FORMAT);
  }

  /**
   * The number of worker threads that the ThreadPool should start. This is fixed for the lifetime
   * of the pool.
   *
   * @return the number of worker threads.
   */
  public abstract int numThreads();

  /**
   * The number of submitted tasks that can wait in the task channel for a free worker. When this
   * many tasks are waiting, calls to {@link ThreadPool#submit} block until a worker takes one. A
   * value of 0 means that the task channel is unbounded, which requires
   * {@link StorageKind#LINKED_LIST} storage.
   *
   * @return the capacity of the task channel.
   */
  public abstract int queueSize();

  /**
   * The storage strategy for the task channel.
   *
   * @return the storage kind.
   */
  public abstract StorageKind storageKind();

  /**
   * The format to use to name worker threads. This must contain a "%d" placeholder which will be
   * replaced with the worker's number.
   *
   * @return the format string.
   */
  public abstract String nameFormat();

  /**
   * This object will build a {@link ThreadPoolConfig} instance. See {@link ThreadPoolConfig} for
   * explanations of what these values mean.
   */
  @AutoValue.Builder
  public static abstract class Builder {
    protected Builder() {}

    public abstract ThreadPoolConfig.Builder setNumThreads(int numThreads);

    public abstract ThreadPoolConfig.Builder setQueueSize(int queueSize);

    public abstract ThreadPoolConfig.Builder setStorageKind(StorageKind storageKind);

    public abstract ThreadPoolConfig.Builder setNameFormat(String nameFormat);

    abstract ThreadPoolConfig buildInternal();

    public ThreadPoolConfig build() {
      ThreadPoolConfig config = buildInternal();

      checkState(config.numThreads() > 0, "numThreads must be positive.");
      checkState(config.queueSize() >= 0, "queueSize cannot be negative.");
      checkState(config.queueSize() > 0 || config.storageKind() == StorageKind.LINKED_LIST,
          "An unbounded queue (queueSize 0) requires LINKED_LIST storage.");
      checkState(config.nameFormat().contains("%d"),
          "nameFormat must contain a %d placeholder.");

      return config;
    }
  }
}
