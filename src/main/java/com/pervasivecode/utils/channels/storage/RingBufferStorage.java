package com.pervasivecode.utils.channels.storage;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.util.concurrent.ArrayBlockingQueue;

/**
 * Fixed-capacity storage backed by a circular array.
 * <p>
 * The owning channel serializes access, so only the non-blocking methods of the underlying queue
 * are used.
 *
 * @param <E> The type of element held by the storage.
 */
public class RingBufferStorage<E> implements Storage<E> {
  private final ArrayBlockingQueue<E> buffer;
  private final int capacity;

  public RingBufferStorage(int capacity) {
    checkArgument(capacity > 0, "Capacity must be at least 1. Got %s", capacity);
    this.capacity = capacity;
    this.buffer = new ArrayBlockingQueue<>(capacity);
  }

  @Override
  public void pushBack(E element) {
    checkNotNull(element, "Null elements are not allowed");
    checkState(buffer.offer(element), "Ring buffer is full.");
  }

  @Override
  public E popFront() {
    E element = buffer.poll();
    checkState(element != null, "Ring buffer is empty.");
    return element;
  }

  @Override
  public int size() {
    return buffer.size();
  }

  @Override
  public int capacity() {
    return capacity;
  }
}
