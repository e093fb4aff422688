package com.pervasivecode.utils.channels.storage;

import javax.annotation.Nonnull;

/**
 * An ordered container of elements that a {@link com.pervasivecode.utils.channels.channel.Channel}
 * uses to hold elements that have been put into it but not yet taken out.
 * <p>
 * Implementations are not thread-safe. The owning channel guards every call with its own lock, and
 * nothing else should hold a reference to the storage.
 *
 * @param <E> The type of element held by the storage.
 */
public interface Storage<E> {
  /** The capacity value reported by storage that has no fixed limit. */
  public static final int UNBOUNDED = Integer.MAX_VALUE;

  /**
   * Append an element at the tail.
   *
   * @param element The element to append.
   * @throws IllegalStateException if the storage is already full.
   */
  public void pushBack(@Nonnull E element);

  /**
   * Remove and return the element at the head.
   *
   * @return The oldest element in the storage.
   * @throws IllegalStateException if the storage is empty.
   */
  public @Nonnull E popFront();

  /**
   * @return The number of elements currently held.
   */
  public int size();

  /**
   * @return The maximum number of elements this storage can hold, or {@link #UNBOUNDED}.
   */
  public int capacity();

  public default boolean isEmpty() {
    return size() == 0;
  }

  public default boolean isFull() {
    return size() >= capacity();
  }
}
