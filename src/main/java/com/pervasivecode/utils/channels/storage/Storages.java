package com.pervasivecode.utils.channels.storage;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

public class Storages {
  private Storages() {}

  /**
   * Create an empty storage instance of the given kind.
   *
   * @param kind Which storage strategy to use.
   * @param capacity The maximum number of elements, or 0 for unbounded storage. Only
   *        {@link StorageKind#LINKED_LIST} can be unbounded.
   * @return A new, empty storage instance.
   */
  public static <E> Storage<E> create(StorageKind kind, int capacity) {
    checkNotNull(kind);
    checkArgument(capacity >= 0, "Capacity cannot be negative. Got %s", capacity);
    switch (kind) {
      case RING_BUFFER:
        checkArgument(capacity > 0, "A ring buffer cannot be unbounded.");
        return new RingBufferStorage<>(capacity);
      case LINKED_LIST:
        return capacity == 0 ? new LinkedListStorage<>() : new LinkedListStorage<>(capacity);
      default:
        throw new IllegalArgumentException("Unsupported storage kind: " + kind);
    }
  }
}
