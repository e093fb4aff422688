package com.pervasivecode.utils.channels.storage;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.util.LinkedList;

/**
 * Storage backed by a linked list. It is unbounded by default, but can be limited to a maximum
 * number of elements.
 *
 * @param <E> The type of element held by the storage.
 */
public class LinkedListStorage<E> implements Storage<E> {
  private final LinkedList<E> elements = new LinkedList<>();
  private final int capacity;

  public LinkedListStorage() {
    this(UNBOUNDED);
  }

  public LinkedListStorage(int capacity) {
    checkArgument(capacity > 0, "Capacity must be at least 1. Got %s", capacity);
    this.capacity = capacity;
  }

  @Override
  public void pushBack(E element) {
    checkNotNull(element, "Null elements are not allowed");
    checkState(elements.size() < capacity, "Linked list storage is full.");
    elements.addLast(element);
  }

  @Override
  public E popFront() {
    checkState(!elements.isEmpty(), "Linked list storage is empty.");
    return elements.removeFirst();
  }

  @Override
  public int size() {
    return elements.size();
  }

  @Override
  public int capacity() {
    return capacity;
  }
}
