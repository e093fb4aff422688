package com.pervasivecode.utils.channels.channel;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import com.pervasivecode.utils.channels.storage.Storage;

/**
 * This Channel implementation synchronizes producers and consumers over a {@link Storage} instance,
 * which holds elements that have been put into the ChannelEntrance but not yet taken from the
 * ChannelExit. The storage decides the capacity: a bounded storage makes {@link #put} block while it
 * is full, which throttles producers to the pace of consumers.
 * <p>
 * All access to the storage happens while holding a single lock. Every state change (an element
 * stored, an element taken, the channel closed) wakes all waiting threads, which then re-check
 * whether they can proceed.
 *
 * @param <E> The type of object that can be sent through the BlockingChannel.
 */
public class BlockingChannel<E> implements Channel<E>, Iterable<E> {
  private final Storage<E> storage;
  private final Lock lock = new ReentrantLock();
  private final Condition stateChanged = lock.newCondition();

  // Guarded by lock. Only ever goes from true to false.
  private boolean isOpen = true;

  /**
   * @param storage An empty storage instance. The channel takes ownership of it, so callers must
   *        not retain a reference.
   */
  public BlockingChannel(Storage<E> storage) {
    this.storage = checkNotNull(storage);
  }

  //
  // Methods from ChannelEntrance
  //

  @Override
  public void close() {
    lock.lock();
    try {
      isOpen = false;
      stateChanged.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isClosed() {
    lock.lock();
    try {
      return !isOpen;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean put(@Nonnull E element) throws InterruptedException {
    checkNotNull(element, "Null elements are not allowed");
    lock.lockInterruptibly();
    try {
      while (isOpen && storage.isFull()) {
        stateChanged.await();
      }
      if (!isOpen) {
        // Closed before there was room: the element is dropped rather than stored.
        return false;
      }
      storage.pushBack(element);
      stateChanged.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  //
  // Methods from ChannelExit
  //

  @Override
  public Optional<E> take() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (isOpen && storage.isEmpty()) {
        stateChanged.await();
      }
      if (storage.isEmpty()) {
        // Closed and drained.
        return Optional.empty();
      }
      return Optional.of(popAndSignal());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<E> tryTakeNow() {
    boolean gotLock = lock.tryLock();
    if (!gotLock) {
      return Optional.empty();
    }
    try {
      if (storage.isEmpty()) {
        return Optional.empty();
      }
      return Optional.of(popAndSignal());
    } finally {
      lock.unlock();
    }
  }

  private E popAndSignal() {
    E element = storage.popFront();
    // A slot was freed, so any producer blocked on a full storage can proceed.
    stateChanged.signalAll();
    return element;
  }

  @Override
  public boolean isReadable() {
    lock.lock();
    try {
      return isOpen || !storage.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return The number of elements currently buffered in this channel.
   */
  public int size() {
    lock.lock();
    try {
      return storage.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * @return The maximum number of elements this channel can buffer, or {@link Storage#UNBOUNDED}.
   */
  public int capacity() {
    lock.lock();
    try {
      return storage.capacity();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns an iterator that takes elements from this channel until it is closed and drained. The
   * iteration consumes elements, so a second iterator only sees elements that the first one did not
   * take.
   *
   * @see Channels#asIterable(ChannelExit)
   */
  @Override
  public Iterator<E> iterator() {
    return Channels.asIterable(this).iterator();
  }
}
