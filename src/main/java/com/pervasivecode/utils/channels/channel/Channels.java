package com.pervasivecode.utils.channels.channel;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;
import com.pervasivecode.utils.channels.storage.LinkedListStorage;
import com.pervasivecode.utils.channels.storage.RingBufferStorage;
import com.pervasivecode.utils.channels.storage.StorageKind;
import com.pervasivecode.utils.channels.storage.Storages;

public class Channels {
  private Channels() {}

  /**
   * Create a channel that holds at most {@code capacity} elements in a ring buffer.
   *
   * @param capacity The maximum number of buffered elements. Must be positive.
   * @return A new open channel.
   */
  public static <E> BlockingChannel<E> bounded(int capacity) {
    return new BlockingChannel<>(new RingBufferStorage<>(capacity));
  }

  /**
   * Create a channel backed by an unbounded linked list, so that {@link ChannelEntrance#put} never
   * blocks.
   *
   * @return A new open channel.
   */
  public static <E> BlockingChannel<E> unbounded() {
    return new BlockingChannel<>(new LinkedListStorage<>());
  }

  /**
   * Create a channel using the specified storage strategy.
   *
   * @param kind The storage strategy.
   * @param capacity The maximum number of buffered elements, or 0 for unbounded (only valid for
   *        {@link StorageKind#LINKED_LIST}).
   * @return A new open channel.
   */
  public static <E> BlockingChannel<E> create(StorageKind kind, int capacity) {
    return new BlockingChannel<>(Storages.<E>create(kind, capacity));
  }

  private static class ChannelIterator<T> implements Iterator<T> {
    private boolean exhausted = false;
    private final ChannelExit<T> source;
    private Optional<T> buffer;

    public ChannelIterator(ChannelExit<T> source) {
      this.source = checkNotNull(source);
      this.buffer = Optional.empty();
    }

    private void maybeFillBuffer() {
      if (buffer.isPresent() || exhausted) {
        return;
      }
      try {
        buffer = source.take();
        if (!buffer.isPresent()) {
          exhausted = true;
        }
      } catch (@SuppressWarnings("unused") InterruptedException e) {
        // Stop iterating, but let the caller see that it was interrupted.
        exhausted = true;
        Thread.currentThread().interrupt();
      }
    }

    @Override
    public boolean hasNext() {
      maybeFillBuffer();
      return buffer.isPresent();
    }

    @Override
    public T next() {
      maybeFillBuffer();
      if (!buffer.isPresent()) {
        throw new NoSuchElementException("The channel is closed and has no more elements.");
      }
      T bufferedElement = buffer.get();
      buffer = Optional.empty();
      return bufferedElement;
    }
  }


  private static class ChannelIterableAdapter<T> implements Iterable<T> {
    private final ChannelExit<T> source;

    public ChannelIterableAdapter(ChannelExit<T> source) {
      this.source = checkNotNull(source);
    }

    @Override
    public Iterator<T> iterator() {
      return new ChannelIterator<>(source);
    }
  }


  /**
   * View a ChannelExit as a lazy, finite sequence. Each step of iteration blocks in
   * {@link ChannelExit#take()} until an element arrives, and iteration ends when the channel is
   * closed and drained (or when the iterating thread is interrupted).
   * <p>
   * Iteration consumes the channel's elements, so an exhausted sequence cannot be restarted.
   * Abandoning an iterator part-way leaves the remaining elements in the channel.
   *
   * @param source The channel to take elements from.
   * @return An Iterable whose iterators take elements from the source.
   */
  public static <T> Iterable<T> asIterable(ChannelExit<T> source) {
    return new ChannelIterableAdapter<>(source);
  }
}
