package com.pervasivecode.utils.channels.channel;

import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The output side of a channel, allowing callers to take elements from a channel until it is
 * closed and drained.
 *
 * @param <E> The type of object that can be taken from the channel.
 */
public interface ChannelExit<E> {
  /**
   * Block for an unlimited amount of time, taking the oldest element.
   * <p>
   * Elements that were in the channel when it was closed are still returned. Once the channel is
   * closed and empty, this returns Optional.empty() immediately, every time.
   *
   * @return An element, or Optional.empty() if the channel is closed and has no elements left.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  public @Nonnull Optional<E> take() throws InterruptedException;

  /**
   * Take an element if one is available immediately. This never waits: if another thread holds
   * the channel's lock, or there are no elements, Optional.empty() is returned.
   *
   * @return An immediately-available element, or Optional.empty() if none was available now.
   */
  public @Nonnull Optional<E> tryTakeNow();

  /**
   * Return true if a future call to {@link #take()} could still return an element: either the
   * channel is still open, or it is closed but still has elements in it.
   * <p>
   * A true value is not a guarantee, since other consumers may take the remaining elements first.
   *
   * @return Whether this channel may return elements in the future.
   */
  public boolean isReadable();

  /**
   * Return true if the channel has been closed and there are no remaining elements in it. This
   * means that this channel will never return an element again.
   *
   * @return Whether the channel is both closed and empty.
   */
  public default boolean isClosedAndEmpty() {
    return !isReadable();
  }
}
