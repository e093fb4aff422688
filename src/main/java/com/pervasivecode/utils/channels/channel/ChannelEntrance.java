package com.pervasivecode.utils.channels.channel;

import javax.annotation.Nonnull;

/**
 * The input side of a channel, allowing callers to put elements into the channel, or to close the
 * channel so that no more elements can be put into it.
 *
 * @param <E> The type of object that can be put into the channel.
 */
public interface ChannelEntrance<E> {
  /**
   * Close the entrance of the channel. After this has been called, no more elements will be
   * accepted, but any elements that have not yet been taken from the corresponding
   * {@link ChannelExit} will still be available.
   * <p>
   * Closing wakes every thread blocked in {@link #put} or {@link ChannelExit#take()}. Closing an
   * already-closed channel has no effect.
   */
  public void close();

  /**
   * Returns true if the entrance to the channel has been closed. This does not necessarily mean
   * that all of the elements that were put into the channel have been removed yet, though.
   *
   * @see ChannelExit#isReadable() for a method that also accounts for elements that have not been
   *      taken yet.
   * @return whether the ChannelEntrance has been closed.
   */
  public boolean isClosed();

  /**
   * Put an element into the channel, blocking as long as the channel is open and full.
   * <p>
   * If the channel is closed before the element could be stored (including while this call was
   * blocked waiting for space), the element is dropped and this method returns false. It never
   * throws because of closing, and never blocks on a closed channel.
   *
   * @param element An element to put in the channel.
   * @return true if the element was stored, or false if it was dropped because the channel is
   *         closed.
   * @throws InterruptedException if the blocked thread is interrupted.
   */
  public boolean put(@Nonnull E element) throws InterruptedException;
}
