package com.pervasivecode.utils.channels.channel;

/**
 * A channel is a closable FIFO conduit between producers of elements and consumers of elements of a
 * given type.
 * <p>
 * A channel provides put, take, and close operations. After being closed, a channel will not accept
 * new elements, but will allow consumers to take all of the remaining elements.
 *
 * @param <E> The type of object that can be sent through the channel.
 */
public interface Channel<E> extends ChannelEntrance<E>, ChannelExit<E> {
  // This interface is just composed of ChannelEntrance and ChannelExit.
}
