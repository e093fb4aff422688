package com.pervasivecode.utils.channels.storage;

/** The storage strategies available for backing a channel. */
public enum StorageKind {
  /** A fixed-capacity circular array. Requires a positive capacity. */
  RING_BUFFER,

  /** A linked list, unbounded unless given a positive capacity. */
  LINKED_LIST
}
