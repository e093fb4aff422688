package com.pervasivecode.utils.channels.storage;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.fail;
import org.junit.Test;

public class RingBufferStorageTest {

  @Test(expected = IllegalArgumentException.class)
  public void constructor_shouldRejectZeroCapacity() {
    new RingBufferStorage<String>(0);
  }

  @Test
  public void newStorage_shouldBeEmpty() {
    Storage<String> s = new RingBufferStorage<>(3);
    assertThat(s.size()).isEqualTo(0);
    assertThat(s.capacity()).isEqualTo(3);
    assertThat(s.isEmpty()).isTrue();
    assertThat(s.isFull()).isFalse();
  }

  @Test
  public void pushBack_untilFull_shouldReportFull() {
    Storage<String> s = new RingBufferStorage<>(2);
    s.pushBack("a");
    assertThat(s.isFull()).isFalse();
    s.pushBack("b");
    assertThat(s.isFull()).isTrue();
    assertThat(s.size()).isEqualTo(2);
  }

  @Test
  public void pushBack_whenFull_shouldThrowAndKeepContents() {
    Storage<String> s = new RingBufferStorage<>(1);
    s.pushBack("a");
    try {
      s.pushBack("b");
      fail("Expected IllegalStateException.");
    } catch (@SuppressWarnings("unused") IllegalStateException ise) {
      // expected
    }
    assertThat(s.size()).isEqualTo(1);
    assertThat(s.popFront()).isEqualTo("a");
  }

  @Test(expected = NullPointerException.class)
  public void pushBack_withNull_shouldThrow() {
    new RingBufferStorage<String>(1).pushBack(null);
  }

  @Test(expected = IllegalStateException.class)
  public void popFront_whenEmpty_shouldThrow() {
    new RingBufferStorage<String>(1).popFront();
  }

  @Test
  public void popFront_afterWrappingAround_shouldKeepFifoOrder() {
    Storage<Integer> s = new RingBufferStorage<>(3);
    int nextIn = 0;
    int nextOut = 0;
    // Interleave pushes and pops so that the buffer wraps around several times.
    for (int round = 0; round < 10; round++) {
      s.pushBack(nextIn++);
      s.pushBack(nextIn++);
      assertThat(s.popFront()).isEqualTo(nextOut++);
      s.pushBack(nextIn++);
      assertThat(s.popFront()).isEqualTo(nextOut++);
      assertThat(s.popFront()).isEqualTo(nextOut++);
      assertThat(s.isEmpty()).isTrue();
    }
  }

  @Test
  public void popFront_fromFullStorage_shouldFreeExactlyOneSlot() {
    Storage<String> s = new RingBufferStorage<>(2);
    s.pushBack("a");
    s.pushBack("b");
    assertThat(s.popFront()).isEqualTo("a");
    assertThat(s.isFull()).isFalse();
    s.pushBack("c");
    assertThat(s.isFull()).isTrue();
    assertThat(s.capacity()).isEqualTo(2);
    assertThat(s.popFront()).isEqualTo("b");
    assertThat(s.popFront()).isEqualTo("c");
    assertThat(s.isEmpty()).isTrue();
  }
}
