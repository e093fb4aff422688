package com.pervasivecode.utils.channels.storage;

import static com.google.common.truth.Truth.assertThat;
import org.junit.Test;

public class LinkedListStorageTest {

  @Test
  public void defaultConstructor_shouldBeUnbounded() {
    Storage<Integer> s = new LinkedListStorage<>();
    assertThat(s.capacity()).isEqualTo(Storage.UNBOUNDED);
    for (int i = 0; i < 10_000; i++) {
      s.pushBack(i);
    }
    assertThat(s.size()).isEqualTo(10_000);
    assertThat(s.isFull()).isFalse();
  }

  @Test(expected = IllegalArgumentException.class)
  public void constructor_shouldRejectZeroCapacity() {
    new LinkedListStorage<String>(0);
  }

  @Test(expected = IllegalStateException.class)
  public void pushBack_beyondBound_shouldThrow() {
    Storage<String> s = new LinkedListStorage<>(1);
    s.pushBack("a");
    s.pushBack("b");
  }

  @Test(expected = IllegalStateException.class)
  public void popFront_whenEmpty_shouldThrow() {
    new LinkedListStorage<String>().popFront();
  }

  @Test
  public void popFront_shouldReturnElementsInFifoOrder() {
    Storage<String> s = new LinkedListStorage<>();
    s.pushBack("a");
    s.pushBack("b");
    s.pushBack("c");
    assertThat(s.popFront()).isEqualTo("a");
    assertThat(s.popFront()).isEqualTo("b");
    assertThat(s.popFront()).isEqualTo("c");
    assertThat(s.isEmpty()).isTrue();
  }
}
