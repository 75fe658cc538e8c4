package com.github.pdasimulator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class PushdownStackTest {

  @Test
  public void testLifo() {
    final PushdownStack stack = new PushdownStack();
    assertTrue(stack.isEmpty());
    stack.push("$");
    stack.push("A");
    stack.push("B");
    assertEquals(3, stack.size());
    assertEquals("B", stack.peek().get());
    assertEquals("B", stack.pop().get());
    assertEquals("A", stack.pop().get());
    assertEquals(1, stack.size());
    assertTrue(stack.contains("$"));
    assertFalse(stack.contains("A"));
  }

  @Test
  public void testEmptyStackReportsNothing() {
    final PushdownStack stack = new PushdownStack();
    assertFalse(stack.pop().isPresent());
    assertFalse(stack.peek().isPresent());
    assertEquals(0, stack.size());
  }

  @Test
  public void testSnapshotIsBottomToTopAndDetached() {
    final PushdownStack stack = new PushdownStack();
    stack.push("$");
    stack.push("X");
    final List<String> snapshot = stack.snapshot();
    assertEquals(Arrays.asList("$", "X"), snapshot);
    stack.push("Y");
    assertEquals(2, snapshot.size());
    try {
      snapshot.add("Z");
      fail("snapshot must be read-only");
    } catch (UnsupportedOperationException expected) {
      assertEquals(3, stack.size());
    }

    stack.reset();
    assertTrue(stack.isEmpty());
    assertTrue(stack.snapshot().isEmpty());
  }

}
