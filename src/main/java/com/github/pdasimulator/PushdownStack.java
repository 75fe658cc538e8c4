package com.github.pdasimulator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Stack;

/**
 * The pushdown memory of a simulation run: a LIFO sequence of symbols. The bottom marker is not
 * special here, callers decide when to insert it.
 *
 * Popping or peeking an empty stack is not an error, both simply report an empty Optional. Guard
 * discipline lives with the caller.
 *
 * Not thread-safe on its own, the owning simulator serializes access.
 */
public final class PushdownStack {
  private final Stack<String> symbols = new Stack<>();

  /**
   * Drop all symbols.
   */
  public void reset() {
    symbols.clear();
  }

  public void push(final String symbol) {
    symbols.push(symbol);
  }

  public Optional<String> pop() {
    if (symbols.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(symbols.pop());
  }

  public Optional<String> peek() {
    if (symbols.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(symbols.peek());
  }

  public boolean isEmpty() {
    return symbols.isEmpty();
  }

  public int size() {
    return symbols.size();
  }

  public boolean contains(final String symbol) {
    return symbols.contains(symbol);
  }

  /**
   * Read-only copy of the contents ordered bottom-to-top, i.e. the last element is the top.
   */
  public List<String> snapshot() {
    return Collections.unmodifiableList(new ArrayList<>(symbols));
  }

  @Override
  public String toString() {
    return symbols.toString();
  }
}
