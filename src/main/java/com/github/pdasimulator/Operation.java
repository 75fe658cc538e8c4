package com.github.pdasimulator;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import com.github.pdasimulator.PdaSimulatorException.Code;

/**
 * One guarded stack/input action attached to a {@link Transition}.
 *
 * The guard is made of {@link #getInputTopSymbol()} (the input symbol required, or
 * {@link Symbols#EPSILON} to consume nothing) and {@link #getStackPopSymbol()} (the symbol required
 * on top of the stack, or {@link Symbols#EPSILON} to pop nothing). The action pushes
 * {@link #getStackPushSymbol()}, which may be several symbols pushed left to right, or
 * {@link Symbols#EPSILON} to push nothing.
 */
public final class Operation {
  private final String id = UUID.randomUUID().toString();
  private final String inputTopSymbol;
  private final String stackPopSymbol;
  private final String stackPushSymbol;

  public Operation(final String inputTopSymbol, final String stackPopSymbol,
      final String stackPushSymbol) throws PdaSimulatorException {
    if (!Symbols.isSingleSymbol(inputTopSymbol)) {
      throw new PdaSimulatorException(Code.INVALID_OPERATION,
          "Input symbol must be exactly one symbol or " + Symbols.EPSILON + ": " + inputTopSymbol);
    }
    if (!Symbols.isSingleSymbol(stackPopSymbol)) {
      throw new PdaSimulatorException(Code.INVALID_OPERATION,
          "Pop symbol must be exactly one symbol or " + Symbols.EPSILON + ": " + stackPopSymbol);
    }
    if (stackPushSymbol == null || stackPushSymbol.isEmpty()) {
      throw new PdaSimulatorException(Code.INVALID_OPERATION);
    }
    this.inputTopSymbol = inputTopSymbol;
    this.stackPopSymbol = stackPopSymbol;
    this.stackPushSymbol = stackPushSymbol;
  }

  public String getId() {
    return id;
  }

  public String getInputTopSymbol() {
    return inputTopSymbol;
  }

  public String getStackPopSymbol() {
    return stackPopSymbol;
  }

  public String getStackPushSymbol() {
    return stackPushSymbol;
  }

  public boolean consumesInput() {
    return !Symbols.isEpsilon(inputTopSymbol);
  }

  /**
   * Symbols to push in order, empty for an epsilon push.
   */
  public List<String> pushSymbols() {
    if (Symbols.isEpsilon(stackPushSymbol)) {
      return Collections.emptyList();
    }
    return Symbols.split(stackPushSymbol);
  }

  @Override
  public String toString() {
    return "Operation [" + inputTopSymbol + ", " + stackPopSymbol + " / " + stackPushSymbol + "]";
  }
}
