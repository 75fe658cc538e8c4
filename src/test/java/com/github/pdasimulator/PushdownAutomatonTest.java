package com.github.pdasimulator;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.junit.Test;

import com.github.pdasimulator.PdaSimulatorException.Code;
import com.github.pdasimulator.PushdownAutomaton.PushdownAutomatonBuilder;

/**
 * Tests for building and validating automaton definitions.
 */
public class PushdownAutomatonTest {

  @Test
  public void testDefinitionKeepsDeclaredOrder() throws PdaSimulatorException {
    final State q0 = new State("q0", true, false);
    final State q1 = new State(" q1 ", false, true);
    final Transition loop = new Transition(q0, q0, new Operation("a", Symbols.EPSILON, "A"));
    final Transition across = new Transition(q0, q1, new Operation("b", "A", Symbols.EPSILON));
    final Transition back = new Transition(q1, q0, new Operation("c", Symbols.EPSILON, "C"));
    final PushdownAutomaton automaton = PushdownAutomatonBuilder.newBuilder().states(q0, q1)
        .transition(loop).transition(back).transition(across).word("aab").build();

    assertEquals("q1", q1.getName());
    assertEquals(Arrays.asList(q0, q1), automaton.getStates());
    assertEquals(Arrays.asList(loop, across), automaton.transitionsFrom(q0));
    assertEquals(Arrays.asList(back), automaton.transitionsFrom(q1));
    assertEquals(Arrays.asList("a", "a", "b"), automaton.getWordSymbols());
    assertEquals(3, automaton.getWordLength());
    assertEquals(q0, automaton.findStartState().get());

    final PushdownAutomaton rerun = automaton.withWord("ab");
    assertEquals("ab", rerun.getWord());
    assertEquals(automaton.getTransitions(), rerun.getTransitions());
    assertEquals("aab", automaton.getWord());
  }

  @Test
  public void testEmptyAndMissingWord() throws PdaSimulatorException {
    final State q0 = new State("q0", false, false);
    final PushdownAutomaton automaton = PushdownAutomatonBuilder.newBuilder().state(q0)
        .word(null).build();
    assertEquals("", automaton.getWord());
    assertTrue(automaton.getWordSymbols().isEmpty());
    assertFalse(automaton.findStartState().isPresent());
  }

  @Test
  public void testMultiCodeUnitSymbols() throws PdaSimulatorException {
    final PushdownAutomaton automaton = PushdownAutomatonBuilder.newBuilder()
        .state(new State("q0", true, false)).word("a😀b").build();
    assertEquals(3, automaton.getWordLength());
    assertEquals("😀", automaton.getWordSymbols().get(1));
  }

  @Test
  public void testValidation() throws PdaSimulatorException {
    final State q0 = new State("q0", true, false);
    final State stranger = new State("stranger", false, false);

    assertCode(Code.INVALID_AUTOMATON, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        PushdownAutomatonBuilder.newBuilder().word("a").build();
      }
    });
    assertCode(Code.ILLEGAL_TRANSITION, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        PushdownAutomatonBuilder.newBuilder().state(q0)
            .transition(new Transition(q0, stranger, new Operation("a", "A", "B"))).build();
      }
    });
    assertCode(Code.INVALID_STATE, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new Transition(q0, null, new Operation("a", "A", "B"));
      }
    });
    assertCode(Code.INVALID_STATE_NAME, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new State("a-state-name-way-beyond-twenty", false, false);
      }
    });
    assertCode(Code.INVALID_STATE_NAME, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new State("  ", false, false);
      }
    });
    assertCode(Code.INVALID_OPERATION, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new Operation("ab", Symbols.EPSILON, Symbols.EPSILON);
      }
    });
    assertCode(Code.INVALID_OPERATION, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new Operation("a", null, Symbols.EPSILON);
      }
    });
    assertCode(Code.INVALID_OPERATION, new Definition() {
      @Override
      public void define() throws PdaSimulatorException {
        new Operation("a", Symbols.EPSILON, "");
      }
    });
  }

  @Test
  public void testOperationPushSymbols() throws PdaSimulatorException {
    assertTrue(new Operation("a", "A", Symbols.EPSILON).pushSymbols().isEmpty());
    assertEquals(Arrays.asList("X", "Y", "Z"), new Operation("a", "A", "XYZ").pushSymbols());
    assertTrue(new Operation("a", "A", "B").consumesInput());
    assertFalse(new Operation(Symbols.EPSILON, "A", "B").consumesInput());
  }

  private static void assertCode(final Code expected, final Definition definition) {
    try {
      definition.define();
      fail("expected " + expected);
    } catch (PdaSimulatorException problem) {
      assertEquals(expected, problem.getCode());
    }
  }

  private interface Definition {
    void define() throws PdaSimulatorException;
  }

}
