package TOC.Turing;

import TOC.Model.Symbol;
import TOC.Model.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class MultiTapeTuringMachineTest {
  private static final Symbol ONE = Symbol.of("1");
  private static final Symbol B = Symbol.BLANK;

  static TuringMachineDefinition unaryCopy() {
    return TuringMachineDefinition.builder(2)
        .state("e0", "ef")
        .start("e0")
        .accept("ef")
        .transition("e0", List.of(ONE, B), List.of(Action.move(Move.RIGHT), Action.write(ONE, Move.RIGHT)), "e0")
        .transition("e0", List.of(B, B), List.of(Action.stay(), Action.stay()), "ef")
        .build();
  }

  static List<List<Symbol>> fiveOnes() {
    return List.of(Collections.nCopies(5, ONE), List.of());
  }

  @Test
  void testUnaryCopy() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    StepResult result = null;
    for (int i = 0; i < 5; i++) {
      result = tm.step();
      Assertions.assertEquals(StepStatus.RUNNING, result.status());
    }
    result = tm.step();
    Assertions.assertEquals(StepStatus.ACCEPT, result.status());
    Assertions.assertTrue(result.isAccepted());
    Assertions.assertEquals("ef", tm.getCurrentState());
    Assertions.assertEquals(6, tm.getStepCount());
    Assertions.assertEquals(Collections.nCopies(5, ONE), tm.getTapeContents(1));
    Assertions.assertEquals(Collections.nCopies(5, ONE), tm.getTapeContents(0)); // input untouched
    Assertions.assertEquals(5, tm.getHead(0));
    Assertions.assertEquals(5, tm.getHead(1));
    Assertions.assertNotNull(tm.getLastTransition());
    Assertions.assertEquals("ef", tm.getLastTransition().nextState());
  }

  @Test
  void testHaltedStepIsIdempotent() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    tm.run(100);
    Assertions.assertTrue(tm.isHalted());

    StepResult first = tm.step();
    Assertions.assertEquals(StepStatus.HALTED, first.status());
    Assertions.assertEquals(HaltReason.ACCEPTED, first.haltReason());
    for (int i = 0; i < 3; i++) {
      Assertions.assertEquals(first, tm.step());
    }
    Assertions.assertEquals(6, tm.getStepCount());
    Assertions.assertEquals(5, tm.getHead(1));
    Assertions.assertEquals(Collections.nCopies(5, ONE), tm.getTapeContents(1));
  }

  @Test
  void testAcceptCheckedBeforeTransitions() {
    TuringMachineDefinition def = TuringMachineDefinition.builder(1)
        .state("a")
        .start("a")
        .accept("a")
        .transition("a", List.of(ONE), List.of(Action.write(B, Move.RIGHT)), "a")
        .build();
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(def, List.of(List.of(ONE)));
    StepResult result = tm.step();
    Assertions.assertEquals(StepStatus.ACCEPT, result.status());
    Assertions.assertEquals(0, result.stepCount());
    Assertions.assertEquals(ONE, tm.read(0)); // transition never fired
  }

  @Test
  void testNoApplicableTransition() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), List.of(List.of(Symbol.of("x")), List.of()));
    StepResult result = tm.step();
    Assertions.assertEquals(StepStatus.HALTED, result.status());
    Assertions.assertEquals(HaltReason.NO_TRANSITION, result.haltReason());
    Assertions.assertNull(tm.getLastTransition());
    Assertions.assertEquals(0, tm.getStepCount());

    StepResult again = tm.step();
    Assertions.assertEquals(StepStatus.HALTED, again.status());
    Assertions.assertEquals(HaltReason.NO_TRANSITION.description(), again.message());
  }

  @Test
  void testResetReplaysDeterministically() {
    MultiTapeTuringMachine tm1 = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    MultiTapeTuringMachine tm2 = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    List<StepResult> trace1 = trace(tm1);
    Assertions.assertEquals(trace1, trace(tm2));

    tm1.reset();
    Assertions.assertFalse(tm1.isHalted());
    Assertions.assertEquals(HaltReason.NONE, tm1.getHaltReason());
    Assertions.assertEquals(0, tm1.getStepCount());
    Assertions.assertEquals("e0", tm1.getCurrentState());
    Assertions.assertNull(tm1.getLastTransition());
    Assertions.assertTrue(tm1.getTapeContents(1).isEmpty());
    Assertions.assertEquals(trace1, trace(tm1));
  }

  @Test
  void testResetWithNewTapes() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    tm.reset(List.of(List.of(ONE, ONE), List.of()));
    StepResult result = tm.run(100);
    Assertions.assertTrue(result.isAccepted());
    Assertions.assertEquals(List.of(ONE, ONE), tm.getTapeContents(1));

    Assertions.assertThrows(ValidationException.class, () -> tm.reset(List.of(List.of(ONE))));
    Assertions.assertThrows(ValidationException.class, () -> tm.reset(List.of(List.of(Symbol.EPSILON), List.of())));
    // failed resets leave the machine alone
    Assertions.assertEquals(List.of(ONE, ONE), tm.getTapeContents(1));
  }

  @Test
  void testLeftMovesAndErase() {
    Symbol x = Symbol.of("x");
    TuringMachineDefinition def = TuringMachineDefinition.builder(1)
        .state("s", "t", "f")
        .start("s")
        .accept("f")
        .transition("s", List.of(x), List.of(Action.write(B, Move.LEFT)), "t")
        .transition("t", List.of(B), List.of(Action.write(x, Move.LEFT)), "f")
        .build();
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(def, List.of(List.of(x)));
    StepResult result = tm.run(10);
    Assertions.assertTrue(result.isAccepted());
    Assertions.assertEquals(-2, tm.getHead(0));
    Assertions.assertEquals(List.of(x), tm.getTapeContents(0));
    Assertions.assertEquals(x, tm.window(0, 1).cells().get(2)); // position -1
    Assertions.assertEquals(B, tm.window(0, 1).underHead());
  }

  @Test
  void testReadWriteAtHead() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes());
    Assertions.assertEquals(ONE, tm.read(0));
    Assertions.assertEquals(B, tm.read(1));
    tm.write(1, Symbol.of("z"));
    Assertions.assertEquals(Symbol.of("z"), tm.read(1));
    tm.write(1, B);
    Assertions.assertTrue(tm.getTapeContents(1).isEmpty());
  }

  @Test
  void testStepResultWindows() {
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes(), 2);
    StepResult result = tm.step();
    Assertions.assertEquals(2, result.tapes().size());
    TapeWindow second = result.tapes().get(1);
    Assertions.assertEquals(1, second.head());
    Assertions.assertEquals(-1, second.from());
    Assertions.assertEquals(List.of(B, ONE, B, B, B), second.cells());
  }

  @Test
  void testWindowRadius() {
    Assertions.assertThrows(ValidationException.class, () -> new MultiTapeTuringMachine(unaryCopy(), fiveOnes(), -1));

    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(unaryCopy(), fiveOnes(), 0);
    TapeWindow first = tm.step().tapes().get(0);
    Assertions.assertEquals(1, first.cells().size());
    Assertions.assertEquals(ONE, first.underHead());
    Assertions.assertThrows(ValidationException.class, () -> tm.window(0, -3));
  }

  @Test
  void testRunStopsAtBound() {
    TuringMachineDefinition loop = TuringMachineDefinition.builder(1)
        .state("s")
        .start("s")
        .transition("s", List.of(B), List.of(Action.move(Move.RIGHT)), "s")
        .build();
    MultiTapeTuringMachine tm = new MultiTapeTuringMachine(loop, List.of(List.of()));
    StepResult result = tm.run(50);
    Assertions.assertEquals(StepStatus.RUNNING, result.status());
    Assertions.assertEquals(50, tm.getStepCount());
    Assertions.assertFalse(tm.isHalted());
  }

  @Test
  void testValidation() {
    TuringMachineDefinition.Builder dup = TuringMachineDefinition.builder(1)
        .state("s")
        .start("s")
        .transition("s", List.of(ONE), List.of(Action.stay()), "s");
    Assertions.assertThrows(ValidationException.class,
        () -> dup.transition("s", List.of(ONE), List.of(Action.move(Move.RIGHT)), "s"));

    Assertions.assertThrows(ValidationException.class, () -> TuringMachineDefinition.builder(1)
        .state("s").start("s")
        .transition("s", List.of(ONE), List.of(Action.stay()), "nowhere")
        .build());

    Assertions.assertThrows(ValidationException.class, () -> TuringMachineDefinition.builder(2)
        .state("s").start("s")
        .transition("s", List.of(ONE), List.of(Action.stay(), Action.stay()), "s"));

    Assertions.assertThrows(ValidationException.class, () -> TuringMachineDefinition.builder(1)
        .state("s").start("s")
        .transition("s", List.of(Symbol.EPSILON), List.of(Action.stay()), "s"));

    Assertions.assertThrows(ValidationException.class, () -> TuringMachineDefinition.builder(1).state("s").build());
    Assertions.assertThrows(ValidationException.class, () -> TuringMachineDefinition.builder(0));
    Assertions.assertThrows(ValidationException.class, () -> Action.write(Symbol.EPSILON, Move.STAY));
  }

  private static List<StepResult> trace(MultiTapeTuringMachine tm) {
    List<StepResult> results = new ArrayList<>();
    StepResult r;
    do {
      r = tm.step();
      results.add(r);
    } while (r.isRunning());
    return results;
  }
}
