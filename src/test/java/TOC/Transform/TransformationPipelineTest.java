package TOC.Transform;

import TOC.Finite.FiniteAutomaton;
import TOC.Finite.FiniteAutomatonEvaluator;
import TOC.Finite.FiniteAutomatonEvaluatorTest;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class TransformationPipelineTest {
  private final FiniteAutomatonEvaluator evaluator = new FiniteAutomatonEvaluator();

  @Test
  void testFiveStateExample() {
    FiniteAutomaton fa = FiniteAutomatonEvaluatorTest.fiveStateExample();
    PipelineResult result = new TransformationPipeline(true).run(fa);

    Assertions.assertTrue(result.unitNfa().isUnitLabelled());
    Assertions.assertTrue(result.dfa().isComplete());
    Assertions.assertEquals(4, result.minimalDfa().size()); // start, after a, after ab, dead
    assertSameLanguage(fa, result.minimalDfa(), 5);
  }

  @Test
  void testInputNotMutated() {
    FiniteAutomaton fa = FiniteAutomatonEvaluatorTest.fiveStateExample();
    String before = fa.toString();
    new TransformationPipeline().run(fa);
    Assertions.assertEquals(before, fa.toString());
  }

  @Test
  void testShortcuts() {
    FiniteAutomaton fa = FiniteAutomatonEvaluatorTest.fiveStateExample();
    TransformationPipeline pipeline = new TransformationPipeline();
    Assertions.assertEquals(pipeline.run(fa).dfa().toString(), pipeline.determinize(fa).toString());
    Assertions.assertEquals(pipeline.run(fa).minimalDfa().toString(), pipeline.minimize(fa).toString());
  }

  @Test
  void testRandomEpsilonAutomata() {
    TransformationPipeline pipeline = new TransformationPipeline(true);
    for (int seed = 0; seed < 40; seed++) {
      FiniteAutomaton fa = RandomFiniteAutomata.epsilonNFA(seed, 6);
      FiniteAutomaton minimal = pipeline.run(fa).minimalDfa();
      assertSameLanguage(fa, minimal, 5);
    }
  }

  private void assertSameLanguage(FiniteAutomaton expected, FiniteAutomaton actual, int maxLength) {
    for (String w : words(maxLength)) {
      Assertions.assertEquals(evaluator.accepts(expected, w), evaluator.accepts(actual, w), "word '" + w + "'");
    }
  }

  static List<String> words(int maxLength) {
    List<String> words = new ArrayList<>();
    words.add("");
    int from = 0;
    for (int len = 1; len <= maxLength; len++) {
      int to = words.size();
      for (int i = from; i < to; i++) {
        words.add(words.get(i) + "a");
        words.add(words.get(i) + "b");
      }
      from = to;
    }
    return words;
  }
}
