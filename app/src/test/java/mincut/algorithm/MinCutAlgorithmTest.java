package mincut.algorithm;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;
import mincut.examples.Example;
import org.junit.jupiter.api.Test;

final class MinCutAlgorithmTest {

  @Test
  void defaultRepetitionsFollowTheAmplificationBounds() {
    assertEquals(58, MinCutAlgorithm.KARGER.defaultRepetitions(8));
    assertEquals(4, MinCutAlgorithm.KARGER_STEIN.defaultRepetitions(8));
    assertEquals(1, MinCutAlgorithm.KARGER.defaultRepetitions(2));
    assertEquals(1, MinCutAlgorithm.KARGER_STEIN.defaultRepetitions(2));
    assertEquals(21, MinCutAlgorithm.KARGER_STEIN.defaultRepetitions(100));
    assertEquals(Integer.MAX_VALUE, MinCutAlgorithm.KARGER.defaultRepetitions(100_000));
  }

  @Test
  void parsesNamesAndAliases() {
    assertEquals(MinCutAlgorithm.KARGER, MinCutAlgorithm.parse("Karger"));
    assertEquals(MinCutAlgorithm.KARGER_STEIN, MinCutAlgorithm.parse(" karger-stein "));
    assertEquals(MinCutAlgorithm.KARGER_STEIN, MinCutAlgorithm.parse("ks"));
    assertThrows(IllegalArgumentException.class, () -> MinCutAlgorithm.parse("stoer-wagner"));
  }

  @Test
  void eachVariantRunsOneTrial() {
    for (MinCutAlgorithm algorithm : MinCutAlgorithm.values()) {
      assertEquals(1, algorithm.runOnce(Example.singleEdge(), new Random(3)).size());
    }
  }
}
