package mincut.algorithm;

import java.util.Locale;
import java.util.Objects;
import java.util.random.RandomGenerator;
import mincut.contract.Contraction;
import mincut.contract.KargerStein;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;

/** The randomized contraction variants, each exposing one trial and a default trial count. */
public enum MinCutAlgorithm {
  KARGER("Karger"),
  KARGER_STEIN("Karger-Stein");

  private final String displayName;

  MinCutAlgorithm(String displayName) {
    this.displayName = displayName;
  }

  public String displayName() {
    return displayName;
  }

  /** Runs a single independent trial on a private copy of {@code graph}. */
  public GraphCut runOnce(Graph graph, RandomGenerator random) {
    return switch (this) {
      case KARGER -> Contraction.karger(graph, random);
      case KARGER_STEIN -> KargerStein.run(graph, random);
    };
  }

  /**
   * Trial count giving a success probability of at least {@code 1 - 1/n}: {@code C(n,2) ln n}
   * for Karger, {@code ln² n} for Karger-Stein. Never less than one.
   */
  public int defaultRepetitions(int vertexCount) {
    double log = Math.log(vertexCount);
    double repetitions =
        switch (this) {
          case KARGER -> 0.5 * vertexCount * (vertexCount - 1) * log;
          case KARGER_STEIN -> log * log;
        };
    if (repetitions >= Integer.MAX_VALUE) {
      return Integer.MAX_VALUE;
    }
    return Math.max(1, (int) repetitions);
  }

  public static MinCutAlgorithm parse(String raw) {
    Objects.requireNonNull(raw, "raw");
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "karger", "k" -> KARGER;
      case "karger-stein", "karger_stein", "kargerstein", "ks" -> KARGER_STEIN;
      default -> throw new IllegalArgumentException("Unknown algorithm: " + raw);
    };
  }
}
