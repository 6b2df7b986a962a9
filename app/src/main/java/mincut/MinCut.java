package mincut;

import java.util.Objects;
import mincut.algorithm.MinCutAlgorithm;
import mincut.algorithm.MinCutDriver;
import mincut.algorithm.MinCutRun;
import mincut.core.MinCutOptions;
import mincut.core.model.CutPartition;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;

/** Entry points for computing a global minimum cut by randomized contraction. */
public final class MinCut {

  private MinCut() {}

  /** Best cut over {@code repeatCount} independent Karger trials. */
  public static GraphCut karger(Graph graph, int repeatCount) {
    return repeat(graph, MinCutAlgorithm.KARGER, repeatCount);
  }

  /** Best cut over {@code repeatCount} independent Karger-Stein runs. */
  public static GraphCut kargerStein(Graph graph, int repeatCount) {
    return repeat(graph, MinCutAlgorithm.KARGER_STEIN, repeatCount);
  }

  public static CutPartition partitions(GraphCut cut) {
    Objects.requireNonNull(cut, "cut");
    return cut.partitions();
  }

  /** Runs {@code algorithm} with full control over seeding, parallelism and time budget. */
  public static MinCutRun run(Graph graph, MinCutAlgorithm algorithm, MinCutOptions options) {
    return new MinCutDriver(options).run(graph, algorithm);
  }

  private static GraphCut repeat(Graph graph, MinCutAlgorithm algorithm, int repeatCount) {
    if (repeatCount < 1) {
      throw new IllegalArgumentException("repeatCount must be at least 1, got " + repeatCount);
    }
    return run(graph, algorithm, MinCutOptions.defaults().withRepeatCount(repeatCount)).bestCut();
  }
}
