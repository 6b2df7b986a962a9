package mincut.algorithm;

import java.util.Objects;
import mincut.core.model.CutPartition;
import mincut.core.model.GraphCut;

/** Outcome of one repetition run: the best cut plus trial and timing bookkeeping. */
public record MinCutRun(
    MinCutAlgorithm algorithm,
    GraphCut bestCut,
    int repetitions,
    int trialsCompleted,
    int componentCount,
    long elapsedMillis,
    String terminationReason) {

  public MinCutRun {
    Objects.requireNonNull(algorithm, "algorithm");
    Objects.requireNonNull(bestCut, "bestCut");
    if (trialsCompleted < 1 || trialsCompleted > repetitions) {
      throw new IllegalArgumentException(
          "trialsCompleted must be in [1, " + repetitions + "], got " + trialsCompleted);
    }
  }

  public int cutSize() {
    return bestCut.size();
  }

  public CutPartition partitions() {
    return bestCut.partitions();
  }

  public boolean completed() {
    return terminationReason == null;
  }

  public boolean inputConnected() {
    return componentCount == 1;
  }
}
