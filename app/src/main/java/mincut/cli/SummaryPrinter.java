package mincut.cli;

import java.io.PrintStream;
import java.util.Objects;
import mincut.algorithm.MinCutRun;
import mincut.core.model.CutPartition;
import mincut.core.model.Graph;
import mincut.util.BitsetUtils;

/** Human readable run output. Vertex ids are printed 1-based, as in the input files. */
final class SummaryPrinter {
  private final PrintStream out;

  SummaryPrinter(PrintStream out) {
    this.out = Objects.requireNonNull(out, "out");
  }

  void printGraph(String label, Graph graph) {
    out.printf(
        "%nInput graph: \"%s\" (|V| = %d, |E| = %d)%n",
        label, graph.vertexCount(), graph.edgeCount());
  }

  void printRun(MinCutRun run, boolean printPartitions) {
    out.printf("%nAlgorithm: \"%s\"%n", run.algorithm().displayName());
    out.printf("    - Number of repetitions: %d%n", run.repetitions());
    if (!run.completed()) {
      out.printf(
          "    - Trials completed: %d (%s)%n", run.trialsCompleted(), run.terminationReason());
    }
    out.printf("    - Best minimum cut's size found: %d%n", run.cutSize());
    out.printf("    - Duration: %dms%n", run.elapsedMillis());
    if (printPartitions) {
      CutPartition partition = run.partitions();
      out.printf(
          "    - Partitions: %s %s%n",
          BitsetUtils.signature(partition.first(), run.bestCut().vertexCount(), 1),
          BitsetUtils.signature(partition.second(), run.bestCut().vertexCount(), 1));
    }
  }
}
