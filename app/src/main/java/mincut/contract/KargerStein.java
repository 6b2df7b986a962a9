package mincut.contract;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.random.RandomGenerator;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;

/**
 * Karger-Stein recursive contraction, run over an explicit work stack instead of the call stack.
 *
 * <p>Each popped working graph is either a leaf (at most {@value #BASE_CASE_VERTICES} vertices,
 * contracted straight to a cut) or a branch, contracted twice independently to {@link
 * #branchTarget(int)} vertices with both children pushed back. Every working graph is popped and
 * consumed exactly once.
 */
public final class KargerStein {
  /** Working graphs at or below this size are contracted straight down to two vertices. */
  public static final int BASE_CASE_VERTICES = 6;

  private static final double INV_SQRT_2 = 1.0 / Math.sqrt(2.0);

  private KargerStein() {}

  /** One top-level Karger-Stein run on a private copy of {@code graph}. */
  public static GraphCut run(Graph graph, RandomGenerator random) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(random, "random");

    GraphCut best = null;
    Deque<ContractedGraph> pending = new ArrayDeque<>();
    pending.push(ContractedGraph.of(graph));

    while (!pending.isEmpty()) {
      ContractedGraph current = pending.pop();
      int n = current.vertexCount();
      if (n <= BASE_CASE_VERTICES) {
        GraphCut leaf = Contraction.contract(current, 2, random).toCut();
        best = GraphCut.min(best, leaf);
      } else {
        int target = branchTarget(n);
        pending.push(Contraction.contract(current, target, random));
        pending.push(Contraction.contract(current, target, random));
      }
    }
    return best;
  }

  /** Size a branch contracts to: {@code 1 + ceil(n / sqrt(2))}. */
  public static int branchTarget(int n) {
    return 1 + (int) Math.ceil(n * INV_SQRT_2);
  }
}
