package mincut.core.model;

import java.util.BitSet;
import java.util.Objects;
import mincut.core.DisjointSet;

/**
 * A cut found by contraction: the number of crossing edges plus the disjoint-set state at the
 * moment the contraction converged.
 *
 * <p>Cuts order by size only. The vertex sides are not stored; {@link #partitions()} rebuilds
 * them from the disjoint-set when asked, which is rare compared to the number of trials.
 */
public final class GraphCut implements Comparable<GraphCut> {
  private final int size;
  private final DisjointSet components;

  public GraphCut(int size, DisjointSet components) {
    if (size < 0) {
      throw new IllegalArgumentException("cut size must be non-negative: " + size);
    }
    this.size = size;
    this.components = Objects.requireNonNull(components, "components");
  }

  public int size() {
    return size;
  }

  public int vertexCount() {
    return components.size();
  }

  /** True once the underlying disjoint-set holds exactly two subsets. */
  public boolean isConverged() {
    return components.subsetCount() == 2;
  }

  /** Returns a copy of the disjoint-set this cut was taken from. */
  public DisjointSet components() {
    return new DisjointSet(components);
  }

  /**
   * Splits the vertices by whether they share vertex 0's representative.
   *
   * @throws IllegalStateException if the contraction did not end with exactly two subsets
   */
  public CutPartition partitions() {
    if (!isConverged()) {
      throw new IllegalStateException(
          "partitions need a disjoint-set with exactly 2 subsets, found "
              + components.subsetCount());
    }
    DisjointSet snapshot = new DisjointSet(components);
    int n = snapshot.size();
    int anchor = snapshot.find(0);
    BitSet first = new BitSet(n);
    BitSet second = new BitSet(n);
    for (int vertex = 0; vertex < n; vertex++) {
      if (snapshot.find(vertex) == anchor) {
        first.set(vertex);
      } else {
        second.set(vertex);
      }
    }
    return new CutPartition(first, second, n);
  }

  /** Returns whichever of the two cuts is smaller, preferring {@code a} on ties. */
  public static GraphCut min(GraphCut a, GraphCut b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    return b.size < a.size ? b : a;
  }

  @Override
  public int compareTo(GraphCut other) {
    return Integer.compare(size, other.size);
  }

  @Override
  public String toString() {
    return "GraphCut{size=" + size + ", vertices=" + components.size() + "}";
  }
}
