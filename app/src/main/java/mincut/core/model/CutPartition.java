package mincut.core.model;

import java.util.BitSet;
import java.util.List;
import java.util.Objects;
import mincut.util.BitsetUtils;

/**
 * The two vertex sets on either side of a cut.
 *
 * <p>{@code first} always holds vertex 0. Both sides are non-empty, disjoint and together cover
 * {@code [0, vertexCount)}.
 */
public record CutPartition(BitSet first, BitSet second, int vertexCount) {

  public CutPartition {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
    if (first.isEmpty() || second.isEmpty()) {
      throw new IllegalArgumentException("both sides of a cut must be non-empty");
    }
    if (first.intersects(second)) {
      throw new IllegalArgumentException("cut sides overlap");
    }
    if (first.cardinality() + second.cardinality() != vertexCount) {
      throw new IllegalArgumentException("cut sides do not cover all " + vertexCount + " vertices");
    }
    first = (BitSet) first.clone();
    second = (BitSet) second.clone();
  }

  @Override
  public BitSet first() {
    return (BitSet) first.clone();
  }

  @Override
  public BitSet second() {
    return (BitSet) second.clone();
  }

  public List<Integer> firstVertices() {
    return BitsetUtils.toIndexList(first);
  }

  public List<Integer> secondVertices() {
    return BitsetUtils.toIndexList(second);
  }

  /** Returns the side containing {@code vertex}. */
  public BitSet sideOf(int vertex) {
    Objects.checkIndex(vertex, vertexCount);
    return first.get(vertex) ? first() : second();
  }

  /** Counts the edges of {@code graph} with one endpoint on each side. */
  public int crossingEdges(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    int crossing = 0;
    for (Edge edge : graph.edges()) {
      if (first.get(edge.tail()) != first.get(edge.head())) {
        crossing++;
      }
    }
    return crossing;
  }

  @Override
  public String toString() {
    return BitsetUtils.signature(first, vertexCount)
        + " | "
        + BitsetUtils.signature(second, vertexCount);
  }
}
