package mincut.contract;

import java.util.Objects;
import mincut.core.DisjointSet;
import mincut.core.model.Edge;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;

/**
 * Working state of a partially contracted graph: the surviving edges (no self-loops once produced
 * by {@link Contraction}) and the disjoint-set lineage describing which original vertices have
 * been merged.
 *
 * <p>Endpoints are stored interleaved, edge {@code i} being {@code (endpoints[2i],
 * endpoints[2i + 1])}. Instances are owned by exactly one consumer; {@link Contraction} permutes
 * the endpoint array in place and never shares it with the graphs it produces.
 */
public final class ContractedGraph {
  private final int vertexCount;
  private final int[] endpoints;
  private final DisjointSet components;

  ContractedGraph(int vertexCount, int[] endpoints, DisjointSet components) {
    this.vertexCount = vertexCount;
    this.endpoints = endpoints;
    this.components = components;
  }

  /** Copies the edges of {@code graph} into a fresh working graph with singleton components. */
  public static ContractedGraph of(Graph graph) {
    Objects.requireNonNull(graph, "graph");
    int[] endpoints = new int[graph.edgeCount() * 2];
    int i = 0;
    for (Edge edge : graph.edges()) {
      endpoints[i++] = edge.tail();
      endpoints[i++] = edge.head();
    }
    return new ContractedGraph(
        graph.vertexCount(), endpoints, new DisjointSet(graph.vertexCount()));
  }

  /** Number of super-vertices left, equal to the disjoint-set's subset count. */
  public int vertexCount() {
    return vertexCount;
  }

  public int edgeCount() {
    return endpoints.length / 2;
  }

  int[] endpoints() {
    return endpoints;
  }

  DisjointSet components() {
    return components;
  }

  /**
   * Turns a graph contracted down to two super-vertices into a cut. Every remaining edge crosses
   * between the two.
   */
  public GraphCut toCut() {
    if (vertexCount != 2) {
      throw new IllegalStateException(
          "only a graph contracted to 2 vertices is a cut, this one has " + vertexCount);
    }
    return new GraphCut(edgeCount(), components);
  }

  @Override
  public String toString() {
    return "ContractedGraph{vertices=" + vertexCount + ", edges=" + edgeCount() + "}";
  }
}
