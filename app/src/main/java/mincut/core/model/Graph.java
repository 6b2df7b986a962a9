package mincut.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import mincut.core.DisjointSet;

/**
 * Undirected multigraph given as a vertex count and an edge list.
 *
 * <p>Vertices are the ids {@code [0, vertexCount())}. The edge list is immutable; contraction
 * algorithms copy the endpoints into their own working arrays instead of reordering it.
 */
public final class Graph {
  private final int vertexCount;
  private final List<Edge> edges;

  public Graph(int vertexCount, List<Edge> edges) {
    Objects.requireNonNull(edges, "edges");
    if (vertexCount < 2) {
      throw new IllegalArgumentException("graph needs at least 2 vertices, got " + vertexCount);
    }
    for (Edge edge : edges) {
      Objects.requireNonNull(edge, "edge");
      if (edge.tail() >= vertexCount || edge.head() >= vertexCount) {
        throw new IllegalArgumentException(
            "edge " + edge + " references a vertex outside [0, " + vertexCount + ")");
      }
    }
    this.vertexCount = vertexCount;
    this.edges = List.copyOf(edges);
  }

  public static Graph of(int vertexCount, int... endpoints) {
    if (endpoints.length % 2 != 0) {
      throw new IllegalArgumentException("endpoints must come in pairs");
    }
    List<Edge> edges = new ArrayList<>(endpoints.length / 2);
    for (int i = 0; i < endpoints.length; i += 2) {
      edges.add(new Edge(endpoints[i], endpoints[i + 1]));
    }
    return new Graph(vertexCount, edges);
  }

  public int vertexCount() {
    return vertexCount;
  }

  public int edgeCount() {
    return edges.size();
  }

  public List<Edge> edges() {
    return edges;
  }

  /** Counts connected components with a throwaway {@link DisjointSet}. */
  public int componentCount() {
    DisjointSet components = new DisjointSet(vertexCount);
    for (Edge edge : edges) {
      components.union(edge.tail(), edge.head());
    }
    return components.subsetCount();
  }

  public boolean isConnected() {
    return componentCount() == 1;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Graph other)) {
      return false;
    }
    return vertexCount == other.vertexCount && edges.equals(other.edges);
  }

  @Override
  public int hashCode() {
    return Objects.hash(vertexCount, edges);
  }

  @Override
  public String toString() {
    return "Graph{|V|=" + vertexCount + ", |E|=" + edges.size() + "}";
  }
}
