package mincut.contract;

import java.util.Arrays;
import java.util.Objects;
import java.util.random.RandomGenerator;
import mincut.core.DisjointSet;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;

/**
 * Random edge contraction backed by a {@link DisjointSet}.
 *
 * <p>Edges are drawn with a partial Fisher-Yates shuffle: the next edge is picked uniformly from
 * the not yet processed suffix of the endpoint array and swapped to its front, so no full
 * permutation is ever built. One contraction costs {@code O(m α(n))}.
 */
public final class Contraction {
  private Contraction() {}

  /**
   * One run of Karger's algorithm: contracts a private copy of {@code graph} down to two
   * super-vertices. {@code graph} itself is left untouched.
   */
  public static GraphCut karger(Graph graph, RandomGenerator random) {
    return contract(ContractedGraph.of(graph), 2, random).toCut();
  }

  /**
   * Contracts {@code graph} until {@code targetVertices} super-vertices remain.
   *
   * <p>The endpoint array of {@code graph} is reordered in place but keeps the same edges, so the
   * same working graph may be contracted again. The returned graph owns a copy of the
   * disjoint-set and only the surviving edges whose endpoints are still apart.
   *
   * <p>If the edges run out first, which happens only when {@code graph} is disconnected, the
   * super-vertices holding the lowest vertex ids are folded into vertex 0's until the target is
   * met.
   */
  public static ContractedGraph contract(
      ContractedGraph graph, int targetVertices, RandomGenerator random) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(random, "random");
    if (targetVertices < 2 || targetVertices > graph.vertexCount()) {
      throw new IllegalArgumentException(
          "target must be in [2, " + graph.vertexCount() + "], got " + targetVertices);
    }

    DisjointSet components = new DisjointSet(graph.components());
    int[] endpoints = graph.endpoints();
    int edgeCount = endpoints.length / 2;
    int next = 0;
    while (components.subsetCount() > targetVertices && next < edgeCount) {
      swap(endpoints, next, next + random.nextInt(edgeCount - next));
      components.union(endpoints[2 * next], endpoints[2 * next + 1]);
      next++;
    }
    if (components.subsetCount() > targetVertices) {
      mergeRemaining(components, targetVertices);
    }

    int[] survivors = new int[(edgeCount - next) * 2];
    int kept = 0;
    for (int i = next; i < edgeCount; i++) {
      int tail = endpoints[2 * i];
      int head = endpoints[2 * i + 1];
      if (!components.connected(tail, head)) {
        survivors[kept++] = tail;
        survivors[kept++] = head;
      }
    }
    return new ContractedGraph(
        components.subsetCount(), Arrays.copyOf(survivors, kept), components);
  }

  private static void mergeRemaining(DisjointSet components, int targetVertices) {
    int anchor = components.find(0);
    for (int vertex = 1;
        vertex < components.size() && components.subsetCount() > targetVertices;
        vertex++) {
      components.union(anchor, vertex);
      anchor = components.find(anchor);
    }
  }

  private static void swap(int[] endpoints, int i, int j) {
    if (i == j) {
      return;
    }
    int tail = endpoints[2 * i];
    int head = endpoints[2 * i + 1];
    endpoints[2 * i] = endpoints[2 * j];
    endpoints[2 * i + 1] = endpoints[2 * j + 1];
    endpoints[2 * j] = tail;
    endpoints[2 * j + 1] = head;
  }
}
