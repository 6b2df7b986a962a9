package mincut.examples;

import mincut.core.model.Graph;
import mincut.generator.PlantedCutConfig;
import mincut.generator.PlantedCutGenerator;

/** Built-in graphs for demos and tests. */
public final class Example {
  private Example() {}

  /**
   * Two 4-cliques {@code {0,1,2,3}} and {@code {4,5,6,7}} joined by the edges {@code {1,4}} and
   * {@code {3,4}}. The minimum cut has size 2 and separates the cliques.
   */
  public static Graph twoCliques() {
    return Graph.of(
        8,
        0, 1, 0, 2, 0, 3, 1, 2, 1, 3, 2, 3,
        4, 5, 4, 6, 4, 7, 5, 6, 5, 7, 6, 7,
        1, 4, 3, 4);
  }

  /** Single edge between two vertices; every contraction ends with a cut of size 1. */
  public static Graph singleEdge() {
    return Graph.of(2, 0, 1);
  }

  /** Two triangles with no edge between them. */
  public static Graph disconnectedTriangles() {
    return Graph.of(6, 0, 1, 1, 2, 0, 2, 3, 4, 4, 5, 3, 5);
  }

  /** Cycle over {@code n} vertices; its minimum cut has size 2. */
  public static Graph cycle(int n) {
    int[] endpoints = new int[2 * n];
    for (int i = 0; i < n; i++) {
      endpoints[2 * i] = i;
      endpoints[2 * i + 1] = (i + 1) % n;
    }
    return Graph.of(n, endpoints);
  }

  /** Planted-cut graph with the default parameters and a fixed seed. */
  public static Graph planted() {
    return PlantedCutGenerator.generate(PlantedCutConfig.defaults().withSeed(7L)).graph();
  }
}
