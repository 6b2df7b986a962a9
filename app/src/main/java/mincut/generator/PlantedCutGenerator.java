package mincut.generator;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import mincut.core.model.CutPartition;
import mincut.core.model.Edge;
import mincut.core.model.Graph;

/**
 * Builds test instances with a known cut.
 *
 * <p>Cluster A holds vertices {@code [0, k)} and cluster B {@code [k, 2k)}. Each cluster gets a
 * spanning path plus every other pair with probability {@code density}; then {@code
 * crossingEdges} distinct A-B pairs are added. The edge list is shuffled before returning.
 */
public final class PlantedCutGenerator {
  private PlantedCutGenerator() {}

  /** A generated graph together with the cut that was planted in it. */
  public record PlantedGraph(Graph graph, CutPartition plantedCut, int crossingEdges) {
    public PlantedGraph {
      Objects.requireNonNull(graph, "graph");
      Objects.requireNonNull(plantedCut, "plantedCut");
    }
  }

  public static PlantedGraph generate(PlantedCutConfig config) {
    Objects.requireNonNull(config, "config");
    Random random = config.createRandom();
    int k = config.clusterSize();
    List<Edge> edges = new ArrayList<>();
    addCluster(edges, 0, k, config.density(), random);
    addCluster(edges, k, k, config.density(), random);

    Set<Long> crossing = new HashSet<>();
    while (crossing.size() < config.crossingEdges()) {
      int a = random.nextInt(k);
      int b = k + random.nextInt(k);
      if (crossing.add((long) a * config.vertexCount() + b)) {
        edges.add(new Edge(a, b));
      }
    }
    Collections.shuffle(edges, random);

    BitSet first = new BitSet(config.vertexCount());
    first.set(0, k);
    BitSet second = new BitSet(config.vertexCount());
    second.set(k, 2 * k);
    return new PlantedGraph(
        new Graph(config.vertexCount(), edges),
        new CutPartition(first, second, config.vertexCount()),
        config.crossingEdges());
  }

  private static void addCluster(
      List<Edge> edges, int offset, int size, double density, Random random) {
    for (int u = 0; u < size; u++) {
      for (int v = u + 1; v < size; v++) {
        if (v == u + 1 || random.nextDouble() < density) {
          edges.add(new Edge(offset + u, offset + v));
        }
      }
    }
  }
}
