package mincut.generator;

import java.util.Random;

/**
 * Parameters for a graph made of two random clusters joined by a fixed number of crossing edges.
 *
 * @param clusterSize vertices per cluster
 * @param density probability of each intra-cluster edge, in {@code (0, 1]}
 * @param crossingEdges distinct edges between the clusters
 * @param seed generator seed, or {@code null} for a random one
 */
public record PlantedCutConfig(int clusterSize, double density, int crossingEdges, Long seed) {

  public static final int DEFAULT_CLUSTER_SIZE = 10;
  public static final double DEFAULT_DENSITY = 0.6;
  public static final int DEFAULT_CROSSING_EDGES = 2;
  public static final int MAX_CLUSTER_SIZE = Integer.MAX_VALUE / 2;

  public PlantedCutConfig {
    if (clusterSize < 2 || clusterSize > MAX_CLUSTER_SIZE) {
      throw new IllegalArgumentException("clusterSize must be in [2, " + MAX_CLUSTER_SIZE + "]");
    }
    if (!(density > 0.0 && density <= 1.0)) {
      throw new IllegalArgumentException("density must be in (0, 1]");
    }
    if (crossingEdges < 1) {
      throw new IllegalArgumentException("crossingEdges must be at least 1");
    }
    if ((long) crossingEdges > (long) clusterSize * clusterSize) {
      throw new IllegalArgumentException(
          "at most " + (long) clusterSize * clusterSize + " distinct crossing edges fit");
    }
  }

  public static PlantedCutConfig defaults() {
    return new PlantedCutConfig(
        DEFAULT_CLUSTER_SIZE, DEFAULT_DENSITY, DEFAULT_CROSSING_EDGES, null);
  }

  public PlantedCutConfig withSeed(Long seed) {
    return new PlantedCutConfig(clusterSize, density, crossingEdges, seed);
  }

  public int vertexCount() {
    return clusterSize * 2;
  }

  public Random createRandom() {
    return seed != null ? new Random(seed) : new Random();
  }
}
