package mincut;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import mincut.algorithm.MinCutAlgorithm;
import mincut.algorithm.MinCutRun;
import mincut.core.MinCutOptions;
import mincut.core.model.CutPartition;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;
import mincut.examples.Example;
import mincut.generator.PlantedCutConfig;
import mincut.generator.PlantedCutGenerator;
import mincut.generator.PlantedCutGenerator.PlantedGraph;
import mincut.testing.TestDefaults;
import org.junit.jupiter.api.Test;

final class MinCutTest {
  private static final Set<List<Integer>> CLIQUES =
      Set.of(List.of(0, 1, 2, 3), List.of(4, 5, 6, 7));

  @Test
  void kargerSeparatesTheTwoCliques() {
    GraphCut cut = MinCut.karger(Example.twoCliques(), 400);
    assertEquals(2, cut.size());
    CutPartition partition = MinCut.partitions(cut);
    assertEquals(CLIQUES, Set.of(partition.firstVertices(), partition.secondVertices()));
  }

  @Test
  void kargerSteinSeparatesTheTwoCliques() {
    GraphCut cut = MinCut.kargerStein(Example.twoCliques(), 40);
    assertEquals(2, cut.size());
    CutPartition partition = MinCut.partitions(cut);
    assertEquals(CLIQUES, Set.of(partition.firstVertices(), partition.secondVertices()));
  }

  @Test
  void singleEdgeGraph() {
    assertEquals(1, MinCut.karger(Example.singleEdge(), 1).size());
    assertEquals(1, MinCut.kargerStein(Example.singleEdge(), 1).size());
  }

  @Test
  void disconnectedGraphGivesEmptyCut() {
    Graph graph = Example.disconnectedTriangles();
    GraphCut cut = MinCut.karger(graph, 20);
    assertEquals(0, cut.size());
    CutPartition partition = MinCut.partitions(cut);
    assertEquals(List.of(0, 1, 2), partition.firstVertices());
    assertEquals(List.of(3, 4, 5), partition.secondVertices());
    assertEquals(0, MinCut.kargerStein(graph, 5).size());
  }

  @Test
  void partitionsCoverAllVerticesOnce() {
    Graph graph = Example.planted();
    CutPartition partition = MinCut.partitions(MinCut.karger(graph, 50));
    assertTrue(partition.first().get(0));
    assertTrue(!partition.first().isEmpty() && !partition.second().isEmpty());
    assertTrue(!partition.first().intersects(partition.second()));
    assertEquals(
        graph.vertexCount(), partition.first().cardinality() + partition.second().cardinality());
  }

  @Test
  void kargerSteinIsAtLeastAsGoodAsKarger() {
    PlantedGraph planted =
        PlantedCutGenerator.generate(new PlantedCutConfig(10, 1.0, 3, TestDefaults.seed()));
    MinCutOptions options = MinCutOptions.defaults().withSeed(TestDefaults.seed());

    MinCutRun karger = MinCut.run(planted.graph(), MinCutAlgorithm.KARGER, options);
    MinCutRun kargerStein =
        MinCut.run(planted.graph(), MinCutAlgorithm.KARGER_STEIN, options.withRepeatCount(20));

    assertTrue(kargerStein.cutSize() <= karger.cutSize());
    assertEquals(3, kargerStein.cutSize());
    assertEquals(planted.plantedCut().firstVertices(), kargerStein.partitions().firstVertices());
  }

  @Test
  void rejectsNonPositiveRepeatCounts() {
    assertThrows(IllegalArgumentException.class, () -> MinCut.karger(Example.singleEdge(), 0));
    assertThrows(
        IllegalArgumentException.class, () -> MinCut.kargerStein(Example.singleEdge(), -1));
    assertThrows(NullPointerException.class, () -> MinCut.partitions(null));
  }
}
