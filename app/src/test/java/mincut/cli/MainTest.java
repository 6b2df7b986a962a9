package mincut.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import mincut.core.model.Graph;
import mincut.examples.Example;
import mincut.io.GraphLoader;
import mincut.io.GraphWriter;
import mincut.testing.TestDefaults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {

  @TempDir Path tempDir;

  private ByteArrayOutputStream outBytes;
  private ByteArrayOutputStream errBytes;

  @BeforeEach
  void resetStreams() {
    outBytes = new ByteArrayOutputStream();
    errBytes = new ByteArrayOutputStream();
  }

  private int run(String... args) {
    return Main.run(
        args,
        new PrintStream(outBytes, true, StandardCharsets.UTF_8),
        new PrintStream(errBytes, true, StandardCharsets.UTF_8));
  }

  private String out() {
    return outBytes.toString(StandardCharsets.UTF_8);
  }

  private String err() {
    return errBytes.toString(StandardCharsets.UTF_8);
  }

  private Path writeGraph(String name, Graph graph) throws IOException {
    Path file = tempDir.resolve(name);
    GraphWriter.write(graph, file, null);
    return file;
  }

  @Test
  void runsBothAlgorithmsOnAGraphFile() throws IOException {
    Path file = writeGraph("two.col", Example.twoCliques());

    int exit =
        run(file.toString(), "--repeat", "300", "--seed", String.valueOf(TestDefaults.seed()));

    assertEquals(0, exit, err());
    String output = out();
    assertTrue(output.contains("Input graph: \"" + file + "\" (|V| = 8, |E| = 14)"));
    assertTrue(output.contains("Algorithm: \"Karger\""));
    assertTrue(output.contains("Algorithm: \"Karger-Stein\""));
    assertTrue(output.contains("    - Number of repetitions: 300"));
    assertTrue(output.contains("    - Best minimum cut's size found: 2"));
    assertFalse(output.contains("found: 3"));
  }

  @Test
  void printsOneBasedPartitionsForAnExample() {
    int exit =
        run(
            "run",
            "--example",
            "two-cliques",
            "--algorithms",
            "karger",
            "--repeat",
            "300",
            "--partitions",
            "--parallelism",
            "2");

    assertEquals(0, exit, err());
    assertTrue(out().contains("Input graph: \"example:two-cliques\""));
    assertTrue(out().contains("    - Partitions: [1,2,3,4] [5,6,7,8]"));
    assertFalse(out().contains("Karger-Stein"));
  }

  @Test
  void writesJsonReport() throws IOException {
    Path report = tempDir.resolve("reports/two.json");

    int exit =
        run(
            "--example",
            "two-cliques",
            "--algorithms",
            "ks",
            "--repeat",
            "40",
            "--partitions",
            "--json",
            report.toString());

    assertEquals(0, exit, err());
    JsonObject root = JsonParser.parseString(Files.readString(report)).getAsJsonObject();
    JsonObject meta = root.getAsJsonObject("meta");
    assertEquals(8, meta.get("vertex_count").getAsInt());
    assertEquals(14, meta.get("edge_count").getAsInt());
    assertEquals(1, meta.get("component_count").getAsInt());

    JsonArray runs = root.getAsJsonArray("runs");
    assertEquals(1, runs.size());
    JsonObject ks = runs.get(0).getAsJsonObject();
    assertEquals("Karger-Stein", ks.get("algorithm").getAsString());
    assertEquals(40, ks.get("trials_completed").getAsInt());
    assertEquals(2, ks.get("cut_size").getAsInt());
    assertTrue(ks.get("termination_reason").isJsonNull());
    assertEquals(JsonParser.parseString("[[1,2,3,4],[5,6,7,8]]"), ks.get("partitions"));
    assertEquals(2, root.get("best_cut_size").getAsInt());
  }

  @Test
  void disconnectedExampleReportsEmptyCut() {
    assertEquals(0, run("--example", "disconnected", "--repeat", "5"));
    assertTrue(out().contains("    - Best minimum cut's size found: 0"));
  }

  @Test
  void noArgumentsPrintsUsage() {
    assertEquals(Main.EXIT_USAGE, run());
    assertTrue(err().startsWith("Usage: mincut"));
  }

  @Test
  void helpGoesToStdout() {
    assertEquals(0, run("help"));
    assertTrue(out().contains("--time-budget-ms"));
  }

  @Test
  void missingFileExitsWithInputNotFound() {
    assertEquals(Main.EXIT_INPUT_NOT_FOUND, run(tempDir.resolve("absent.col").toString()));
    assertTrue(err().contains("input not found"));
  }

  @Test
  void malformedFileExitsWithMalformedInput() throws IOException {
    Path file = tempDir.resolve("bad.col");
    Files.writeString(file, "p edge 3 1\ne 1 7\n");

    assertEquals(Main.EXIT_MALFORMED_INPUT, run(file.toString()));
    assertTrue(err().contains("bad.col:2:"));
  }

  @Test
  void nonUtf8CommentDoesNotFailTheRun() throws IOException {
    Path file = tempDir.resolve("latin1.col");
    Files.write(
        file, "c Jos\u00e9 Garc\u00eda\np edge 2 1\ne 1 2\n".getBytes(StandardCharsets.ISO_8859_1));

    assertEquals(0, run(file.toString(), "--repeat", "1"), err());
    assertTrue(out().contains("    - Best minimum cut's size found: 1"));
  }

  @Test
  void invalidOptionsExitWithUsage() throws IOException {
    Path file = writeGraph("ok.col", Example.singleEdge());
    assertEquals(Main.EXIT_USAGE, run(file.toString(), "--repeat", "0"));
    assertEquals(Main.EXIT_USAGE, run(file.toString(), "--bogus"));
    assertEquals(Main.EXIT_USAGE, run(file.toString(), "--algorithms", "stoer-wagner"));
    assertEquals(Main.EXIT_USAGE, run(file.toString(), "--example", "two-cliques"));
    assertEquals(Main.EXIT_USAGE, run("--example", "nonexistent"));
    assertEquals(Main.EXIT_USAGE, run("run", "--seed"));
  }

  @Test
  void batchContinuesPastBadGraphs() throws IOException {
    Path graphs = Files.createDirectories(tempDir.resolve("graphs"));
    writeGraph("graphs/a_two.col", Example.twoCliques());
    Files.writeString(graphs.resolve("b_broken.col"), "e 1 2\n");
    Files.writeString(graphs.resolve("notes.txt"), "not a graph");
    Path jsonDir = tempDir.resolve("json");

    int exit =
        run(
            "batch",
            "--graphs",
            graphs.toString(),
            "--json-dir",
            jsonDir.toString(),
            "--algorithms",
            "karger",
            "--repeat",
            "300");

    assertEquals(1, exit);
    assertTrue(Files.exists(jsonDir.resolve("a_two.json")));
    assertFalse(Files.exists(jsonDir.resolve("b_broken.json")));
    assertTrue(out().contains("    - Best minimum cut's size found: 2"));
  }

  @Test
  void batchSucceedsWhenEveryGraphRuns() throws IOException {
    Path graphs = Files.createDirectories(tempDir.resolve("graphs"));
    writeGraph("graphs/edge.col", Example.singleEdge());
    writeGraph("graphs/cycle.col", Example.cycle(6));

    assertEquals(0, run("batch", "--graphs", graphs.toString(), "--repeat", "50"));
    assertEquals(Main.EXIT_USAGE, run("batch"));
    assertEquals(
        Main.EXIT_INPUT_NOT_FOUND, run("batch", "--graphs", tempDir.resolve("none").toString()));
  }

  @Test
  void generateWritesALoadableGraph() throws IOException {
    Path file = tempDir.resolve("generated/planted.col");

    int exit =
        run(
            "generate",
            "--out",
            file.toString(),
            "--cluster-size",
            "6",
            "--density",
            "1.0",
            "--crossing",
            "2",
            "--seed",
            "5");

    assertEquals(0, exit, err());
    Graph graph = GraphLoader.load(file);
    assertEquals(12, graph.vertexCount());
    assertEquals(2 * 15 + 2, graph.edgeCount());
    assertTrue(Files.readString(file).startsWith("c planted cut: clusters of 6"));
    assertTrue(out().contains("planted cut of size 2"));

    assertEquals(Main.EXIT_USAGE, run("generate", "--cluster-size", "6"));
    assertEquals(Main.EXIT_USAGE, run("generate", "--out", file.toString(), "--density", "2"));
  }
}
