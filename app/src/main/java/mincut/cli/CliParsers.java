package mincut.cli;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Supplier;
import mincut.algorithm.MinCutAlgorithm;
import mincut.core.model.Graph;
import mincut.examples.Example;
import mincut.io.GraphLoader;

/** Shared helpers for CLI argument parsing and graph loading. */
final class CliParsers {
  private static final Map<String, Supplier<Graph>> EXAMPLE_LOADERS = buildExampleLoaders();
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private CliParsers() {}

  /** A loaded graph plus the label it is reported under. */
  record GraphInput(String label, Graph graph) {}

  static int parseInt(String raw, String optionName) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid integer for " + optionName + ": " + raw);
    }
  }

  static long parseLong(String raw, String optionName) {
    try {
      return Long.parseLong(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid long for " + optionName + ": " + raw);
    }
  }

  static double parseDouble(String raw, String optionName) {
    try {
      return Double.parseDouble(raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid number for " + optionName + ": " + raw);
    }
  }

  static List<MinCutAlgorithm> parseAlgorithms(String raw) {
    List<MinCutAlgorithm> algorithms =
        LIST_SPLITTER.splitToList(raw).stream().map(MinCutAlgorithm::parse).distinct().toList();
    if (algorithms.isEmpty()) {
      throw new IllegalArgumentException("--algorithms needs at least one algorithm");
    }
    return algorithms;
  }

  static Graph loadExampleByName(String exampleName) {
    if (exampleName == null || exampleName.isBlank()) {
      throw new IllegalArgumentException("Unknown example: " + exampleName);
    }
    Supplier<Graph> supplier = EXAMPLE_LOADERS.get(exampleName.trim().toLowerCase(Locale.ROOT));
    if (supplier == null) {
      throw new IllegalArgumentException(
          "Unknown example: " + exampleName + " (known: " + EXAMPLE_LOADERS.keySet() + ")");
    }
    return supplier.get();
  }

  static GraphInput loadGraph(CliOptions options) throws IOException {
    if (options.hasExample()) {
      return new GraphInput(
          "example:" + options.exampleName(), loadExampleByName(options.exampleName()));
    }
    if (options.hasGraphFile()) {
      Path path = Path.of(options.graphFile());
      return new GraphInput(path.toString(), GraphLoader.load(path));
    }
    throw new IllegalStateException("Missing graph input.");
  }

  private static Map<String, Supplier<Graph>> buildExampleLoaders() {
    Map<String, Supplier<Graph>> loaders = new LinkedHashMap<>();
    loaders.put("two-cliques", Example::twoCliques);
    loaders.put("single-edge", Example::singleEdge);
    loaders.put("disconnected", Example::disconnectedTriangles);
    loaders.put("cycle", () -> Example.cycle(12));
    loaders.put("planted", Example::planted);
    return Map.copyOf(loaders);
  }
}
