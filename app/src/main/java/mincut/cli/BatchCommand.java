package mincut.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;
import mincut.algorithm.MinCutRun;
import mincut.io.GraphLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Runs the algorithms over every {@code .col} graph in a directory. */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);
  private static final String GRAPH_EXTENSION = ".col";

  private final PrintStream out;

  BatchCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    BatchOptions options = parseArgs(args);
    List<Path> graphs = resolveGraphs(options.graphsPath());
    if (graphs.isEmpty()) {
      LOG.warn("No {} graphs found under {}.", GRAPH_EXTENSION, options.graphsPath());
      return 1;
    }

    SummaryPrinter printer = new SummaryPrinter(out);
    boolean hadFailure = false;
    for (Path graph : graphs) {
      try {
        runForGraph(graph, options, printer);
      } catch (IOException | RuntimeException ex) {
        hadFailure = true;
        LOG.error("Batch run failed for {}: {}", graph, ex.getMessage(), ex);
      }
    }
    out.println();
    return hadFailure ? 1 : 0;
  }

  private void runForGraph(Path graph, BatchOptions options, SummaryPrinter printer)
      throws IOException {
    CliParsers.GraphInput input =
        new CliParsers.GraphInput(graph.toString(), GraphLoader.load(graph));
    printer.printGraph(input.label(), input.graph());
    CliOptions.Builder run = options.run();
    List<MinCutRun> runs =
        RunCommand.runAll(
            input.graph(), run.algorithms(), run.runOptions(), printer, run.printPartitions());
    if (options.jsonDir() != null) {
      Path report = options.jsonDir().resolve(baseName(graph) + ".json");
      RunCommand.writeReport(report, input, runs, run.printPartitions());
    }
  }

  private List<Path> resolveGraphs(Path graphsPath) throws IOException {
    if (Files.isRegularFile(graphsPath)) {
      return List.of(graphsPath);
    }
    if (!Files.isDirectory(graphsPath)) {
      throw new NoSuchFileException(graphsPath.toString());
    }
    try (Stream<Path> files = Files.list(graphsPath)) {
      return files
          .filter(Files::isRegularFile)
          .filter(
              p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(GRAPH_EXTENSION))
          .sorted()
          .toList();
    }
  }

  private static String baseName(Path graph) {
    String name = graph.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private BatchOptions parseArgs(String[] args) {
    BatchOptions.Builder builder = new BatchOptions.Builder();
    OptionTable<BatchOptions.Builder> table =
        RunCommand.runOptionSpecs(new OptionTable<BatchOptions.Builder>(), b -> b.run)
            .withValue("--graphs", (b, raw) -> b.graphsPath = Path.of(raw))
            .withValue("--json-dir", (b, raw) -> b.jsonDir = Path.of(raw));
    List<String> positionals = table.parse(stripCommand(args), builder);
    if (!positionals.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + positionals);
    }
    return builder.build();
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("batch".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private record BatchOptions(Path graphsPath, Path jsonDir, CliOptions.Builder run) {
    static final class Builder {
      private Path graphsPath;
      private Path jsonDir;
      private final CliOptions.Builder run = CliOptions.builder();

      BatchOptions build() {
        if (graphsPath == null) {
          throw new IllegalArgumentException("batch needs --graphs <dir|file>");
        }
        return new BatchOptions(graphsPath, jsonDir, run);
      }
    }
  }
}
