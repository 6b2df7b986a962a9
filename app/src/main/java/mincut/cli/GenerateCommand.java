package mincut.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import mincut.generator.PlantedCutConfig;
import mincut.generator.PlantedCutGenerator;
import mincut.generator.PlantedCutGenerator.PlantedGraph;
import mincut.io.GraphWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the `generate` command: writes a planted-cut graph file. */
final class GenerateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(GenerateCommand.class);

  private final PrintStream out;

  GenerateCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    Settings settings = new Settings();
    List<String> positionals =
        new OptionTable<Settings>()
            .withValue("--out", (s, raw) -> s.output = Path.of(raw))
            .withValue(
                "--cluster-size",
                (s, raw) -> s.clusterSize = CliParsers.parseInt(raw, "--cluster-size"))
            .withValue(
                "--density", (s, raw) -> s.density = CliParsers.parseDouble(raw, "--density"))
            .withValue(
                "--crossing", (s, raw) -> s.crossingEdges = CliParsers.parseInt(raw, "--crossing"))
            .withValue("--seed", (s, raw) -> s.seed = CliParsers.parseLong(raw, "--seed"))
            .parse(stripCommand(args), settings);
    if (!positionals.isEmpty()) {
      throw new IllegalArgumentException("Unexpected arguments: " + positionals);
    }
    if (settings.output == null) {
      throw new IllegalArgumentException("generate needs --out <file>");
    }

    PlantedCutConfig config =
        new PlantedCutConfig(
            settings.clusterSize, settings.density, settings.crossingEdges, settings.seed);
    PlantedGraph planted = PlantedCutGenerator.generate(config);
    String comment =
        String.format(
            Locale.ROOT,
            "planted cut: clusters of %d, density %.3f, %d crossing edges, seed %s",
            config.clusterSize(), config.density(), config.crossingEdges(), config.seed());
    GraphWriter.write(planted.graph(), settings.output, comment);
    LOG.info("Wrote {} to {}", planted.graph(), settings.output);
    out.printf(
        "Generated %s with a planted cut of size %d: %s%n",
        settings.output, planted.crossingEdges(), planted.graph());
    return 0;
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("generate".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }

  private static final class Settings {
    private Path output;
    private int clusterSize = PlantedCutConfig.DEFAULT_CLUSTER_SIZE;
    private double density = PlantedCutConfig.DEFAULT_DENSITY;
    private int crossingEdges = PlantedCutConfig.DEFAULT_CROSSING_EDGES;
    private Long seed;
  }
}
