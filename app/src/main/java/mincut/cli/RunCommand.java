package mincut.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;
import mincut.algorithm.MinCutAlgorithm;
import mincut.algorithm.MinCutDriver;
import mincut.algorithm.MinCutRun;
import mincut.core.MinCutOptions;
import mincut.core.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Handles the primary `run` command; also used when no command name is given. */
final class RunCommand {
  private static final Logger LOG = LoggerFactory.getLogger(RunCommand.class);

  private final PrintStream out;

  RunCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = parseArgs(args);
    CliParsers.GraphInput input = CliParsers.loadGraph(options);

    SummaryPrinter printer = new SummaryPrinter(out);
    printer.printGraph(input.label(), input.graph());
    List<MinCutRun> runs =
        runAll(
            input.graph(),
            options.algorithms(),
            options.runOptions(),
            printer,
            options.printPartitions());
    out.println();

    if (options.jsonReport() != null) {
      writeReport(options.jsonReport(), input, runs, options.printPartitions());
    }
    return 0;
  }

  static List<MinCutRun> runAll(
      Graph graph,
      List<MinCutAlgorithm> algorithms,
      MinCutOptions runOptions,
      SummaryPrinter printer,
      boolean printPartitions) {
    MinCutDriver driver = new MinCutDriver(runOptions);
    List<MinCutRun> runs = new ArrayList<>(algorithms.size());
    for (MinCutAlgorithm algorithm : algorithms) {
      MinCutRun run = driver.run(graph, algorithm);
      LOG.info(
          "{}: cut {} after {}/{} trials in {} ms",
          algorithm.displayName(),
          run.cutSize(),
          run.trialsCompleted(),
          run.repetitions(),
          run.elapsedMillis());
      printer.printRun(run, printPartitions);
      runs.add(run);
    }
    return runs;
  }

  static void writeReport(
      Path target, CliParsers.GraphInput input, List<MinCutRun> runs, boolean includePartitions)
      throws IOException {
    Path parent = target.toAbsolutePath().getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    String json =
        new JsonReportBuilder().build(input.label(), input.graph(), runs, includePartitions);
    Files.writeString(target, json, StandardCharsets.UTF_8);
    LOG.info("Wrote report to {}", target);
  }

  private CliOptions parseArgs(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    List<String> positionals = options().parse(stripCommand(args), builder);
    for (String positional : positionals) {
      builder.graphFile(positional);
    }
    return builder.build();
  }

  /** Registers the options shared by `run` and `batch`; {@code run} picks the builder to fill. */
  static <B> OptionTable<B> runOptionSpecs(
      OptionTable<B> table, Function<B, CliOptions.Builder> run) {
    return table
        .withValue(
            "--algorithms",
            (b, raw) -> run.apply(b).algorithms(CliParsers.parseAlgorithms(raw)))
        .withValue(
            "--repeat", (b, raw) -> run.apply(b).repeatCount(CliParsers.parseInt(raw, "--repeat")))
        .withValue("--seed", (b, raw) -> run.apply(b).seed(CliParsers.parseLong(raw, "--seed")))
        .withValue(
            "--parallelism",
            (b, raw) -> run.apply(b).parallelism(CliParsers.parseInt(raw, "--parallelism")))
        .withValue(
            "--time-budget-ms",
            (b, raw) -> run.apply(b).timeBudgetMs(CliParsers.parseLong(raw, "--time-budget-ms")))
        .flag("--partitions", b -> run.apply(b).printPartitions(true));
  }

  private OptionTable<CliOptions.Builder> options() {
    return runOptionSpecs(new OptionTable<CliOptions.Builder>(), Function.identity())
        .withValue("--file", (b, raw) -> b.graphFile(raw))
        .withValue("--example", (b, raw) -> b.exampleName(raw))
        .withValue("--json", (b, raw) -> b.jsonReport(Path.of(raw)));
  }

  private String[] stripCommand(String[] args) {
    if (args == null || args.length == 0) {
      return new String[0];
    }
    if ("run".equalsIgnoreCase(args[0])) {
      return Arrays.copyOfRange(args, 1, args.length);
    }
    return args;
  }
}
