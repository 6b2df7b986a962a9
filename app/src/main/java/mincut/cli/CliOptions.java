package mincut.cli;

import java.nio.file.Path;
import java.util.List;
import mincut.algorithm.MinCutAlgorithm;
import mincut.core.MinCutOptions;

record CliOptions(
    String graphFile,
    String exampleName,
    List<MinCutAlgorithm> algorithms,
    MinCutOptions runOptions,
    boolean printPartitions,
    Path jsonReport) {

  static final List<MinCutAlgorithm> DEFAULT_ALGORITHMS =
      List.of(MinCutAlgorithm.KARGER, MinCutAlgorithm.KARGER_STEIN);

  CliOptions {
    algorithms =
        algorithms == null || algorithms.isEmpty() ? DEFAULT_ALGORITHMS : List.copyOf(algorithms);
    runOptions = MinCutOptions.normalize(runOptions);
  }

  boolean hasGraphFile() {
    return graphFile != null && !graphFile.isBlank();
  }

  boolean hasExample() {
    return exampleName != null && !exampleName.isBlank();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String graphFile;
    private String exampleName;
    private List<MinCutAlgorithm> algorithms = DEFAULT_ALGORITHMS;
    private MinCutOptions runOptions = MinCutOptions.defaults();
    private boolean printPartitions;
    private Path jsonReport;

    Builder graphFile(String graphFile) {
      if (this.graphFile != null) {
        throw new IllegalArgumentException("Only one graph file may be given");
      }
      this.graphFile = graphFile;
      return this;
    }

    Builder exampleName(String exampleName) {
      this.exampleName = exampleName;
      return this;
    }

    Builder algorithms(List<MinCutAlgorithm> algorithms) {
      this.algorithms = algorithms;
      return this;
    }

    Builder repeatCount(int repeatCount) {
      if (repeatCount < 1) {
        throw new IllegalArgumentException("--repeat must be at least 1");
      }
      runOptions = runOptions.withRepeatCount(repeatCount);
      return this;
    }

    Builder seed(long seed) {
      runOptions = runOptions.withSeed(seed);
      return this;
    }

    Builder parallelism(int parallelism) {
      if (parallelism < 1) {
        throw new IllegalArgumentException("--parallelism must be at least 1");
      }
      runOptions = runOptions.withParallelism(parallelism);
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      if (timeBudgetMs < 0) {
        throw new IllegalArgumentException("--time-budget-ms must be non-negative");
      }
      runOptions = runOptions.withTimeBudgetMs(timeBudgetMs);
      return this;
    }

    Builder printPartitions(boolean printPartitions) {
      this.printPartitions = printPartitions;
      return this;
    }

    Builder jsonReport(Path jsonReport) {
      this.jsonReport = jsonReport;
      return this;
    }

    List<MinCutAlgorithm> algorithms() {
      return algorithms;
    }

    MinCutOptions runOptions() {
      return runOptions;
    }

    boolean printPartitions() {
      return printPartitions;
    }

    CliOptions build() {
      boolean hasFile = graphFile != null && !graphFile.isBlank();
      boolean hasExample = exampleName != null && !exampleName.isBlank();
      if (hasFile == hasExample) {
        throw new IllegalArgumentException("Provide exactly one graph file or --example");
      }
      return new CliOptions(
          graphFile, exampleName, algorithms, runOptions, printPartitions, jsonReport);
    }
  }
}
