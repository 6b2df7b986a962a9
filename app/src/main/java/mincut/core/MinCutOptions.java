package mincut.core;

/**
 * Configuration for a min-cut repetition run.
 *
 * @param repeatCount number of independent trials; {@code 0} or less picks the algorithm's
 *     default for the graph size
 * @param seed base seed for the per-trial generators, or {@code null} for a random one
 * @param parallelism number of worker threads; {@code 1} runs the trials sequentially
 * @param timeBudgetMs wall-clock budget after which no new trials start; {@code 0} disables it
 */
public record MinCutOptions(int repeatCount, Long seed, int parallelism, long timeBudgetMs) {

  public static MinCutOptions defaults() {
    return new MinCutOptions(0, null, 1, 0);
  }

  public static MinCutOptions normalize(MinCutOptions options) {
    if (options == null) {
      return defaults();
    }
    int repeatCount = Math.max(0, options.repeatCount());
    int parallelism = Math.max(1, options.parallelism());
    long timeBudgetMs = Math.max(0, options.timeBudgetMs());
    return new MinCutOptions(repeatCount, options.seed(), parallelism, timeBudgetMs);
  }

  public boolean hasExplicitRepeatCount() {
    return repeatCount > 0;
  }

  public boolean isParallel() {
    return parallelism > 1;
  }

  public MinCutOptions withRepeatCount(int repeatCount) {
    return new MinCutOptions(repeatCount, seed, parallelism, timeBudgetMs);
  }

  public MinCutOptions withSeed(Long seed) {
    return new MinCutOptions(repeatCount, seed, parallelism, timeBudgetMs);
  }

  public MinCutOptions withParallelism(int parallelism) {
    return new MinCutOptions(repeatCount, seed, parallelism, timeBudgetMs);
  }

  public MinCutOptions withTimeBudgetMs(long timeBudgetMs) {
    return new MinCutOptions(repeatCount, seed, parallelism, timeBudgetMs);
  }
}
