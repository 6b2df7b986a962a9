package mincut.algorithm;

import java.util.Objects;
import java.util.SplittableRandom;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;
import mincut.core.MinCutOptions;
import mincut.core.model.Graph;
import mincut.core.model.GraphCut;
import mincut.util.Timing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats independent trials of a {@link MinCutAlgorithm} and keeps the smallest cut.
 *
 * <p>Every trial draws from its own generator, seeded from the run's base seed and the trial
 * index, so a fixed seed yields the same per-trial cuts whether the trials run sequentially or on
 * a {@link ForkJoinPool}. The only state shared between parallel trials is the best cut, merged
 * with a keep-smaller accumulation.
 */
public final class MinCutDriver {
  private static final Logger LOG = LoggerFactory.getLogger(MinCutDriver.class);
  private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;
  static final String TIME_BUDGET_EXHAUSTED = "time budget exhausted";

  private final MinCutOptions options;
  private final TrialListener listener;

  public MinCutDriver(MinCutOptions options) {
    this(options, TrialListener.NONE);
  }

  public MinCutDriver(MinCutOptions options, TrialListener listener) {
    this.options = MinCutOptions.normalize(options);
    this.listener = Objects.requireNonNull(listener, "listener");
  }

  public MinCutOptions options() {
    return options;
  }

  public MinCutRun run(Graph graph, MinCutAlgorithm algorithm) {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(algorithm, "algorithm");

    int repetitions =
        options.hasExplicitRepeatCount()
            ? options.repeatCount()
            : algorithm.defaultRepetitions(graph.vertexCount());
    int componentCount = graph.componentCount();
    if (componentCount > 1) {
      LOG.warn(
          "{} has {} connected components; {} will report a cut of size 0.",
          graph,
          componentCount,
          algorithm.displayName());
    }
    long baseSeed = options.seed() != null ? options.seed() : new SplittableRandom().nextLong();
    LOG.debug(
        "Running {} x{} on {} (seed={}, parallelism={}, timeBudgetMs={})",
        algorithm.displayName(),
        repetitions,
        graph,
        baseSeed,
        options.parallelism(),
        options.timeBudgetMs());

    Timing timer = Timing.start();
    TrialOutcome outcome =
        options.isParallel()
            ? runParallel(graph, algorithm, repetitions, baseSeed, timer)
            : runSequential(graph, algorithm, repetitions, baseSeed, timer);
    long elapsed = timer.elapsedMillis();

    String terminationReason = null;
    if (outcome.trialsCompleted() < repetitions) {
      terminationReason = TIME_BUDGET_EXHAUSTED;
      LOG.warn(
          "{} stopped after {} of {} trials: {}",
          algorithm.displayName(),
          outcome.trialsCompleted(),
          repetitions,
          terminationReason);
    }
    LOG.debug(
        "{} finished: best cut {} after {} trials in {} ms",
        algorithm.displayName(),
        outcome.best().size(),
        outcome.trialsCompleted(),
        elapsed);
    return new MinCutRun(
        algorithm,
        outcome.best(),
        repetitions,
        outcome.trialsCompleted(),
        componentCount,
        elapsed,
        terminationReason);
  }

  private TrialOutcome runSequential(
      Graph graph, MinCutAlgorithm algorithm, int repetitions, long baseSeed, Timing timer) {
    GraphCut best = null;
    int completed = 0;
    for (int trial = 0; trial < repetitions; trial++) {
      if (completed > 0 && timer.exceeded(options.timeBudgetMs())) {
        break;
      }
      GraphCut cut = algorithm.runOnce(graph, trialRandom(baseSeed, trial));
      best = GraphCut.min(best, cut);
      completed++;
      listener.onTrial(trial, cut, best);
    }
    return new TrialOutcome(best, completed);
  }

  private TrialOutcome runParallel(
      Graph graph, MinCutAlgorithm algorithm, int repetitions, long baseSeed, Timing timer) {
    AtomicReference<GraphCut> best = new AtomicReference<>();
    AtomicInteger completed = new AtomicInteger();
    AtomicBoolean started = new AtomicBoolean();
    ForkJoinPool pool =
        options.parallelism() == ForkJoinPool.getCommonPoolParallelism()
            ? ForkJoinPool.commonPool()
            : new ForkJoinPool(options.parallelism());
    try {
      pool.submit(
              () ->
                  IntStream.range(0, repetitions)
                      .parallel()
                      .forEach(
                          trial -> {
                            // the first trial to get here always runs
                            if (started.getAndSet(true) && timer.exceeded(options.timeBudgetMs())) {
                              return;
                            }
                            GraphCut cut = algorithm.runOnce(graph, trialRandom(baseSeed, trial));
                            GraphCut current = best.accumulateAndGet(cut, GraphCut::min);
                            completed.incrementAndGet();
                            listener.onTrial(trial, cut, current);
                          }))
          .join();
    } finally {
      if (pool != ForkJoinPool.commonPool()) {
        pool.shutdown();
      }
    }
    return new TrialOutcome(best.get(), completed.get());
  }

  static SplittableRandom trialRandom(long baseSeed, int trial) {
    long trialSeed = new SplittableRandom(baseSeed + trial * SEED_STRIDE).nextLong();
    return new SplittableRandom(trialSeed);
  }

  private record TrialOutcome(GraphCut best, int trialsCompleted) {}
}
