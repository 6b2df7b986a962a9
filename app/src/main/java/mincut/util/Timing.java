package mincut.util;

import java.util.concurrent.TimeUnit;

/** Lightweight timer for trial runs and deadline checks. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  public long elapsedNanos() {
    return System.nanoTime() - startedAt;
  }

  /** True when a positive {@code budgetMs} has been used up. Non-positive budgets never expire. */
  public boolean exceeded(long budgetMs) {
    return budgetMs > 0 && elapsedNanos() >= TimeUnit.MILLISECONDS.toNanos(budgetMs);
  }
}
