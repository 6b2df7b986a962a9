package mincut.algorithm;

import mincut.core.model.GraphCut;

/**
 * Callback invoked after every completed trial. Parallel runs call it from worker threads, so
 * implementations must be thread-safe there.
 */
@FunctionalInterface
public interface TrialListener {
  TrialListener NONE = (trial, cut, best) -> {};

  /**
   * @param trial zero-based trial index
   * @param cut the cut this trial produced
   * @param best the best cut recorded so far, including this trial
   */
  void onTrial(int trial, GraphCut cut, GraphCut best);
}
