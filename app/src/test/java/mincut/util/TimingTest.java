package mincut.util;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

final class TimingTest {

  @Test
  void nonPositiveBudgetNeverExpires() {
    Timing timing = Timing.start();
    assertFalse(timing.exceeded(0));
    assertFalse(timing.exceeded(-5));
  }

  @Test
  void hugeBudgetDoesNotExpireImmediately() {
    Timing timing = Timing.start();
    assertFalse(timing.exceeded(10_000_000_000_000L));
    assertFalse(timing.exceeded(Long.MAX_VALUE));
  }

  @Test
  void smallBudgetExpires() throws InterruptedException {
    Timing timing = Timing.start();
    Thread.sleep(5);
    assertTrue(timing.exceeded(1));
    assertTrue(timing.elapsedMillis() >= 1);
  }
}
