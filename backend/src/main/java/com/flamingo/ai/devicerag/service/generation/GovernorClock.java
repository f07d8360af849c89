package com.flamingo.ai.devicerag.service.generation;

import java.time.Duration;

/** Time source used by the rate governor and retry backoff. Tests substitute a fake. */
public interface GovernorClock {

  GovernorClock SYSTEM =
      new GovernorClock() {
        @Override
        public long nanoTime() {
          return System.nanoTime();
        }

        @Override
        public void sleep(Duration duration) throws InterruptedException {
          if (!duration.isNegative() && !duration.isZero()) {
            Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
          }
        }
      };

  long nanoTime();

  void sleep(Duration duration) throws InterruptedException;
}
