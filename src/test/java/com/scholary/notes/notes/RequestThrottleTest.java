package com.scholary.notes.notes;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class RequestThrottleTest {

  private final AtomicLong now = new AtomicLong(0);
  private final List<Long> sleeps = new ArrayList<>();

  private final RequestThrottle throttle =
      new RequestThrottle(
          Duration.ofSeconds(1),
          now::get,
          millis -> {
            sleeps.add(millis);
            now.addAndGet(millis * 1_000_000);
          });

  @Test
  void acquire_shouldNotWaitTheFirstTime() throws InterruptedException {
    throttle.acquire();

    assertThat(sleeps).isEmpty();
  }

  @Test
  void acquire_shouldWaitForRemainingInterval() throws InterruptedException {
    throttle.acquire();
    now.addAndGet(Duration.ofMillis(300).toNanos());

    throttle.acquire();

    assertThat(sleeps).containsExactly(700L);
  }

  @Test
  void acquire_shouldNotWaitAfterIntervalPassed() throws InterruptedException {
    throttle.acquire();
    now.addAndGet(Duration.ofMillis(1500).toNanos());

    throttle.acquire();

    assertThat(sleeps).isEmpty();
  }

  @Test
  void acquire_shouldSpaceConsecutiveCalls() throws InterruptedException {
    throttle.acquire();
    throttle.acquire();
    throttle.acquire();

    assertThat(sleeps).containsExactly(1000L, 1000L);
    assertThat(now.get()).isEqualTo(Duration.ofSeconds(2).toNanos());
  }
}
