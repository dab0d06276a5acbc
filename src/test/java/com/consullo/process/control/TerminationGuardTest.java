package com.consullo.process.control;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the run-once termination guard.
 *
 * @since 1.0
 */
public class TerminationGuardTest {

  @Test
  @DisplayName("Should run the body once for sequential callers")
  void run_Sequential_BodyRunsOnce() throws Exception {
    final TerminationGuard guard = new TerminationGuard();
    final AtomicInteger runs = new AtomicInteger();

    guard.run(runs::incrementAndGet);
    guard.run(runs::incrementAndGet);

    assertThat(runs.get()).isEqualTo(1);
    assertThat(guard.hasRun()).isTrue();
  }

  @Test
  @DisplayName("Should replay the recorded failure to every caller")
  void run_BodyFails_SameExceptionForAll() throws Exception {
    final TerminationGuard guard = new TerminationGuard();
    final ProcessControlException failure = new ProcessControlException("no");

    assertThatThrownBy(() -> guard.run(() -> {
      throw failure;
    })).isSameAs(failure);
    assertThatThrownBy(() -> guard.run(() -> {
    })).isSameAs(failure);
  }

  @Test
  @DisplayName("Should replay an error thrown by the body to later callers")
  void run_BodyThrowsError_SameErrorForAll() throws Exception {
    final TerminationGuard guard = new TerminationGuard();
    final AssertionError error = new AssertionError("x");
    final AtomicInteger runs = new AtomicInteger();

    assertThatThrownBy(() -> guard.run(() -> {
      runs.incrementAndGet();
      throw error;
    })).isSameAs(error);
    assertThatThrownBy(() -> guard.run(runs::incrementAndGet)).isSameAs(error);
    assertThat(runs.get()).isEqualTo(1);
    assertThat(guard.hasRun()).isTrue();
  }

  @Test
  @DisplayName("Should make concurrent callers wait for the single run and share its result")
  void run_Concurrent_OneExecutionSharedOutcome() throws Exception {
    final TerminationGuard guard = new TerminationGuard();
    final AtomicInteger runs = new AtomicInteger();
    final CountDownLatch release = new CountDownLatch(1);
    final ProcessControlException failure = new ProcessControlException("shared");
    final int callers = 8;

    final ExecutorService pool = Executors.newFixedThreadPool(callers);
    try {
      final List<Future<Throwable>> results = new ArrayList<>(callers);
      for (int i = 0; i < callers; i++) {
        results.add(pool.submit(() -> {
          try {
            guard.run(() -> {
              runs.incrementAndGet();
              try {
                release.await(5, TimeUnit.SECONDS);
              } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
              }
              throw failure;
            });
            return null;
          } catch (final ProcessControlException e) {
            return e;
          }
        }));
      }

      Thread.sleep(100L);
      release.countDown();

      for (final Future<Throwable> f : results) {
        assertThat(f.get(5, TimeUnit.SECONDS)).isSameAs(failure);
      }
      assertThat(runs.get()).isEqualTo(1);
    } finally {
      pool.shutdownNow();
    }
  }
}
