package com.consullo.process.control;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the one-shot exit slot.
 *
 * @since 1.0
 */
public class ExitSlotTest {

  @Test
  @DisplayName("Should accept exactly one deposit")
  void deposit_Twice_SecondRejected() throws Exception {
    final ExitSlot slot = new ExitSlot();

    assertThat(slot.deposit(new ExitStatus(1, 0))).isTrue();
    assertThat(slot.deposit(new ExitStatus(1, 7))).isFalse();
    assertThat(slot.await(Deadline.none()).exitCode()).isZero();
  }

  @Test
  @DisplayName("Should hand every reader the same cached status after the first drain")
  void await_RepeatedReads_ReturnCachedValue() throws Exception {
    final ExitSlot slot = new ExitSlot();
    final ExitStatus status = new ExitStatus(7, 3);
    slot.deposit(status);

    assertThat(slot.isDrained()).isFalse();
    assertThat(slot.await(Deadline.none())).isEqualTo(status);
    assertThat(slot.isDrained()).isTrue();
    assertThat(slot.awaitUninterruptibly()).isEqualTo(status);
    assertThat(slot.await(Deadline.after(Duration.ZERO))).isEqualTo(status);
  }

  @Test
  @DisplayName("Should return null when the deadline expires first")
  void await_DeadlineFirst_ReturnsNull() throws Exception {
    final ExitSlot slot = new ExitSlot();

    final long start = System.nanoTime();
    assertThat(slot.await(Deadline.after(Duration.ofMillis(50)))).isNull();
    assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    assertThat(slot.isDrained()).isFalse();
  }

  @Test
  @DisplayName("Should wake a blocked reader when the status arrives")
  void await_DepositWhileBlocked_Delivers() throws Exception {
    final ExitSlot slot = new ExitSlot();
    final AtomicReference<ExitStatus> seen = new AtomicReference<>();
    final CountDownLatch done = new CountDownLatch(1);

    final Thread reader = new Thread(() -> {
      try {
        seen.set(slot.await(Deadline.none()));
      } catch (final ProcessControlException e) {
        throw new IllegalStateException(e);
      } finally {
        done.countDown();
      }
    });
    reader.start();

    slot.deposit(new ExitStatus(9, 0));

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(seen.get()).isEqualTo(new ExitStatus(9, 0));
  }

  @Test
  @DisplayName("Should treat an interrupt of the reader like an expired deadline")
  void await_Interrupted_ReturnsNullAndKeepsFlag() throws Exception {
    final ExitSlot slot = new ExitSlot();

    Thread.currentThread().interrupt();
    try {
      assertThat(slot.await(Deadline.none())).isNull();
      assertThat(Thread.currentThread().isInterrupted()).isTrue();
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  @DisplayName("Should surface a monitoring failure as a control exception")
  void await_MonitorFailed_Throws() throws Exception {
    final ExitSlot slot = new ExitSlot();
    slot.fail(new IllegalStateException("boom"));

    assertThatThrownBy(() -> slot.await(Deadline.none()))
        .isInstanceOf(ProcessControlException.class)
        .hasRootCauseMessage("boom");
  }
}
