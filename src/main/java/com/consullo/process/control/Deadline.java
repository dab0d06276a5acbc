package com.consullo.process.control;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;

/**
 * Expiry signal for a blocking controller call: a point in time, an explicit cancellation, or
 * both. Whichever happens first expires the deadline, and expiry is permanent.
 *
 * <p>One deadline may be shared by several calls, e.g. a stop followed by the restart it
 * belongs to.
 *
 * @since 1.0
 */
public final class Deadline {

  private static final Deadline NONE = new Deadline(null);

  // Longest delay a nanosecond timer can represent.
  private static final Duration MAX_TIMER = Duration.ofNanos(Long.MAX_VALUE);

  private final Instant expiresAt;
  private final CompletableFuture<Void> expiry = new CompletableFuture<>();

  private Deadline(final Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  /** Never expires and cannot be cancelled. */
  public static Deadline none() {
    return NONE;
  }

  /** Expires only through {@link #cancel()}. */
  public static Deadline cancellable() {
    return new Deadline(null);
  }

  /**
   * Expires once the timeout has elapsed. A zero or negative timeout is already expired.
   *
   * @param timeout time from now
   * @return deadline
   */
  public static Deadline after(final Duration timeout) {
    Validate.notNull(timeout, "timeout must not be null");
    final Deadline deadline = new Deadline(saturatedPlus(Instant.now(), timeout));
    if (timeout.isNegative() || timeout.isZero()) {
      deadline.expiry.complete(null);
    } else if (timeout.compareTo(MAX_TIMER) < 0) {
      deadline.expiry.completeOnTimeout(null, timeout.toNanos(), TimeUnit.NANOSECONDS);
    }
    // Beyond MAX_TIMER the deadline is unreachable in practice; only cancel() expires it.
    return deadline;
  }

  public static Deadline at(final Instant instant) {
    Validate.notNull(instant, "instant must not be null");
    return after(Duration.between(Instant.now(), instant));
  }

  /**
   * Expire now. Callers blocked on this deadline escalate as if it had timed out.
   */
  public void cancel() {
    if (this == NONE) {
      throw new UnsupportedOperationException("Deadline.none() cannot be cancelled");
    }
    this.expiry.complete(null);
  }

  public boolean isExpired() {
    return this.expiry.isDone();
  }

  public Optional<Instant> expiresAt() {
    return Optional.ofNullable(this.expiresAt);
  }

  private static Instant saturatedPlus(final Instant base, final Duration timeout) {
    try {
      return base.plus(timeout);
    } catch (final DateTimeException | ArithmeticException e) {
      return timeout.isNegative() ? Instant.MIN : Instant.MAX;
    }
  }

  boolean isUnbounded() {
    return this == NONE;
  }

  /** Completes when the deadline expires. Never completes for {@link #none()}. */
  CompletableFuture<Void> expiry() {
    return this.expiry;
  }

  @Override
  public String toString() {
    if (this.expiresAt == null) {
      return isExpired() ? "Deadline[cancelled]" : "Deadline[none]";
    }
    return "Deadline[" + this.expiresAt + (isExpired() ? ", expired]" : "]");
  }
}
