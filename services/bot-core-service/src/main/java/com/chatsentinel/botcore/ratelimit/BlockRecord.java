package com.chatsentinel.botcore.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Temporary admission denial for one sender.
 *
 * <p>Active while {@code now < blockedAt + duration}. Both the lazy lookup and the periodic sweep
 * use {@link #isExpired(Instant)}.
 */
public record BlockRecord(
    String senderId,
    Instant blockedAt,
    Duration duration,
    String reason,
    Severity severity,
    ActionCategory category,
    List<Violation> triggeringViolations) {

  public BlockRecord {
    triggeringViolations =
        triggeringViolations == null ? List.of() : List.copyOf(triggeringViolations);
  }

  public Instant expiresAt() {
    return blockedAt.plus(duration);
  }

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt());
  }

  public Duration remaining(Instant now) {
    Duration left = Duration.between(now, expiresAt());
    return left.isNegative() ? Duration.ZERO : left;
  }
}
