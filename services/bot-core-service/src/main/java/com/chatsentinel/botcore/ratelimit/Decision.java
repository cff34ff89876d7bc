package com.chatsentinel.botcore.ratelimit;

import java.time.Duration;
import java.util.List;

/**
 * Admission outcome. A rate-limit or spam violation is a regular outcome here, not an exception.
 *
 * <p>{@code warning} is only set on allowed decisions; {@code reason}, {@code severity}, {@code
 * remaining} and {@code violations} only on blocked ones.
 */
public record Decision(
    Outcome outcome,
    String warning,
    String reason,
    Severity severity,
    Duration remaining,
    List<Violation> violations) {

  public enum Outcome {
    ALLOWED,
    BLOCKED
  }

  private static final Decision ALLOWED =
      new Decision(Outcome.ALLOWED, null, null, null, null, List.of());

  public static Decision allowed() {
    return ALLOWED;
  }

  public static Decision allowedWithWarning(String warning) {
    return new Decision(Outcome.ALLOWED, warning, null, null, null, List.of());
  }

  public static Decision blocked(
      String reason, Severity severity, Duration remaining, List<Violation> violations) {
    return new Decision(
        Outcome.BLOCKED,
        null,
        reason,
        severity,
        remaining,
        violations == null ? List.of() : List.copyOf(violations));
  }

  public boolean isAllowed() {
    return outcome == Outcome.ALLOWED;
  }

  public boolean hasWarning() {
    return warning != null;
  }
}
