package com.chatsentinel.botcore.ratelimit;

import java.time.Duration;

/** Sliding windows, declared shortest first. */
public enum WindowKind {
  MINUTE(Duration.ofMinutes(1), "perMinute"),
  HOUR(Duration.ofHours(1), "perHour"),
  DAY(Duration.ofDays(1), "perDay");

  private final Duration span;
  private final String label;

  WindowKind(Duration span, String label) {
    this.span = span;
    this.label = label;
  }

  public Duration span() {
    return span;
  }

  public String label() {
    return label;
  }
}
