package com.chatsentinel.botcore.ratelimit;

import java.util.Comparator;

/** One window whose count reached its limit. */
public record Violation(WindowKind window, int observedCount, int limit) {

  /** Harsher severity wins; on equal severity the longer window wins. */
  public static final Comparator<Violation> BY_PRECEDENCE =
      Comparator.comparing(Violation::severity).thenComparing(Violation::window);

  public double ratio() {
    return (double) observedCount / limit;
  }

  public Severity severity() {
    return Severity.ofRatio(ratio());
  }

  public String describe() {
    return observedCount + "/" + limit + " " + window.label();
  }
}
