package com.chatsentinel.botcore.ratelimit;

/** Violation severity, ordered from mildest to harshest. */
public enum Severity {
  WARNING,
  SOFT,
  HARD,
  SEVERE;

  public static Severity ofRatio(double ratio) {
    if (ratio >= 2.0) {
      return SEVERE;
    }
    if (ratio >= 1.5) {
      return HARD;
    }
    if (ratio >= 1.0) {
      return SOFT;
    }
    return WARNING;
  }
}
