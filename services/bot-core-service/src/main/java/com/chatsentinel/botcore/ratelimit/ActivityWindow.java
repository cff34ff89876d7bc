package com.chatsentinel.botcore.ratelimit;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Action timestamps of one sender in one category, oldest first.
 *
 * <p>Not thread-safe; callers hold the owning {@link SenderState} monitor.
 */
final class ActivityWindow {

  private final Deque<Instant> timestamps = new ArrayDeque<>();
  private Instant lastWarningAt;
  private int warningCount;

  /** Drops entries at or before {@code cutoff}. */
  void purgeOlderThan(Instant cutoff) {
    while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
      timestamps.pollFirst();
    }
  }

  void append(Instant at) {
    timestamps.addLast(at);
  }

  int countSince(Instant since) {
    int n = 0;
    Iterator<Instant> it = timestamps.descendingIterator();
    while (it.hasNext() && it.next().isAfter(since)) {
      n++;
    }
    return n;
  }

  int size() {
    return timestamps.size();
  }

  boolean warningCooldownElapsed(Instant now, Duration cooldown) {
    return lastWarningAt == null || !now.isBefore(lastWarningAt.plus(cooldown));
  }

  void markWarned(Instant now) {
    lastWarningAt = now;
    warningCount++;
  }

  Instant lastWarningAt() {
    return lastWarningAt;
  }

  int warningCount() {
    return warningCount;
  }
}
