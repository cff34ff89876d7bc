package com.chatsentinel.botcore.spam;

import com.chatsentinel.botcore.config.SpamProperties;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Category-agnostic burst detection over a fixed trailing window.
 *
 * <p>Every processed message is counted, whatever its content kind. A sender is flagged each time
 * the count in the window, current message included, exceeds the threshold. Per-sender updates go
 * through {@link ConcurrentMap#compute} so they are atomic against the idle eviction.
 */
@Service
@Slf4j
public class SpamEscalator {

  private final ConcurrentMap<String, Deque<Instant>> recent = new ConcurrentHashMap<>();
  private final SpamProperties properties;
  private final Clock clock;

  public SpamEscalator(SpamProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public SpamVerdict registerAndCheck(String senderId) {
    Instant now = clock.instant();
    Instant cutoff = now.minus(properties.window());
    AtomicInteger count = new AtomicInteger();
    recent.compute(
        senderId,
        (k, window) -> {
          Deque<Instant> w = window == null ? new ArrayDeque<>() : window;
          purge(w, cutoff);
          w.addLast(now);
          count.set(w.size());
          return w;
        });

    boolean flagged = count.get() > properties.threshold();
    if (flagged) {
      log.info(
          "Spam detected from {}: {} messages in {}", senderId, count.get(), properties.window());
    }
    return new SpamVerdict(flagged, count.get(), properties.threshold());
  }

  public int recentCount(String senderId) {
    Instant cutoff = clock.instant().minus(properties.window());
    Deque<Instant> window =
        recent.computeIfPresent(
            senderId,
            (k, w) -> {
              purge(w, cutoff);
              return w.isEmpty() ? null : w;
            });
    return window == null ? 0 : window.size();
  }

  /** Drops senders with nothing left inside the window. */
  public int evictIdle() {
    Instant cutoff = clock.instant().minus(properties.window());
    AtomicInteger removed = new AtomicInteger();
    for (String sender : recent.keySet()) {
      recent.computeIfPresent(
          sender,
          (k, w) -> {
            purge(w, cutoff);
            if (w.isEmpty()) {
              removed.incrementAndGet();
              return null;
            }
            return w;
          });
    }
    return removed.get();
  }

  public void clear(String senderId) {
    recent.remove(senderId);
  }

  private static void purge(Deque<Instant> window, Instant cutoff) {
    while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
      window.pollFirst();
    }
  }
}
