package com.chatsentinel.botcore.ratelimit;

import com.chatsentinel.botcore.config.RateLimitProperties;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Per-sender sliding-window limiter with block escalation.
 *
 * <p>Every check-then-update for a sender runs while holding that sender's {@link SenderState}
 * monitor, so two in-flight messages of the same sender can never both slip under a limit.
 * Admission ({@link #canProceed}) and recording ({@link #record}) are separate operations; {@link
 * #tryAcquire} does both atomically.
 */
@Service
@Slf4j
public class RateLimiter {

  private static final String WARNING_TEMPLATE =
      "⚠️ Warning: You're sending messages quickly (%d/%d per minute). "
          + "Please slow down to avoid being temporarily blocked.";

  private final RateLimitStateStore store;
  private final RateLimitProperties properties;
  private final Clock clock;

  private volatile Map<ActionCategory, CategoryLimits> limits;

  public RateLimiter(RateLimitStateStore store, RateLimitProperties properties, Clock clock) {
    this.store = store;
    this.properties = properties;
    this.clock = clock;
    this.limits = new EnumMap<>(properties.limits());
  }

  /** Admission check without recording the action. May create a block or consume a warning. */
  public Decision canProceed(String senderId, ActionCategory category) {
    Instant now = clock.instant();
    SenderState state = store.stateFor(senderId);
    synchronized (state) {
      return evaluate(senderId, category, state, now);
    }
  }

  public void record(String senderId, ActionCategory category) {
    Instant now = clock.instant();
    SenderState state = store.stateFor(senderId);
    synchronized (state) {
      ActivityWindow window = state.window(category);
      window.purgeOlderThan(now.minus(properties.retention()));
      window.append(now);
    }
  }

  /** {@link #canProceed} followed by {@link #record} when allowed, as one atomic step. */
  public Decision tryAcquire(String senderId, ActionCategory category) {
    Instant now = clock.instant();
    SenderState state = store.stateFor(senderId);
    synchronized (state) {
      Decision decision = evaluate(senderId, category, state, now);
      if (decision.isAllowed()) {
        state.window(category).append(now);
      }
      return decision;
    }
  }

  public boolean isBlocked(String senderId) {
    return activeBlock(senderId, clock.instant()) != null;
  }

  public Optional<BlockRecord> blockInfo(String senderId) {
    return Optional.ofNullable(activeBlock(senderId, clock.instant()));
  }

  /** Deletes every block whose duration has elapsed. */
  public int sweepExpiredBlocks() {
    int removed = store.removeExpiredBlocks(clock.instant());
    if (removed > 0) {
      log.debug("Removed {} expired block record(s)", removed);
    }
    return removed;
  }

  public List<BlockedSender> blockedSenders() {
    Instant now = clock.instant();
    List<BlockedSender> out = new ArrayList<>();
    for (BlockRecord rec : List.copyOf(store.blocks().values())) {
      if (rec.isExpired(now)) {
        store.removeBlock(rec.senderId(), rec);
        continue;
      }
      out.add(
          new BlockedSender(
              rec.senderId(),
              rec.reason(),
              rec.severity(),
              rec.category(),
              rec.blockedAt(),
              rec.expiresAt(),
              rec.remaining(now)));
    }
    out.sort(Comparator.comparing(BlockedSender::blockedAt));
    return out;
  }

  public Optional<SenderStats> senderStats(String senderId, ActionCategory category) {
    SenderState state = store.existingState(senderId);
    if (state == null) {
      return Optional.empty();
    }
    Instant now = clock.instant();
    SenderStats stats;
    synchronized (state) {
      ActivityWindow window = state.existingWindow(category);
      if (window == null) {
        stats = new SenderStats(senderId, category, 0, 0, 0, 0, null, 0, false);
      } else {
        window.purgeOlderThan(now.minus(properties.retention()));
        stats =
            new SenderStats(
                senderId,
                category,
                window.countSince(now.minus(WindowKind.MINUTE.span())),
                window.countSince(now.minus(WindowKind.HOUR.span())),
                window.countSince(now.minus(WindowKind.DAY.span())),
                window.size(),
                window.lastWarningAt(),
                window.warningCount(),
                false);
      }
    }
    boolean blocked = activeBlock(senderId, now) != null;
    return Optional.of(stats.withBlocked(blocked));
  }

  public GlobalStats globalStats() {
    Instant hourAgo = clock.instant().minus(WindowKind.HOUR.span());
    int active = 0;
    for (SenderState state : store.states()) {
      synchronized (state) {
        if (state.activeSince(hourAgo)) {
          active++;
        }
      }
    }
    return new GlobalStats(store.trackedSenders(), blockedSenders().size(), active);
  }

  /** Administrative reset: forgets all activity, warnings and any block of the sender. */
  public void clearSender(String senderId) {
    store.clear(senderId);
    log.info("Rate limit data cleared for sender {}", senderId);
  }

  public synchronized void updateLimits(ActionCategory category, CategoryLimits newLimits) {
    Map<ActionCategory, CategoryLimits> next = new EnumMap<>(limits);
    next.put(category, newLimits);
    limits = next;
    log.info("Rate limits for {} updated to {}", category.code(), newLimits);
  }

  public CategoryLimits limitsFor(ActionCategory category) {
    return limits.get(category);
  }

  private Decision evaluate(
      String senderId, ActionCategory category, SenderState state, Instant now) {
    BlockRecord active = activeBlock(senderId, now);
    if (active != null) {
      return Decision.blocked(
          active.reason(), active.severity(), active.remaining(now), active.triggeringViolations());
    }

    ActivityWindow window = state.window(category);
    window.purgeOlderThan(now.minus(properties.retention()));
    CategoryLimits categoryLimits = limitsFor(category);

    List<Violation> violations = new ArrayList<>();
    for (WindowKind kind : WindowKind.values()) {
      int count = window.countSince(now.minus(kind.span()));
      int limit = categoryLimits.limitFor(kind);
      if (count >= limit) {
        violations.add(new Violation(kind, count, limit));
      }
    }
    if (!violations.isEmpty()) {
      return block(senderId, category, violations, now);
    }

    // the attempt being admitted counts toward the warning threshold
    int perMinute = window.countSince(now.minus(WindowKind.MINUTE.span())) + 1;
    int threshold =
        (int) Math.floor(categoryLimits.perMinute() * properties.warningThreshold(category));
    if (perMinute >= threshold
        && window.warningCooldownElapsed(now, properties.warningCooldown())) {
      window.markWarned(now);
      return Decision.allowedWithWarning(
          String.format(WARNING_TEMPLATE, perMinute, categoryLimits.perMinute()));
    }
    return Decision.allowed();
  }

  private Decision block(
      String senderId, ActionCategory category, List<Violation> violations, Instant now) {
    Violation top = violations.stream().max(Violation.BY_PRECEDENCE).orElseThrow();
    Severity severity = top.severity();
    Duration duration = properties.blockDuration(severity);
    String reason = "Rate limit exceeded: " + top.describe();

    store.putBlock(
        new BlockRecord(senderId, now, duration, reason, severity, category, violations));
    log.info(
        "Sender {} blocked for {} on {} ({}, severity={})",
        senderId,
        duration,
        category.code(),
        reason,
        severity);
    return Decision.blocked(reason, severity, duration, violations);
  }

  private BlockRecord activeBlock(String senderId, Instant now) {
    BlockRecord rec = store.block(senderId);
    if (rec == null) {
      return null;
    }
    if (rec.isExpired(now)) {
      store.removeBlock(senderId, rec);
      return null;
    }
    return rec;
  }

  public record SenderStats(
      String senderId,
      ActionCategory category,
      int perMinute,
      int perHour,
      int perDay,
      int retained,
      Instant lastWarningAt,
      int warningCount,
      boolean blocked) {

    SenderStats withBlocked(boolean value) {
      return new SenderStats(
          senderId,
          category,
          perMinute,
          perHour,
          perDay,
          retained,
          lastWarningAt,
          warningCount,
          value);
    }
  }

  public record GlobalStats(int trackedSenders, int blockedSenders, int activeSenders) {}

  public record BlockedSender(
      String senderId,
      String reason,
      Severity severity,
      ActionCategory category,
      Instant blockedAt,
      Instant expiresAt,
      Duration remaining) {}
}
