package com.chatsentinel.botcore.admin;

import com.chatsentinel.botcore.config.BotProperties;
import com.chatsentinel.botcore.pipeline.InboundEventDispatcher;
import com.chatsentinel.botcore.pipeline.PipelineCounters;
import com.chatsentinel.botcore.ratelimit.ActionCategory;
import com.chatsentinel.botcore.ratelimit.RateLimiter;
import com.chatsentinel.botcore.spam.SpamEscalator;
import com.chatsentinel.botcore.store.BotLogLevel;
import com.chatsentinel.botcore.store.MessageStore;
import com.chatsentinel.botcore.store.StoredMessage;
import com.chatsentinel.botcore.store.UserRecord;
import com.chatsentinel.botcore.transport.ChatTransport;
import com.chatsentinel.botcore.transport.SendOptions;
import com.chatsentinel.botcore.trigger.TriggerEngine;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Read models and manual actions behind the admin API. */
@Service
@Slf4j
public class BotAdminService {

  static final int MAX_PAGE_SIZE = 500;

  private final BotProperties bot;
  private final InboundEventDispatcher dispatcher;
  private final TriggerEngine triggers;
  private final RateLimiter rateLimiter;
  private final SpamEscalator spam;
  private final MessageStore store;
  private final ChatTransport transport;
  private final PipelineCounters counters;
  private final Clock clock;
  private final Instant startedAt;

  public BotAdminService(
      BotProperties bot,
      InboundEventDispatcher dispatcher,
      TriggerEngine triggers,
      RateLimiter rateLimiter,
      SpamEscalator spam,
      MessageStore store,
      ChatTransport transport,
      PipelineCounters counters,
      Clock clock) {
    this.bot = bot;
    this.dispatcher = dispatcher;
    this.triggers = triggers;
    this.rateLimiter = rateLimiter;
    this.spam = spam;
    this.store = store;
    this.transport = transport;
    this.counters = counters;
    this.clock = clock;
    this.startedAt = clock.instant();
  }

  public BotStatus status() {
    return new BotStatus(
        dispatcher.isRunning(),
        bot.name(),
        bot.version(),
        transport.isConnected(),
        transport.state(),
        dispatcher.queueDepth(),
        triggers.size(),
        startedAt,
        Duration.between(startedAt, clock.instant()));
  }

  public BotStats stats() {
    return new BotStats(
        store.totals(), rateLimiter.globalStats(), counters.snapshot(), status());
  }

  /**
   * @throws com.chatsentinel.botcore.transport.TransportException if delivery fails
   */
  public void sendMessage(String conversationId, String text) {
    transport.send(conversationId, text, SendOptions.none());
    log.info("Manual message sent to {}", conversationId);
    try {
      store.appendLog(BotLogLevel.INFO, "Manual message sent", Map.of("to", conversationId));
    } catch (RuntimeException e) {
      log.warn("Failed to append bot log for manual send: {}", e.getMessage());
    }
  }

  public List<UserRecord> listUsers(int limit, int offset) {
    checkPage(limit, offset);
    return store.listUsers(limit, offset);
  }

  public List<StoredMessage> listMessages(int limit, int offset) {
    checkPage(limit, offset);
    return store.listMessages(limit, offset);
  }

  private static void checkPage(int limit, int offset) {
    if (limit < 1 || limit > MAX_PAGE_SIZE) {
      throw new IllegalArgumentException("limit must be between 1 and " + MAX_PAGE_SIZE);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must not be negative");
    }
  }

  public RateLimiter.GlobalStats rateLimitOverview() {
    return rateLimiter.globalStats();
  }

  public List<RateLimiter.BlockedSender> blockedSenders() {
    return rateLimiter.blockedSenders();
  }

  public Optional<RateLimiter.SenderStats> senderStats(String senderId, ActionCategory category) {
    return rateLimiter.senderStats(senderId, category);
  }

  public void resetSender(String senderId) {
    rateLimiter.clearSender(senderId);
    spam.clear(senderId);
  }
}
