package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.model.RawMessageEvent;
import com.chatsentinel.botcore.normalize.MessageNormalizer;
import com.chatsentinel.botcore.ratelimit.ActionCategory;
import com.chatsentinel.botcore.ratelimit.Decision;
import com.chatsentinel.botcore.ratelimit.RateLimiter;
import com.chatsentinel.botcore.spam.SpamEscalator;
import com.chatsentinel.botcore.spam.SpamVerdict;
import com.chatsentinel.botcore.store.BotLogLevel;
import com.chatsentinel.botcore.store.MessageStore;
import com.chatsentinel.botcore.transport.ChatTransport;
import com.chatsentinel.botcore.transport.SendOptions;
import com.chatsentinel.botcore.trigger.TriggerEngine;
import com.chatsentinel.botcore.trigger.TriggerRule;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Drives one inbound event through the bot.
 *
 * <p>normalize, admission, trigger responses, persistence, sender activity, data collection, spam
 * check. Once a message is admitted every later stage runs in isolation: a failing stage is logged
 * and counted, and the remaining stages still run.
 */
@Service
@Slf4j
public class MessagePipeline {

  private final MessageNormalizer normalizer;
  private final RateLimiter rateLimiter;
  private final TriggerEngine triggers;
  private final SpamEscalator spam;
  private final DataCollector dataCollector;
  private final MessageStore store;
  private final ChatTransport transport;
  private final PipelineCounters counters;

  public MessagePipeline(
      MessageNormalizer normalizer,
      RateLimiter rateLimiter,
      TriggerEngine triggers,
      SpamEscalator spam,
      DataCollector dataCollector,
      MessageStore store,
      ChatTransport transport,
      PipelineCounters counters) {
    this.normalizer = normalizer;
    this.rateLimiter = rateLimiter;
    this.triggers = triggers;
    this.spam = spam;
    this.dataCollector = dataCollector;
    this.store = store;
    this.transport = transport;
    this.counters = counters;
  }

  public void handle(RawMessageEvent event) {
    counters.received.incrementAndGet();
    Optional<NormalizedMessage> normalized = normalizer.normalize(event);
    if (normalized.isEmpty()) {
      counters.skipped.incrementAndGet();
      return;
    }
    process(normalized.get());
  }

  void process(NormalizedMessage message) {
    ActionCategory category =
        message.contentKind().isMedia() ? ActionCategory.MEDIA : ActionCategory.MESSAGE;
    Decision decision = rateLimiter.tryAcquire(message.senderId(), category);

    if (!decision.isAllowed()) {
      counters.rejected.incrementAndGet();
      log.warn(
          "Message {} from {} rejected: {} (remaining {})",
          message.id(),
          message.senderId(),
          decision.reason(),
          decision.remaining());
      appendLogQuietly(
          BotLogLevel.WARN,
          "Message rejected by rate limiter",
          context(
              "messageId", message.id(),
              "sender", message.senderId(),
              "reason", decision.reason(),
              "severity", decision.severity()));
      return;
    }

    if (decision.hasWarning()) {
      stage(
          "rate-limit warning",
          message,
          () -> transport.send(message.conversationId(), decision.warning(), SendOptions.none()));
    }
    stage("triggers", message, () -> dispatchTriggers(message));
    stage("persist", message, () -> store.saveMessage(message));
    stage(
        "user activity",
        message,
        () -> {
          store.upsertUser(message.senderId());
          store.touchUserActivity(message.senderId());
        });
    stage("data collection", message, () -> dataCollector.collect(message));
    stage("spam check", message, () -> checkSpam(message));

    counters.processed.incrementAndGet();
    appendLogQuietly(
        BotLogLevel.INFO,
        "Message processed",
        context(
            "messageId", message.id(),
            "sender", message.senderId(),
            "isGroup", message.groupConversation(),
            "type", message.contentKind().code()));
  }

  private void dispatchTriggers(NormalizedMessage message) {
    List<TriggerRule> fired = triggers.match(message);
    if (fired.isEmpty()) {
      return;
    }
    Decision command = rateLimiter.tryAcquire(message.senderId(), ActionCategory.COMMAND);
    if (!command.isAllowed()) {
      log.info(
          "Suppressed {} trigger response(s) for {}: {}",
          fired.size(),
          message.senderId(),
          command.reason());
      return;
    }
    if (command.hasWarning()) {
      stage(
          "command warning",
          message,
          () -> transport.send(message.conversationId(), command.warning(), SendOptions.none()));
    }
    for (TriggerRule rule : fired) {
      try {
        transport.send(message.conversationId(), rule.response(), SendOptions.none());
        counters.triggerResponses.incrementAndGet();
        appendLogQuietly(
            BotLogLevel.INFO,
            "Trigger response sent",
            context(
                "trigger", rule.keyword(),
                "response", rule.response(),
                "to", message.conversationId()));
      } catch (RuntimeException e) {
        log.warn(
            "Failed to send response of trigger '{}' to {}: {}",
            rule.keyword(),
            message.conversationId(),
            e.getMessage());
      }
    }
  }

  private void checkSpam(NormalizedMessage message) {
    SpamVerdict verdict = spam.registerAndCheck(message.senderId());
    if (!verdict.flagged()) {
      return;
    }
    counters.spamFlags.incrementAndGet();
    store.saveSpamEvent(
        message.senderId(),
        message.id(),
        SpamVerdict.REASON,
        SpamVerdict.SEVERITY,
        SpamVerdict.ACTION);
    if (message.groupConversation()) {
      String handle = localPart(message.senderId());
      transport.send(
          message.conversationId(),
          "⚠️ @" + handle + ", please slow down your messages to avoid being flagged as spam.",
          SendOptions.mentioning(message.senderId()));
    }
  }

  private void stage(String name, NormalizedMessage message, Runnable body) {
    try {
      body.run();
    } catch (RuntimeException | StackOverflowError e) {
      counters.failedStages.incrementAndGet();
      log.warn("Stage '{}' failed for message {}: {}", name, message.id(), e.toString());
      appendLogQuietly(
          BotLogLevel.ERROR,
          "Message processing failed",
          context("stage", name, "messageId", message.id(), "error", e.toString()));
    }
  }

  private void appendLogQuietly(BotLogLevel level, String text, Map<String, Object> context) {
    try {
      store.appendLog(level, text, context);
    } catch (RuntimeException e) {
      log.warn("Failed to append bot log '{}': {}", text, e.getMessage());
    }
  }

  private static Map<String, Object> context(Object... kv) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (int i = 0; i + 1 < kv.length; i += 2) {
      out.put(String.valueOf(kv[i]), kv[i + 1]);
    }
    return out;
  }

  private static String localPart(String senderId) {
    int at = senderId.indexOf('@');
    return at < 0 ? senderId : senderId.substring(0, at);
  }
}
