package com.chatsentinel.botcore.trigger;

import com.chatsentinel.botcore.store.MessageStore;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Admin operations on trigger rules.
 *
 * <p>Writes go to the store first, then the engine snapshot is rebuilt from the store, so the next
 * {@link TriggerEngine#match} already sees the change. Writers are serialized; readers are not
 * affected.
 */
@Service
@Slf4j
public class TriggerService {

  private final MessageStore store;
  private final TriggerEngine engine;

  public TriggerService(MessageStore store, TriggerEngine engine) {
    this.store = store;
    this.engine = engine;
  }

  @EventListener(ApplicationReadyEvent.class)
  public void loadOnStartup() {
    try {
      reload();
    } catch (Exception e) {
      log.warn("Failed to load triggers on startup: {}", e.getMessage());
    }
  }

  public synchronized int reload() {
    engine.replaceAll(store.getActiveTriggers());
    return engine.size();
  }

  public synchronized TriggerRule add(
      String keyword, String response, MatchKind matchKind, boolean caseSensitive) {
    if (keyword == null || keyword.isBlank()) {
      throw new IllegalArgumentException("keyword is required");
    }
    if (response == null || response.isBlank()) {
      throw new IllegalArgumentException("response is required");
    }
    TriggerRule rule = TriggerRule.active(keyword, response, matchKind, caseSensitive);
    if (!store.addTrigger(rule)) {
      throw new DuplicateKeywordException(keyword);
    }
    reload();
    log.info("Trigger added: '{}' ({})", keyword, rule.matchKind().code());
    return rule;
  }

  public synchronized void remove(String keyword) {
    if (!store.removeTrigger(keyword)) {
      throw new TriggerNotFoundException(keyword);
    }
    reload();
    log.info("Trigger removed: '{}'", keyword);
  }

  public List<TriggerRule> list() {
    return engine.rules();
  }
}
