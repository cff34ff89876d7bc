package com.chatsentinel.botcore.store;

import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.trigger.TriggerRule;
import java.util.List;
import java.util.Map;

/**
 * Persistence port of the bot.
 *
 * <p>Writes keyed by a message id or sender id are insert-or-ignore, so a transport that redelivers
 * an event cannot duplicate stored rows.
 */
public interface MessageStore {

  void saveMessage(NormalizedMessage message);

  void upsertUser(String senderId);

  void touchUserActivity(String senderId);

  /** Active triggers in insertion order. */
  List<TriggerRule> getActiveTriggers();

  /**
   * @return false if a trigger with the same keyword already exists.
   */
  boolean addTrigger(TriggerRule rule);

  /**
   * @return false if no trigger with this keyword exists.
   */
  boolean removeTrigger(String keyword);

  void appendLog(BotLogLevel level, String message, Map<String, Object> context);

  void saveCollectedDataPoint(String kind, String value, String sourceId, String messageId);

  void saveSpamEvent(
      String sourceId, String messageId, String reason, String severity, String action);

  /** Creates the group row on first sight, otherwise overwrites its member count. */
  void updateGroupMembers(String groupId, int memberCount);

  /** Most recently active users first. */
  List<UserRecord> listUsers(int limit, int offset);

  /** Newest messages first. */
  List<StoredMessage> listMessages(int limit, int offset);

  StoreTotals totals();
}
