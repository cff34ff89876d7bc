package com.chatsentinel.botcore.store;

import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.trigger.TriggerRule;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** PostgreSQL-backed store: triggers through JPA, everything else through plain JDBC. */
@Service
@RequiredArgsConstructor
@Slf4j
public class JdbcMessageStore implements MessageStore {

  private static final String INSERT_MESSAGE =
      "INSERT INTO messages(message_id, conversation_id, sender_id, content_kind, content, "
          + "media_url, media_mime, sent_at, is_group, reply_to, is_forwarded) "
          + "VALUES(?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
          + "ON CONFLICT(message_id) DO NOTHING";

  private static final String INSERT_USER =
      "INSERT INTO bot_users(sender_id, phone) VALUES(?, ?) ON CONFLICT(sender_id) DO NOTHING";

  private static final String TOUCH_USER =
      "UPDATE bot_users SET last_seen = NOW(), message_count = message_count + 1, "
          + "updated_at = NOW() WHERE sender_id = ?";

  private static final String UPSERT_GROUP =
      "INSERT INTO chat_groups(group_id, member_count) VALUES(?, ?) "
          + "ON CONFLICT(group_id) DO UPDATE SET member_count = EXCLUDED.member_count, "
          + "updated_at = NOW()";

  private static final String SELECT_USERS =
      "SELECT sender_id, phone, first_seen, last_seen, message_count FROM bot_users "
          + "ORDER BY last_seen DESC NULLS LAST, id DESC LIMIT ? OFFSET ?";

  private static final String SELECT_MESSAGES =
      "SELECT message_id, conversation_id, sender_id, content_kind, content, media_url, "
          + "media_mime, sent_at, is_group, reply_to, is_forwarded FROM messages "
          + "ORDER BY sent_at DESC, id DESC LIMIT ? OFFSET ?";

  private final JdbcTemplate jdbc;
  private final TriggerRepository triggers;
  private final ObjectMapper objectMapper;

  @Override
  @Transactional
  public void saveMessage(NormalizedMessage m) {
    int inserted =
        jdbc.update(
            INSERT_MESSAGE,
            m.id(),
            m.conversationId(),
            m.senderId(),
            m.contentKind().code(),
            m.text(),
            m.mediaRef() == null ? null : m.mediaRef().url(),
            m.mediaRef() == null ? null : m.mediaRef().mimeType(),
            Timestamp.from(m.timestamp()),
            m.groupConversation(),
            m.replyToId(),
            m.forwarded());
    if (inserted == 0) {
      log.debug("Message {} already stored", m.id());
    }
  }

  @Override
  @Transactional
  public void upsertUser(String senderId) {
    jdbc.update(INSERT_USER, senderId, phoneOf(senderId));
  }

  @Override
  @Transactional
  public void touchUserActivity(String senderId) {
    jdbc.update(TOUCH_USER, senderId);
  }

  @Override
  @Transactional(readOnly = true)
  public List<TriggerRule> getActiveTriggers() {
    return triggers.findAllByActiveTrueOrderByIdAsc().stream().map(TriggerEntity::toRule).toList();
  }

  @Override
  @Transactional
  public boolean addTrigger(TriggerRule rule) {
    if (triggers.existsByKeyword(rule.keyword())) {
      return false;
    }
    triggers.save(
        new TriggerEntity(rule.keyword(), rule.response(), rule.matchKind(), rule.caseSensitive()));
    return true;
  }

  @Override
  @Transactional
  public boolean removeTrigger(String keyword) {
    return triggers.deleteByKeyword(keyword) > 0;
  }

  @Override
  @Transactional
  public void appendLog(BotLogLevel level, String message, Map<String, Object> context) {
    jdbc.update(
        "INSERT INTO bot_logs(level, message, context) VALUES(?, ?, CAST(? AS jsonb))",
        level.code(),
        message,
        toJson(context));
  }

  @Override
  @Transactional
  public void saveCollectedDataPoint(String kind, String value, String sourceId, String messageId) {
    jdbc.update(
        "INSERT INTO collected_data(kind, value, source_id, message_id) VALUES(?, ?, ?, ?)",
        kind,
        value,
        sourceId,
        messageId);
  }

  @Override
  @Transactional
  public void saveSpamEvent(
      String sourceId, String messageId, String reason, String severity, String action) {
    jdbc.update(
        "INSERT INTO spam_events(source_id, message_id, reason, severity, action_taken) "
            + "VALUES(?, ?, ?, ?, ?)",
        sourceId,
        messageId,
        reason,
        severity,
        action);
  }

  @Override
  @Transactional
  public void updateGroupMembers(String groupId, int memberCount) {
    jdbc.update(UPSERT_GROUP, groupId, memberCount);
  }

  @Override
  @Transactional(readOnly = true)
  public List<UserRecord> listUsers(int limit, int offset) {
    return jdbc.query(
        SELECT_USERS,
        (rs, i) ->
            new UserRecord(
                rs.getString(1),
                rs.getString(2),
                instant(rs, 3),
                instant(rs, 4),
                rs.getLong(5)),
        limit,
        offset);
  }

  @Override
  @Transactional(readOnly = true)
  public List<StoredMessage> listMessages(int limit, int offset) {
    return jdbc.query(
        SELECT_MESSAGES,
        (rs, i) ->
            new StoredMessage(
                rs.getString(1),
                rs.getString(2),
                rs.getString(3),
                rs.getString(4),
                rs.getString(5),
                rs.getString(6),
                rs.getString(7),
                instant(rs, 8),
                rs.getBoolean(9),
                rs.getString(10),
                rs.getBoolean(11)),
        limit,
        offset);
  }

  @Override
  @Transactional(readOnly = true)
  public StoreTotals totals() {
    return new StoreTotals(
        count("SELECT COUNT(*) FROM messages"),
        count("SELECT COUNT(*) FROM bot_users"),
        count("SELECT COUNT(DISTINCT conversation_id) FROM messages WHERE is_group"),
        triggers.countByActiveTrue(),
        count("SELECT COUNT(*) FROM spam_events"));
  }

  private long count(String sql) {
    Long n = jdbc.queryForObject(sql, Long.class);
    return n == null ? 0L : n;
  }

  private static Instant instant(ResultSet rs, int column) throws SQLException {
    Timestamp ts = rs.getTimestamp(column);
    return ts == null ? null : ts.toInstant();
  }

  private String toJson(Map<String, Object> context) {
    if (context == null || context.isEmpty()) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(context);
    } catch (JsonProcessingException e) {
      log.warn("Failed to serialize log context: {}", e.getMessage());
      return null;
    }
  }

  private static String phoneOf(String senderId) {
    if (senderId == null) {
      return null;
    }
    int at = senderId.indexOf('@');
    return at < 0 ? senderId : senderId.substring(0, at);
  }
}
