package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.model.GroupParticipantsEvent;
import com.chatsentinel.botcore.model.ParticipantAction;
import com.chatsentinel.botcore.store.BotLogLevel;
import com.chatsentinel.botcore.store.MessageStore;
import com.chatsentinel.botcore.transport.ChatTransport;
import com.chatsentinel.botcore.transport.SendOptions;
import java.util.Map;
import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reacts to group membership changes: greets new members, audits joins and leaves, and keeps the
 * stored member count in line with the network.
 */
@Service
@Slf4j
public class GroupMembershipHandler {

  static final String WELCOME_TEMPLATE = "👋 Welcome to the group, @%s!";

  private final ChatTransport transport;
  private final MessageStore store;

  public GroupMembershipHandler(ChatTransport transport, MessageStore store) {
    this.transport = transport;
    this.store = store;
  }

  public void handle(GroupParticipantsEvent event) {
    if (event.groupId() == null || event.groupId().isBlank() || event.action() == null) {
      log.warn("Ignoring incomplete group update {}", event);
      return;
    }
    for (String member : event.participants()) {
      try {
        onParticipant(event.groupId(), event.action(), member);
      } catch (RuntimeException e) {
        log.warn(
            "Group update for {} in {} failed: {}", member, event.groupId(), e.getMessage());
        appendLogQuietly(
            BotLogLevel.ERROR,
            "Group update processing failed",
            Map.of("group", event.groupId(), "member", member, "error", String.valueOf(e)));
      }
    }
    refreshMemberCount(event.groupId());
  }

  private void onParticipant(String groupId, ParticipantAction action, String member) {
    switch (action) {
      case ADD -> {
        transport.send(
            groupId,
            String.format(WELCOME_TEMPLATE, localPart(member)),
            SendOptions.mentioning(member));
        appendLogQuietly(
            BotLogLevel.INFO,
            "New member joined group",
            Map.of("group", groupId, "member", member));
      }
      case REMOVE -> appendLogQuietly(
          BotLogLevel.INFO, "Member left group", Map.of("group", groupId, "member", member));
      default -> log.debug("Group {}: {} {}", groupId, action.code(), member);
    }
  }

  private void refreshMemberCount(String groupId) {
    try {
      OptionalInt count = transport.groupMemberCount(groupId);
      if (count.isPresent()) {
        store.updateGroupMembers(groupId, count.getAsInt());
      }
    } catch (RuntimeException e) {
      log.warn("Could not refresh member count of {}: {}", groupId, e.getMessage());
    }
  }

  private void appendLogQuietly(BotLogLevel level, String text, Map<String, Object> context) {
    try {
      store.appendLog(level, text, context);
    } catch (RuntimeException e) {
      log.warn("Failed to append bot log '{}': {}", text, e.getMessage());
    }
  }

  private static String localPart(String id) {
    int at = id.indexOf('@');
    return at < 0 ? id : id.substring(0, at);
  }
}
