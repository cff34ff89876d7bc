package com.chatsentinel.botcore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

/** Members added to, removed from, promoted or demoted in a group conversation. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupParticipantsEvent(
    String groupId, ParticipantAction action, List<String> participants) implements InboundEvent {

  public GroupParticipantsEvent {
    participants =
        participants == null
            ? List.of()
            : participants.stream().filter(Objects::nonNull).toList();
  }

  @Override
  public String conversationKey() {
    return groupId;
  }

  @Override
  public String eventId() {
    return "group-" + (action == null ? "unknown" : action.code()) + ":" + groupId;
  }
}
