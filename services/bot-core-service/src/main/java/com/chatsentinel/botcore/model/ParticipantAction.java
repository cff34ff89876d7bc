package com.chatsentinel.botcore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ParticipantAction {
  ADD,
  REMOVE,
  PROMOTE,
  DEMOTE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  @JsonCreator
  public static ParticipantAction fromCode(String code) {
    if (code == null || code.isBlank()) {
      throw new IllegalArgumentException("participant action is required");
    }
    return ParticipantAction.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
