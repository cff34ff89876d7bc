package com.chatsentinel.botcore.ratelimit;

import java.util.Locale;

/** What kind of action a sender performs; each kind has its own budget. */
public enum ActionCategory {
  MESSAGE,
  MEDIA,
  COMMAND;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static ActionCategory fromCode(String code) {
    if (code == null || code.isBlank()) {
      return MESSAGE;
    }
    return ActionCategory.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
