package com.chatsentinel.botcore.trigger;

import java.util.Locale;

public enum MatchKind {
  EXACT,
  CONTAINS,
  REGEX;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static MatchKind fromCode(String code) {
    if (code == null || code.isBlank()) {
      return EXACT;
    }
    return MatchKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
  }
}
