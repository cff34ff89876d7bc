package com.chatsentinel.botcore.store;

import java.util.Locale;

public enum BotLogLevel {
  INFO,
  WARN,
  ERROR;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
