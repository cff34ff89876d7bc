package com.chatsentinel.botcore.model;

import java.util.Locale;

public enum ContentKind {
  TEXT,
  IMAGE,
  VIDEO,
  AUDIO,
  DOCUMENT,
  STICKER;

  public boolean isMedia() {
    return this != TEXT;
  }

  /** Lower-case name as stored in the {@code messages.content_kind} column. */
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
