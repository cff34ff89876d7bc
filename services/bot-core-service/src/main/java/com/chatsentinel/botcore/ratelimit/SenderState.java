package com.chatsentinel.botcore.ratelimit;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/** Per-sender activity; the instance itself is the lock for every read-modify-write on it. */
final class SenderState {

  private final Map<ActionCategory, ActivityWindow> windows = new EnumMap<>(ActionCategory.class);

  ActivityWindow window(ActionCategory category) {
    return windows.computeIfAbsent(category, c -> new ActivityWindow());
  }

  ActivityWindow existingWindow(ActionCategory category) {
    return windows.get(category);
  }

  boolean activeSince(Instant since) {
    for (ActivityWindow w : windows.values()) {
      if (w.countSince(since) > 0) {
        return true;
      }
    }
    return false;
  }
}
