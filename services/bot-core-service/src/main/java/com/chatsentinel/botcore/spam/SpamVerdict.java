package com.chatsentinel.botcore.spam;

/** Result of the spam burst check for one message. */
public record SpamVerdict(boolean flagged, int recentMessages, int threshold) {

  public static final String REASON = "High message frequency";
  public static final String SEVERITY = "medium";
  public static final String ACTION = "flagged";
}
