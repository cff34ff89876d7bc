package com.chatsentinel.botcore.trigger;

/** Keyword to auto-response mapping. {@code keyword} is unique across all rules. */
public record TriggerRule(
    String keyword, String response, MatchKind matchKind, boolean caseSensitive, boolean active) {

  public TriggerRule {
    matchKind = matchKind == null ? MatchKind.EXACT : matchKind;
  }

  public static TriggerRule active(
      String keyword, String response, MatchKind matchKind, boolean caseSensitive) {
    return new TriggerRule(keyword, response, matchKind, caseSensitive, true);
  }
}
