package com.chatsentinel.botcore.model;

import java.time.Instant;

/**
 * Canonical form of one inbound chat event.
 *
 * <p>Built once by the normalizer and never mutated. {@code text} is never null (empty when the
 * event carried no text or caption); {@code mediaRef} is present only for media content kinds.
 */
public record NormalizedMessage(
    String id,
    String conversationId,
    String senderId,
    ContentKind contentKind,
    String text,
    MediaRef mediaRef,
    Instant timestamp,
    boolean groupConversation,
    String replyToId,
    boolean forwarded) {

  public NormalizedMessage {
    text = text == null ? "" : text;
    contentKind = contentKind == null ? ContentKind.TEXT : contentKind;
  }

  public boolean hasText() {
    return !text.isEmpty();
  }
}
