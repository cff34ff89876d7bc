package com.chatsentinel.botcore.store;

import java.time.Instant;

/** Row of the message log as returned by the listing API. */
public record StoredMessage(
    String messageId,
    String conversationId,
    String senderId,
    String contentKind,
    String content,
    String mediaUrl,
    String mediaMime,
    Instant sentAt,
    boolean group,
    String replyTo,
    boolean forwarded) {}
