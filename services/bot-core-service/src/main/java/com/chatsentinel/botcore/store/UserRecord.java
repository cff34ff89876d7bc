package com.chatsentinel.botcore.store;

import java.time.Instant;

public record UserRecord(
    String senderId, String phone, Instant firstSeen, Instant lastSeen, long messageCount) {}
