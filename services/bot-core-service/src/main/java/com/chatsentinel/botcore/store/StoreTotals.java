package com.chatsentinel.botcore.store;

public record StoreTotals(
    long messages, long users, long groupConversations, long activeTriggers, long spamEvents) {}
