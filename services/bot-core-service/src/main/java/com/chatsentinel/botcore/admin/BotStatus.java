package com.chatsentinel.botcore.admin;

import java.time.Duration;
import java.time.Instant;

public record BotStatus(
    boolean running,
    String name,
    String version,
    boolean transportConnected,
    String transportState,
    int queueDepth,
    int activeTriggers,
    Instant startedAt,
    Duration uptime) {}
