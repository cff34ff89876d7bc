package com.chatsentinel.botcore.admin;

import com.chatsentinel.botcore.pipeline.PipelineCounters;
import com.chatsentinel.botcore.ratelimit.RateLimiter;
import com.chatsentinel.botcore.store.StoreTotals;

public record BotStats(
    StoreTotals total,
    RateLimiter.GlobalStats rateLimits,
    PipelineCounters.Snapshot pipeline,
    BotStatus status) {}
