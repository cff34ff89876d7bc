package com.chatsentinel.botcore.ratelimit;

import com.chatsentinel.botcore.spam.SpamEscalator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodic counterpart of the lazy expiry checks. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitMaintenance {

  private final RateLimiter rateLimiter;
  private final SpamEscalator spamEscalator;

  @Scheduled(
      fixedDelayString = "${bot.rate-limit.sweep-interval:PT10M}",
      initialDelayString = "${bot.rate-limit.sweep-interval:PT10M}")
  public void sweep() {
    try {
      int blocks = rateLimiter.sweepExpiredBlocks();
      int idle = spamEscalator.evictIdle();
      log.debug("Maintenance sweep: {} expired block(s), {} idle spam window(s)", blocks, idle);
    } catch (Exception e) {
      log.warn("Rate limit maintenance sweep failed: {}", e.getMessage());
    }
  }
}
