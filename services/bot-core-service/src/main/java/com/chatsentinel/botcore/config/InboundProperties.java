package com.chatsentinel.botcore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Inbound queue sizing. {@code shutdownGrace} bounds how long stopping waits for the lanes to work
 * off events they already accepted.
 */
@ConfigurationProperties(prefix = "bot.inbound")
public record InboundProperties(
    Integer queueCapacity, Integer workers, Duration offerTimeout, Duration shutdownGrace) {

  public InboundProperties {
    queueCapacity = queueCapacity == null || queueCapacity < 1 ? 1000 : queueCapacity;
    workers = workers == null || workers < 1 ? 4 : workers;
    offerTimeout = offerTimeout == null ? Duration.ofSeconds(5) : offerTimeout;
    shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(10) : shutdownGrace;
  }

  public static InboundProperties defaults() {
    return new InboundProperties(null, null, null, null);
  }
}
