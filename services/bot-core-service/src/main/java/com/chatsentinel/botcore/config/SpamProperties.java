package com.chatsentinel.botcore.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Coarse burst detection: more than {@code threshold} messages inside {@code window}. */
@ConfigurationProperties(prefix = "bot.spam")
public record SpamProperties(Integer threshold, Duration window) {

  public SpamProperties {
    threshold = threshold == null ? 5 : threshold;
    window = window == null ? Duration.ofMinutes(5) : window;
  }

  public static SpamProperties defaults() {
    return new SpamProperties(null, null);
  }
}
