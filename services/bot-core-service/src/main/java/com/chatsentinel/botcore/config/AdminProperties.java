package com.chatsentinel.botcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/** Shared secret that callers of /api/** present in the X-Admin-Token header. */
@ConfigurationProperties(prefix = "bot.admin")
public record AdminProperties(String token) {

  public AdminProperties {
    token = token == null ? "" : token.trim();
  }

  public boolean tokenConfigured() {
    return !token.isEmpty();
  }
}
