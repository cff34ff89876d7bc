package com.chatsentinel.botcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bot")
public record BotProperties(String name, String version, String groupSuffix) {

  public BotProperties {
    name = name == null || name.isBlank() ? "Chat Sentinel Bot" : name;
    version = version == null || version.isBlank() ? "1.0.0" : version;
    groupSuffix = groupSuffix == null ? "@g.us" : groupSuffix;
  }

  public static BotProperties defaults() {
    return new BotProperties(null, null, null);
  }
}
