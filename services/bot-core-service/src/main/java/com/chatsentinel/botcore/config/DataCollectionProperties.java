package com.chatsentinel.botcore.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "bot.data-collection")
public record DataCollectionProperties(
    boolean collectPhoneNumbers, boolean collectUrls, boolean collectMedia) {

  public boolean anyEnabled() {
    return collectPhoneNumbers || collectUrls || collectMedia;
  }
}
