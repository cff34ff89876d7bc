package com.chatsentinel.botcore.transport;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TransportConfig {

  @Bean
  @ConditionalOnMissingBean(ChatTransport.class)
  public ChatTransport loggingChatTransport() {
    return new LoggingChatTransport();
  }
}
