package com.chatsentinel.botcore.transport;

import java.util.OptionalInt;
import lombok.extern.slf4j.Slf4j;

/**
 * Fallback used when no network adapter is wired in: nothing is delivered, outbound messages are
 * only logged.
 */
@Slf4j
public class LoggingChatTransport implements ChatTransport {

  @Override
  public void send(String conversationId, String content, SendOptions options) {
    log.info(
        "Transport is not configured; skip sending to {} (mentions={}): {}",
        conversationId,
        options == null ? 0 : options.mentions().size(),
        content);
  }

  @Override
  public OptionalInt groupMemberCount(String groupId) {
    return OptionalInt.empty();
  }

  @Override
  public boolean isConnected() {
    return false;
  }

  @Override
  public String state() {
    return "not-configured";
  }
}
