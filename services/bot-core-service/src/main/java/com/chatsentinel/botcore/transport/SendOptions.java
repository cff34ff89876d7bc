package com.chatsentinel.botcore.transport;

import java.util.List;

/** Extra send parameters; {@code mentions} are sender ids to tag in the outgoing text. */
public record SendOptions(List<String> mentions) {

  private static final SendOptions NONE = new SendOptions(List.of());

  public SendOptions {
    mentions = mentions == null ? List.of() : List.copyOf(mentions);
  }

  public static SendOptions none() {
    return NONE;
  }

  public static SendOptions mentioning(String... senderIds) {
    return new SendOptions(List.of(senderIds));
  }
}
