package com.chatsentinel.botcore.transport;

import java.util.OptionalInt;

/**
 * Outbound side of the chat network adapter.
 *
 * <p>Inbound events do not come through here: adapters push them into {@code
 * InboundEventDispatcher#submit}.
 */
public interface ChatTransport {

  /**
   * @throws TransportException if the message could not be handed to the network
   */
  void send(String conversationId, String content, SendOptions options);

  /**
   * Current member count of a group, if the network can tell.
   *
   * @throws TransportException if the lookup failed
   */
  OptionalInt groupMemberCount(String groupId);

  boolean isConnected();

  /** Short human readable connection state, e.g. "connected" or "disconnected". */
  String state();
}
