package com.chatsentinel.botcore.model;

/** Anything the transport hands to the inbound queue. */
public interface InboundEvent {

  /** Conversation the event belongs to; events of one conversation keep their order. */
  String conversationKey();

  String eventId();
}
