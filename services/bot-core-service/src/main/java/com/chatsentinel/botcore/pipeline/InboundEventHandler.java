package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.model.InboundEvent;

@FunctionalInterface
public interface InboundEventHandler {
  void handle(InboundEvent event);
}
