package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.model.GroupParticipantsEvent;
import com.chatsentinel.botcore.model.InboundEvent;
import com.chatsentinel.botcore.model.RawMessageEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Sends each dequeued event to the component that owns its kind. */
@Component
@Slf4j
public class InboundEventRouter implements InboundEventHandler {

  private final MessagePipeline messages;
  private final GroupMembershipHandler groups;

  public InboundEventRouter(MessagePipeline messages, GroupMembershipHandler groups) {
    this.messages = messages;
    this.groups = groups;
  }

  @Override
  public void handle(InboundEvent event) {
    if (event instanceof RawMessageEvent raw) {
      messages.handle(raw);
    } else if (event instanceof GroupParticipantsEvent update) {
      groups.handle(update);
    } else {
      log.warn("No handler for inbound event type {}", event.getClass().getSimpleName());
    }
  }
}
