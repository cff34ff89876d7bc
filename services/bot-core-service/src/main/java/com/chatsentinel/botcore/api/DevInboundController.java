package com.chatsentinel.botcore.api;

import com.chatsentinel.botcore.model.GroupParticipantsEvent;
import com.chatsentinel.botcore.model.InboundEvent;
import com.chatsentinel.botcore.model.RawMessageEvent;
import com.chatsentinel.botcore.pipeline.InboundEventDispatcher;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Local endpoints to push raw messages and group updates into the inbound queue without a real
 * network adapter. Enabled only if dev.inbound.enabled=true.
 */
@RestController
@RequestMapping("/dev")
@ConditionalOnProperty(name = "dev.inbound.enabled", havingValue = "true")
public class DevInboundController {

  private final InboundEventDispatcher dispatcher;

  public DevInboundController(InboundEventDispatcher dispatcher) {
    this.dispatcher = dispatcher;
  }

  @PostMapping("/inbound")
  public Map<String, Object> inbound(@RequestBody RawMessageEvent event) {
    return enqueue(event);
  }

  @PostMapping("/group-update")
  public Map<String, Object> groupUpdate(@RequestBody GroupParticipantsEvent event) {
    return enqueue(event);
  }

  private Map<String, Object> enqueue(InboundEvent event) {
    boolean accepted = dispatcher.submit(event);
    return Map.of("ok", accepted, "queueDepth", dispatcher.queueDepth());
  }
}
