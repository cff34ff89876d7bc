package com.chatsentinel.botcore.trigger;

import com.chatsentinel.botcore.common.web.NotFoundException;

public class TriggerNotFoundException extends NotFoundException {
  public TriggerNotFoundException(String keyword) {
    super("Trigger", keyword);
  }
}
