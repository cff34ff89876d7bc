package com.chatsentinel.botcore.trigger;

import com.chatsentinel.botcore.common.web.ConflictException;

public class DuplicateKeywordException extends ConflictException {
  public DuplicateKeywordException(String keyword) {
    super("Trigger", keyword);
  }
}
