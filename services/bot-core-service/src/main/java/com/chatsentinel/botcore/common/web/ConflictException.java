package com.chatsentinel.botcore.common.web;

import org.springframework.http.HttpStatus;

/** An admin action would create something that already exists, e.g. a second trigger. */
public class ConflictException extends ApiException {

  public ConflictException(String subject, String key) {
    super(subject + " already exists: " + key);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.CONFLICT;
  }

  @Override
  public String code() {
    return "CONFLICT";
  }
}
