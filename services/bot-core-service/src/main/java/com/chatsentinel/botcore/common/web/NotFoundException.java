package com.chatsentinel.botcore.common.web;

import org.springframework.http.HttpStatus;

public class NotFoundException extends ApiException {

  public NotFoundException(String subject, String key) {
    super(subject + " not found: " + key);
  }

  @Override
  public HttpStatus status() {
    return HttpStatus.NOT_FOUND;
  }

  @Override
  public String code() {
    return "NOT_FOUND";
  }
}
