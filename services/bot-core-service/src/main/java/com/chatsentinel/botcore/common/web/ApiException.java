package com.chatsentinel.botcore.common.web;

import org.springframework.http.HttpStatus;

/**
 * Failure that maps one-to-one onto an admin API error body. Subclasses fix the HTTP status and
 * the machine-readable code; the message is shown to the caller as is.
 */
public abstract class ApiException extends RuntimeException {

  protected ApiException(String message) {
    super(message);
  }

  public abstract HttpStatus status();

  public abstract String code();
}
