package com.chatsentinel.botcore.api;

import java.time.Instant;

/** Error body shared by every admin API failure, auth rejections included. */
public record ErrorResponse(String code, String message, Instant timestamp) {

  public static ErrorResponse of(String code, String message) {
    return new ErrorResponse(code, message, Instant.now());
  }
}
