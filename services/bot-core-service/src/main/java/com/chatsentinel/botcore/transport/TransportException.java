package com.chatsentinel.botcore.transport;

/** Outbound delivery failed (not connected, network error, rejected by the network). */
public class TransportException extends RuntimeException {
  public TransportException(String message) {
    super(message);
  }

  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
