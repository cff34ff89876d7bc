package com.chatsentinel.botcore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Inbound message event as delivered by the transport adapter.
 *
 * <p>Every field may be absent: adapters forward whatever the network gave them and the normalizer
 * turns it into a best-effort {@link NormalizedMessage}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawMessageEvent(
    String id,
    String remoteId,
    String participantId,
    boolean fromMe,
    Long timestampSeconds,
    Payload payload)
    implements InboundEvent {

  @Override
  public String conversationKey() {
    return remoteId;
  }

  @Override
  public String eventId() {
    return id;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Payload(
      String conversation,
      ExtendedText extendedText,
      Media image,
      Media video,
      Media audio,
      Media document,
      Media sticker) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ExtendedText(String text, ContextInfo contextInfo) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record ContextInfo(String stanzaId, Boolean forwarded) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Media(String url, String mimetype, String caption) {}

  public static RawMessageEvent text(
      String id, String remoteId, String participantId, long timestampSeconds, String text) {
    return new RawMessageEvent(
        id,
        remoteId,
        participantId,
        false,
        timestampSeconds,
        new Payload(text, null, null, null, null, null, null));
  }
}
