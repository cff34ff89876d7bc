package com.chatsentinel.botcore.normalize;

import com.chatsentinel.botcore.config.BotProperties;
import com.chatsentinel.botcore.model.ContentKind;
import com.chatsentinel.botcore.model.MediaRef;
import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.model.RawMessageEvent;
import com.chatsentinel.botcore.model.RawMessageEvent.ContextInfo;
import com.chatsentinel.botcore.model.RawMessageEvent.ExtendedText;
import com.chatsentinel.botcore.model.RawMessageEvent.Media;
import com.chatsentinel.botcore.model.RawMessageEvent.Payload;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns raw transport events into {@link NormalizedMessage}s.
 *
 * <p>Content kind precedence: plain text, extended text, image, video, audio, document, sticker.
 * Plain text must be non-empty to win; an extended-text payload wins by being present, even with
 * empty text, and the media payloads by being present. Missing fields never fail normalization;
 * only echoes of the account's own messages are skipped.
 */
@Component
@Slf4j
public class MessageNormalizer {

  private final BotProperties properties;
  private final Clock clock;

  public MessageNormalizer(BotProperties properties, Clock clock) {
    this.properties = properties;
    this.clock = clock;
  }

  public Optional<NormalizedMessage> normalize(RawMessageEvent raw) {
    if (raw == null) {
      return Optional.empty();
    }
    if (raw.fromMe()) {
      log.trace("Skip own message {}", raw.id());
      return Optional.empty();
    }

    String conversationId = trimToEmpty(raw.remoteId());
    String participant = trimToEmpty(raw.participantId());
    String senderId = participant.isEmpty() ? conversationId : participant;
    String id = raw.id() == null || raw.id().isBlank() ? syntheticId() : raw.id().trim();

    Payload payload = raw.payload();
    ContentKind kind = ContentKind.TEXT;
    String text = "";
    MediaRef media = null;
    ContextInfo context = null;

    if (payload != null) {
      ExtendedText ext = payload.extendedText();
      if (ext != null) {
        context = ext.contextInfo();
      }
      if (notEmpty(payload.conversation())) {
        text = payload.conversation();
      } else if (ext != null) {
        text = ext.text() == null ? "" : ext.text();
      } else if (payload.image() != null) {
        kind = ContentKind.IMAGE;
        text = caption(payload.image());
        media = mediaRef(payload.image());
      } else if (payload.video() != null) {
        kind = ContentKind.VIDEO;
        text = caption(payload.video());
        media = mediaRef(payload.video());
      } else if (payload.audio() != null) {
        kind = ContentKind.AUDIO;
        media = mediaRef(payload.audio());
      } else if (payload.document() != null) {
        kind = ContentKind.DOCUMENT;
        text = caption(payload.document());
        media = mediaRef(payload.document());
      } else if (payload.sticker() != null) {
        kind = ContentKind.STICKER;
        media = mediaRef(payload.sticker());
      }
    }

    String replyTo = context == null ? null : blankToNull(context.stanzaId());
    boolean forwarded = context != null && Boolean.TRUE.equals(context.forwarded());

    return Optional.of(
        new NormalizedMessage(
            id,
            conversationId,
            senderId,
            kind,
            text,
            media,
            timestamp(raw.timestampSeconds()),
            isGroup(conversationId),
            replyTo,
            forwarded));
  }

  private boolean isGroup(String conversationId) {
    String suffix = properties.groupSuffix();
    return !suffix.isEmpty() && conversationId.endsWith(suffix);
  }

  private Instant timestamp(Long epochSeconds) {
    if (epochSeconds == null || epochSeconds <= 0) {
      return clock.instant();
    }
    return Instant.ofEpochSecond(epochSeconds);
  }

  private static MediaRef mediaRef(Media media) {
    return new MediaRef(blankToNull(media.url()), blankToNull(media.mimetype()));
  }

  private static String caption(Media media) {
    return media.caption() == null ? "" : media.caption();
  }

  private static boolean notEmpty(String s) {
    return s != null && !s.isEmpty();
  }

  private static String trimToEmpty(String s) {
    return s == null ? "" : s.trim();
  }

  private static String blankToNull(String s) {
    return s == null || s.isBlank() ? null : s;
  }

  private static String syntheticId() {
    return "local-" + UUID.randomUUID();
  }
}
