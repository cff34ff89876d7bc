package com.chatsentinel.botcore.normalize;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatsentinel.botcore.config.BotProperties;
import com.chatsentinel.botcore.model.ContentKind;
import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.model.RawMessageEvent;
import com.chatsentinel.botcore.model.RawMessageEvent.ContextInfo;
import com.chatsentinel.botcore.model.RawMessageEvent.ExtendedText;
import com.chatsentinel.botcore.model.RawMessageEvent.Media;
import com.chatsentinel.botcore.model.RawMessageEvent.Payload;
import com.chatsentinel.botcore.support.MutableClock;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class MessageNormalizerTest {

  private final MutableClock clock = MutableClock.at("2024-05-01T10:00:00Z");
  private final MessageNormalizer normalizer =
      new MessageNormalizer(BotProperties.defaults(), clock);

  private NormalizedMessage direct(Payload payload) {
    RawMessageEvent raw =
        new RawMessageEvent("MSG1", "1@s.whatsapp.net", null, false, 1714557600L, payload);
    return normalizer.normalize(raw).orElseThrow();
  }

  @Test
  void plainTextInDirectChat() {
    NormalizedMessage m =
        normalizer
            .normalize(RawMessageEvent.text("MSG1", "111@s.whatsapp.net", null, 1714557600L, "hi"))
            .orElseThrow();

    assertThat(m.id()).isEqualTo("MSG1");
    assertThat(m.senderId()).isEqualTo("111@s.whatsapp.net");
    assertThat(m.conversationId()).isEqualTo("111@s.whatsapp.net");
    assertThat(m.contentKind()).isEqualTo(ContentKind.TEXT);
    assertThat(m.text()).isEqualTo("hi");
    assertThat(m.mediaRef()).isNull();
    assertThat(m.groupConversation()).isFalse();
    assertThat(m.timestamp()).isEqualTo(Instant.ofEpochSecond(1714557600L));
  }

  @Test
  void groupMessageUsesParticipantAsSender() {
    NormalizedMessage m =
        normalizer
            .normalize(
                RawMessageEvent.text("MSG1", "999-123@g.us", "222@s.whatsapp.net", 1L, "yo"))
            .orElseThrow();

    assertThat(m.senderId()).isEqualTo("222@s.whatsapp.net");
    assertThat(m.conversationId()).isEqualTo("999-123@g.us");
    assertThat(m.groupConversation()).isTrue();
  }

  @Test
  void ownMessagesAreSkipped() {
    RawMessageEvent own =
        new RawMessageEvent("MSG1", "111@s.whatsapp.net", null, true, 1L, null);
    assertThat(normalizer.normalize(own)).isEmpty();
    assertThat(normalizer.normalize(null)).isEmpty();
  }

  @Test
  void extendedTextCarriesReplyAndForwardFlags() {
    Payload payload =
        new Payload(
            null,
            new ExtendedText("see this", new ContextInfo("ORIG42", true)),
            null,
            null,
            null,
            null,
            null);

    NormalizedMessage m = direct(payload);

    assertThat(m.text()).isEqualTo("see this");
    assertThat(m.replyToId()).isEqualTo("ORIG42");
    assertThat(m.forwarded()).isTrue();
  }

  @Test
  void presentExtendedTextIsTextEvenWhenEmpty() {
    Media image = new Media("https://cdn/y.jpg", "image/jpeg", "caption");
    Payload payload =
        new Payload(null, new ExtendedText("", null), image, null, null, null, null);
    Payload nullText =
        new Payload(null, new ExtendedText(null, null), image, null, null, null, null);

    NormalizedMessage m = direct(payload);
    assertThat(m.contentKind()).isEqualTo(ContentKind.TEXT);
    assertThat(m.text()).isEmpty();
    assertThat(m.mediaRef()).isNull();

    assertThat(direct(nullText).contentKind()).isEqualTo(ContentKind.TEXT);
    assertThat(direct(nullText).text()).isEmpty();
  }

  @Test
  void imageCaptionPopulatesTextAndMediaRef() {
    Payload payload =
        new Payload(
            null,
            null,
            new Media("https://cdn/x.jpg", "image/jpeg", "look"),
            null,
            null,
            null,
            null);

    NormalizedMessage m = direct(payload);

    assertThat(m.contentKind()).isEqualTo(ContentKind.IMAGE);
    assertThat(m.text()).isEqualTo("look");
    assertThat(m.mediaRef().url()).isEqualTo("https://cdn/x.jpg");
    assertThat(m.mediaRef().mimeType()).isEqualTo("image/jpeg");
  }

  @Test
  void precedenceTakesFirstPresentPayload() {
    Media media = new Media("u", "m", null);
    Payload videoAndSticker = new Payload(null, null, null, media, null, null, media);
    Payload textAndImage = new Payload("caption wins", null, media, null, null, null, null);

    assertThat(direct(videoAndSticker).contentKind()).isEqualTo(ContentKind.VIDEO);
    NormalizedMessage text = direct(textAndImage);
    assertThat(text.contentKind()).isEqualTo(ContentKind.TEXT);
    assertThat(text.mediaRef()).isNull();
  }

  @Test
  void stickerAndAudioHaveNoText() {
    Media media = new Media(null, "audio/ogg", "ignored");
    NormalizedMessage audio = direct(new Payload(null, null, null, null, media, null, null));

    assertThat(audio.contentKind()).isEqualTo(ContentKind.AUDIO);
    assertThat(audio.text()).isEmpty();
    assertThat(audio.mediaRef().url()).isNull();
  }

  @Test
  void malformedEventStillNormalizes() {
    RawMessageEvent broken = new RawMessageEvent(null, null, null, false, null, null);

    NormalizedMessage m = normalizer.normalize(broken).orElseThrow();

    assertThat(m.id()).startsWith("local-");
    assertThat(m.conversationId()).isEmpty();
    assertThat(m.text()).isEmpty();
    assertThat(m.contentKind()).isEqualTo(ContentKind.TEXT);
    assertThat(m.timestamp()).isEqualTo(clock.instant());
  }
}
