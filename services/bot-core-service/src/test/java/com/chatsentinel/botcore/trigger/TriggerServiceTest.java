package com.chatsentinel.botcore.trigger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.chatsentinel.botcore.model.ContentKind;
import com.chatsentinel.botcore.model.NormalizedMessage;
import com.chatsentinel.botcore.support.InMemoryMessageStore;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TriggerServiceTest {

  private InMemoryMessageStore store;
  private TriggerEngine engine;
  private TriggerService service;

  @BeforeEach
  void setUp() {
    store = new InMemoryMessageStore();
    store.addTrigger(TriggerRule.active("hello", "Hi there!", MatchKind.EXACT, false));
    engine = new TriggerEngine();
    service = new TriggerService(store, engine);
    service.loadOnStartup();
  }

  private static NormalizedMessage text(String text) {
    return new NormalizedMessage(
        "m1", "c1", "s1", ContentKind.TEXT, text, null, Instant.EPOCH, false, null, false);
  }

  @Test
  void addedTriggerIsVisibleToTheNextMatch() {
    service.add("menu", "Today: soup", MatchKind.CONTAINS, false);

    assertThat(engine.match(text("show me the menu")))
        .extracting(TriggerRule::keyword)
        .containsExactly("menu");
  }

  @Test
  void duplicateKeywordIsRejected() {
    assertThatThrownBy(() -> service.add("hello", "again", MatchKind.EXACT, false))
        .isInstanceOf(DuplicateKeywordException.class);
    assertThat(service.list()).hasSize(1);
  }

  @Test
  void removingUnknownKeywordFails() {
    assertThatThrownBy(() -> service.remove("nope")).isInstanceOf(TriggerNotFoundException.class);
  }

  @Test
  void blankKeywordOrResponseIsRejected() {
    assertThatThrownBy(() -> service.add(" ", "x", MatchKind.EXACT, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> service.add("k", "", MatchKind.EXACT, false))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void addThenRemoveRestoresSnapshot() {
    List<TriggerRule> before = service.list();

    service.add("bye", "See you", MatchKind.EXACT, false);
    service.remove("bye");

    assertThat(service.list()).isEqualTo(before);
    assertThat(engine.match(text("bye"))).isEmpty();
  }
}
