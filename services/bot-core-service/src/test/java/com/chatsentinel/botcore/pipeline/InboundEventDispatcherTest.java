package com.chatsentinel.botcore.pipeline;

import static org.assertj.core.api.Assertions.assertThat;

import com.chatsentinel.botcore.config.InboundProperties;
import com.chatsentinel.botcore.model.RawMessageEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class InboundEventDispatcherTest {

  private InboundEventDispatcher dispatcher;

  @AfterEach
  void tearDown() {
    if (dispatcher != null) {
      dispatcher.stop();
    }
  }

  private static List<String> synchronizedList() {
    return Collections.synchronizedList(new ArrayList<>());
  }

  private static RawMessageEvent event(String id, String conversation) {
    return RawMessageEvent.text(id, conversation, null, 1L, "x");
  }

  @Test
  void eventsOfOneConversationAreHandledInArrivalOrder() throws Exception {
    Map<String, List<String>> seen = new ConcurrentHashMap<>();
    CountDownLatch done = new CountDownLatch(60);
    dispatcher =
        new InboundEventDispatcher(
            e -> {
              seen.computeIfAbsent(e.conversationKey(), k -> synchronizedList())
                  .add(e.eventId());
              done.countDown();
            },
            new InboundProperties(100, 4, Duration.ofSeconds(1), Duration.ofSeconds(5)));
    dispatcher.start();

    for (int i = 0; i < 20; i++) {
      for (String conversation : List.of("a@s.whatsapp.net", "b@s.whatsapp.net", "c@g.us")) {
        assertThat(dispatcher.submit(event(conversation + "#" + i, conversation))).isTrue();
      }
    }

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    for (String conversation : seen.keySet()) {
      List<String> ids = seen.get(conversation);
      for (int i = 0; i < ids.size(); i++) {
        assertThat(ids.get(i)).isEqualTo(conversation + "#" + i);
      }
    }
  }

  @Test
  void handlerFailureDoesNotStopTheLane() throws Exception {
    CountDownLatch done = new CountDownLatch(2);
    dispatcher =
        new InboundEventDispatcher(
            e -> {
              done.countDown();
              if ("boom".equals(e.eventId())) {
                throw new IllegalStateException("boom");
              }
            },
            new InboundProperties(10, 1, Duration.ofSeconds(1), Duration.ofSeconds(5)));
    dispatcher.start();

    dispatcher.submit(event("boom", "a@s.whatsapp.net"));
    dispatcher.submit(event("fine", "a@s.whatsapp.net"));

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
  }

  @Test
  void errorEscapingTheHandlerDoesNotKillTheWorker() throws Exception {
    List<String> handled = synchronizedList();
    CountDownLatch done = new CountDownLatch(1);
    dispatcher =
        new InboundEventDispatcher(
            e -> {
              if ("deep".equals(e.eventId())) {
                throw new StackOverflowError();
              }
              handled.add(e.eventId());
              done.countDown();
            },
            new InboundProperties(10, 1, Duration.ofSeconds(1), Duration.ofSeconds(5)));
    dispatcher.start();

    dispatcher.submit(event("deep", "a@s.whatsapp.net"));
    dispatcher.submit(event("after", "a@s.whatsapp.net"));

    assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(handled).containsExactly("after");
  }

  @Test
  void stopWorksOffAcceptedEventsAndRefusesNewOnes() {
    List<String> handled = synchronizedList();
    dispatcher =
        new InboundEventDispatcher(
            e -> {
              try {
                Thread.sleep(5);
              } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
              }
              handled.add(e.eventId());
            },
            new InboundProperties(100, 1, Duration.ofSeconds(1), Duration.ofSeconds(10)));
    dispatcher.start();

    for (int i = 0; i < 50; i++) {
      assertThat(dispatcher.submit(event("e" + i, "a@s.whatsapp.net"))).isTrue();
    }
    dispatcher.stop();

    assertThat(handled).hasSize(50);
    assertThat(handled.get(0)).isEqualTo("e0");
    assertThat(handled.get(49)).isEqualTo("e49");
    assertThat(dispatcher.queueDepth()).isZero();
    assertThat(dispatcher.isRunning()).isFalse();
    assertThat(dispatcher.submit(event("late", "a@s.whatsapp.net"))).isFalse();
  }

  @Test
  void fullLaneRejectsAfterTimeout() {
    dispatcher =
        new InboundEventDispatcher(
            e -> {}, new InboundProperties(1, 1, Duration.ofMillis(50), null));

    assertThat(dispatcher.submit(event("1", "a@s.whatsapp.net"))).isTrue();
    assertThat(dispatcher.submit(event("2", "a@s.whatsapp.net"))).isFalse();
    assertThat(dispatcher.queueDepth()).isEqualTo(1);
    assertThat(dispatcher.submit(null)).isFalse();
  }

  @Test
  void sameConversationAlwaysMapsToSameLane() {
    dispatcher =
        new InboundEventDispatcher(e -> {}, InboundProperties.defaults());

    int lane = dispatcher.laneFor(event("1", "chat@g.us"));
    assertThat(dispatcher.laneFor(event("2", "chat@g.us"))).isEqualTo(lane);
    assertThat(dispatcher.laneFor(new RawMessageEvent("3", null, null, false, null, null)))
        .isBetween(0, 3);
  }
}
