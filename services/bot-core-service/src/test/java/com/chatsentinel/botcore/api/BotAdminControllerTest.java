package com.chatsentinel.botcore.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chatsentinel.botcore.admin.BotAdminService;
import com.chatsentinel.botcore.admin.BotStatus;
import com.chatsentinel.botcore.config.AdminProperties;
import com.chatsentinel.botcore.ratelimit.ActionCategory;
import com.chatsentinel.botcore.ratelimit.RateLimiter;
import com.chatsentinel.botcore.store.StoredMessage;
import com.chatsentinel.botcore.store.UserRecord;
import com.chatsentinel.botcore.transport.TransportException;
import com.chatsentinel.botcore.trigger.DuplicateKeywordException;
import com.chatsentinel.botcore.trigger.MatchKind;
import com.chatsentinel.botcore.trigger.TriggerNotFoundException;
import com.chatsentinel.botcore.trigger.TriggerRule;
import com.chatsentinel.botcore.trigger.TriggerService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = BotAdminController.class, properties = "bot.admin.token=test-token")
@EnableConfigurationProperties(AdminProperties.class)
class BotAdminControllerTest {

  private static final String TOKEN = "test-token";

  @Autowired MockMvc mvc;

  @MockBean BotAdminService admin;
  @MockBean TriggerService triggers;

  @Test
  void requestsWithoutTokenAreRejected() throws Exception {
    mvc.perform(get("/api/status"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
    mvc.perform(get("/api/status").header("X-Admin-Token", "wrong"))
        .andExpect(status().isUnauthorized());
    mvc.perform(get("/api/status").header("X-Admin-Token", TOKEN + "x"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void usersArePagedWithDefaults() throws Exception {
    Instant seen = Instant.parse("2024-05-01T10:00:00Z");
    when(admin.listUsers(100, 0))
        .thenReturn(List.of(new UserRecord("1@s.whatsapp.net", "1", seen, seen, 7)));

    mvc.perform(get("/api/users").header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].senderId").value("1@s.whatsapp.net"))
        .andExpect(jsonPath("$.items[0].messageCount").value(7))
        .andExpect(jsonPath("$.limit").value(100))
        .andExpect(jsonPath("$.offset").value(0));
  }

  @Test
  void messagesArePagedNewestFirst() throws Exception {
    Instant at = Instant.parse("2024-05-01T10:00:00Z");
    when(admin.listMessages(2, 4))
        .thenReturn(
            List.of(
                new StoredMessage(
                    "M9",
                    "g@g.us",
                    "1@s.whatsapp.net",
                    "text",
                    "hi",
                    null,
                    null,
                    at,
                    true,
                    null,
                    false)));

    mvc.perform(
            get("/api/messages")
                .param("limit", "2")
                .param("offset", "4")
                .header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.items[0].messageId").value("M9"))
        .andExpect(jsonPath("$.items[0].group").value(true))
        .andExpect(jsonPath("$.limit").value(2));
  }

  @Test
  void badPagingIsBadRequest() throws Exception {
    when(admin.listMessages(0, 0))
        .thenThrow(new IllegalArgumentException("limit must be between 1 and 500"));

    mvc.perform(get("/api/messages").param("limit", "0").header("X-Admin-Token", TOKEN))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("limit must be between 1 and 500"));
    mvc.perform(get("/api/users").param("limit", "many").header("X-Admin-Token", TOKEN))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void statusIsReturned() throws Exception {
    when(admin.status())
        .thenReturn(
            new BotStatus(
                true,
                "Chat Sentinel Bot",
                "1.0.0",
                false,
                "not-configured",
                0,
                2,
                Instant.parse("2024-05-01T10:00:00Z"),
                Duration.ofMinutes(3)));

    mvc.perform(get("/api/status").header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.running").value(true))
        .andExpect(jsonPath("$.transportState").value("not-configured"))
        .andExpect(jsonPath("$.activeTriggers").value(2));
  }

  @Test
  void triggersAreListed() throws Exception {
    when(triggers.list())
        .thenReturn(List.of(TriggerRule.active("help", "Hi", MatchKind.EXACT, false)));

    mvc.perform(get("/api/triggers").header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.triggers[0].keyword").value("help"))
        .andExpect(jsonPath("$.triggers[0].matchKind").value("exact"));
  }

  @Test
  void addTriggerReturnsCreated() throws Exception {
    when(triggers.add("price", "See menu", MatchKind.CONTAINS, false))
        .thenReturn(TriggerRule.active("price", "See menu", MatchKind.CONTAINS, false));

    mvc.perform(
            post("/api/triggers")
                .header("X-Admin-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"keyword\":\"price\",\"response\":\"See menu\",\"matchKind\":\"contains\"}"))
        .andExpect(status().isCreated())
        .andExpect(jsonPath("$.keyword").value("price"))
        .andExpect(jsonPath("$.active").value(true));
  }

  @Test
  void duplicateTriggerIsConflict() throws Exception {
    when(triggers.add(anyString(), anyString(), any(), anyBoolean()))
        .thenThrow(new DuplicateKeywordException("help"));

    mvc.perform(
            post("/api/triggers")
                .header("X-Admin-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keyword\":\"help\",\"response\":\"Hi\"}"))
        .andExpect(status().isConflict())
        .andExpect(jsonPath("$.code").value("CONFLICT"));
  }

  @Test
  void blankKeywordIsValidationError() throws Exception {
    mvc.perform(
            post("/api/triggers")
                .header("X-Admin-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keyword\":\"\",\"response\":\"Hi\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
  }

  @Test
  void unknownMatchKindIsBadRequest() throws Exception {
    mvc.perform(
            post("/api/triggers")
                .header("X-Admin-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"keyword\":\"k\",\"response\":\"r\",\"matchKind\":\"fuzzy\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("BAD_REQUEST"));
  }

  @Test
  void removingUnknownTriggerIsNotFound() throws Exception {
    doThrow(new TriggerNotFoundException("nope")).when(triggers).remove("nope");

    mvc.perform(delete("/api/triggers/nope").header("X-Admin-Token", TOKEN))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Trigger not found: nope"));
  }

  @Test
  void sendFailureIsBadGateway() throws Exception {
    doThrow(new TransportException("not connected"))
        .when(admin)
        .sendMessage(eq("1@s.whatsapp.net"), anyString());

    mvc.perform(
            post("/api/send")
                .header("X-Admin-Token", TOKEN)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"conversationId\":\"1@s.whatsapp.net\",\"message\":\"hello\"}"))
        .andExpect(status().isBadGateway())
        .andExpect(jsonPath("$.code").value("TRANSPORT_ERROR"));
  }

  @Test
  void senderStatsUseRequestedCategory() throws Exception {
    when(admin.senderStats("s1", ActionCategory.MEDIA))
        .thenReturn(
            Optional.of(
                new RateLimiter.SenderStats(
                    "s1", ActionCategory.MEDIA, 3, 3, 3, 3, null, 0, false)));

    mvc.perform(
            get("/api/rate-limits/senders/s1")
                .param("category", "media")
                .header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.perMinute").value(3));

    mvc.perform(get("/api/rate-limits/senders/other").header("X-Admin-Token", TOKEN))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.message").value("Rate limit data not found: other"));
  }

  @Test
  void resetClearsSender() throws Exception {
    mvc.perform(delete("/api/rate-limits/senders/s1").header("X-Admin-Token", TOKEN))
        .andExpect(status().isOk());

    verify(admin).resetSender("s1");
  }
}
