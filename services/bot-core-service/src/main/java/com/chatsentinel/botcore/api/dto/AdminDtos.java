package com.chatsentinel.botcore.api.dto;

import com.chatsentinel.botcore.trigger.MatchKind;
import com.chatsentinel.botcore.trigger.TriggerRule;
import jakarta.validation.constraints.NotBlank;
import java.util.List;

/** Request and response bodies of the admin API. */
public final class AdminDtos {
  private AdminDtos() {}

  public record AddTriggerRequest(
      @NotBlank String keyword,
      @NotBlank String response,
      String matchKind,
      Boolean caseSensitive) {

    public MatchKind resolvedMatchKind() {
      return MatchKind.fromCode(matchKind);
    }

    public boolean resolvedCaseSensitive() {
      return Boolean.TRUE.equals(caseSensitive);
    }
  }

  public record TriggerDto(
      String keyword, String response, String matchKind, boolean caseSensitive, boolean active) {

    public static TriggerDto of(TriggerRule rule) {
      return new TriggerDto(
          rule.keyword(),
          rule.response(),
          rule.matchKind().code(),
          rule.caseSensitive(),
          rule.active());
    }
  }

  public record TriggerListResponse(List<TriggerDto> triggers) {}

  public record SendMessageRequest(@NotBlank String conversationId, @NotBlank String message) {}

  public record MessageResponse(String message) {}

  public record PageResponse<T>(List<T> items, int limit, int offset) {}
}
