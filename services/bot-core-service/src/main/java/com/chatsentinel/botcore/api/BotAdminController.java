package com.chatsentinel.botcore.api;

import com.chatsentinel.botcore.admin.BotAdminService;
import com.chatsentinel.botcore.admin.BotStats;
import com.chatsentinel.botcore.admin.BotStatus;
import com.chatsentinel.botcore.api.dto.AdminDtos;
import com.chatsentinel.botcore.common.web.NotFoundException;
import com.chatsentinel.botcore.ratelimit.ActionCategory;
import com.chatsentinel.botcore.ratelimit.RateLimiter;
import com.chatsentinel.botcore.store.StoredMessage;
import com.chatsentinel.botcore.store.UserRecord;
import com.chatsentinel.botcore.trigger.TriggerRule;
import com.chatsentinel.botcore.trigger.TriggerService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class BotAdminController {

  private final BotAdminService admin;
  private final TriggerService triggers;

  public BotAdminController(BotAdminService admin, TriggerService triggers) {
    this.admin = admin;
    this.triggers = triggers;
  }

  @GetMapping("/status")
  public BotStatus status() {
    return admin.status();
  }

  @GetMapping("/stats")
  public BotStats stats() {
    return admin.stats();
  }

  @GetMapping("/triggers")
  public AdminDtos.TriggerListResponse listTriggers() {
    return new AdminDtos.TriggerListResponse(
        triggers.list().stream().map(AdminDtos.TriggerDto::of).toList());
  }

  @PostMapping("/triggers")
  @ResponseStatus(HttpStatus.CREATED)
  public AdminDtos.TriggerDto addTrigger(@Valid @RequestBody AdminDtos.AddTriggerRequest req) {
    TriggerRule rule =
        triggers.add(
            req.keyword(), req.response(), req.resolvedMatchKind(), req.resolvedCaseSensitive());
    return AdminDtos.TriggerDto.of(rule);
  }

  @DeleteMapping("/triggers/{keyword}")
  public AdminDtos.MessageResponse removeTrigger(@PathVariable String keyword) {
    triggers.remove(keyword);
    return new AdminDtos.MessageResponse("Trigger removed successfully");
  }

  @PostMapping("/send")
  public AdminDtos.MessageResponse send(@Valid @RequestBody AdminDtos.SendMessageRequest req) {
    admin.sendMessage(req.conversationId(), req.message());
    return new AdminDtos.MessageResponse("Message sent successfully");
  }

  @GetMapping("/users")
  public AdminDtos.PageResponse<UserRecord> users(
      @RequestParam(name = "limit", defaultValue = "100") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    return new AdminDtos.PageResponse<>(admin.listUsers(limit, offset), limit, offset);
  }

  @GetMapping("/messages")
  public AdminDtos.PageResponse<StoredMessage> messages(
      @RequestParam(name = "limit", defaultValue = "50") int limit,
      @RequestParam(name = "offset", defaultValue = "0") int offset) {
    return new AdminDtos.PageResponse<>(admin.listMessages(limit, offset), limit, offset);
  }

  @GetMapping("/rate-limits")
  public RateLimiter.GlobalStats rateLimits() {
    return admin.rateLimitOverview();
  }

  @GetMapping("/rate-limits/blocked")
  public List<RateLimiter.BlockedSender> blocked() {
    return admin.blockedSenders();
  }

  @GetMapping("/rate-limits/senders/{senderId}")
  public RateLimiter.SenderStats senderStats(
      @PathVariable String senderId,
      @RequestParam(name = "category", required = false) String category) {
    return admin
        .senderStats(senderId, ActionCategory.fromCode(category))
        .orElseThrow(() -> new NotFoundException("Rate limit data", senderId));
  }

  @DeleteMapping("/rate-limits/senders/{senderId}")
  public AdminDtos.MessageResponse resetSender(@PathVariable String senderId) {
    admin.resetSender(senderId);
    return new AdminDtos.MessageResponse("Rate limit data cleared");
  }
}
