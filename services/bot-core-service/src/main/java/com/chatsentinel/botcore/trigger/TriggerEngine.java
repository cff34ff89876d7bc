package com.chatsentinel.botcore.trigger;

import com.chatsentinel.botcore.model.NormalizedMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * In-memory snapshot of the active trigger rules.
 *
 * <p>Readers never lock: {@link #match} works on whatever snapshot is current when it starts, and
 * {@link #replaceAll} swaps in a fully built new one. Rules are evaluated in snapshot order and
 * every matching rule is returned.
 */
@Component
@Slf4j
public class TriggerEngine {

  private volatile List<CompiledRule> snapshot = List.of();

  public void replaceAll(List<TriggerRule> rules) {
    List<CompiledRule> next = new ArrayList<>();
    if (rules != null) {
      for (TriggerRule rule : rules) {
        if (rule != null && rule.active() && rule.keyword() != null) {
          next.add(compile(rule));
        }
      }
    }
    snapshot = List.copyOf(next);
    log.info("Loaded {} active trigger(s)", next.size());
  }

  public List<TriggerRule> rules() {
    return snapshot.stream().map(CompiledRule::rule).toList();
  }

  public int size() {
    return snapshot.size();
  }

  public List<TriggerRule> match(NormalizedMessage message) {
    if (message == null || !message.hasText()) {
      return List.of();
    }
    String text = message.text();
    String folded = text.toLowerCase(Locale.ROOT);

    List<TriggerRule> fired = new ArrayList<>();
    for (CompiledRule r : snapshot) {
      if (r.matches(text, folded)) {
        fired.add(r.rule());
      }
    }
    return fired;
  }

  private static CompiledRule compile(TriggerRule rule) {
    if (rule.matchKind() != MatchKind.REGEX) {
      String key = rule.caseSensitive() ? rule.keyword() : rule.keyword().toLowerCase(Locale.ROOT);
      return new CompiledRule(rule, key, null);
    }
    int flags = rule.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    try {
      return new CompiledRule(rule, rule.keyword(), Pattern.compile(rule.keyword(), flags));
    } catch (PatternSyntaxException e) {
      log.warn("Invalid regex in trigger '{}': {}", rule.keyword(), e.getDescription());
      return new CompiledRule(rule, rule.keyword(), null);
    }
  }

  private record CompiledRule(TriggerRule rule, String key, Pattern pattern) {

    boolean matches(String text, String folded) {
      String candidate = rule.caseSensitive() ? text : folded;
      return switch (rule.matchKind()) {
        case EXACT -> candidate.equals(key);
        case CONTAINS -> candidate.contains(key);
        case REGEX -> {
          if (pattern == null) {
            log.debug("Skip trigger '{}': pattern does not compile", rule.keyword());
            yield false;
          }
          yield find(text);
        }
      };
    }

    // backtracking on long input can exhaust the stack; such a rule just does not fire
    private boolean find(String text) {
      try {
        return pattern.matcher(text).find();
      } catch (StackOverflowError e) {
        log.warn(
            "Trigger '{}' skipped: regex overflowed the stack on {} chars of input",
            rule.keyword(),
            text.length());
        return false;
      }
    }
  }
}
