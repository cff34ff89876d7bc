package com.chatsentinel.botcore.config;

import com.chatsentinel.botcore.ratelimit.ActionCategory;
import com.chatsentinel.botcore.ratelimit.CategoryLimits;
import com.chatsentinel.botcore.ratelimit.Severity;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per-category budgets and the escalation policy of the rate limiter.
 *
 * <p>Anything left out of the configuration falls back to the built-in defaults, so a partial
 * {@code bot.rate-limit.limits.media} override keeps the message and command budgets intact.
 */
@ConfigurationProperties(prefix = "bot.rate-limit")
public record RateLimitProperties(
    Map<ActionCategory, CategoryLimits> limits,
    Map<ActionCategory, Double> warningThresholds,
    Map<Severity, Duration> blockDurations,
    Duration warningCooldown,
    Duration retention) {

  public RateLimitProperties {
    limits = merge(ActionCategory.class, defaultLimits(), limits);
    warningThresholds = merge(ActionCategory.class, defaultWarningThresholds(), warningThresholds);
    blockDurations = merge(Severity.class, defaultBlockDurations(), blockDurations);
    warningCooldown = warningCooldown == null ? Duration.ofMinutes(5) : warningCooldown;
    retention = retention == null ? Duration.ofHours(24) : retention;
  }

  public static RateLimitProperties defaults() {
    return new RateLimitProperties(null, null, null, null, null);
  }

  public double warningThreshold(ActionCategory category) {
    return warningThresholds.get(category);
  }

  public Duration blockDuration(Severity severity) {
    return blockDurations.get(severity);
  }

  private static Map<ActionCategory, CategoryLimits> defaultLimits() {
    Map<ActionCategory, CategoryLimits> m = new EnumMap<>(ActionCategory.class);
    m.put(ActionCategory.MESSAGE, new CategoryLimits(20, 100, 500));
    m.put(ActionCategory.MEDIA, new CategoryLimits(5, 30, 100));
    m.put(ActionCategory.COMMAND, new CategoryLimits(10, 50, 200));
    return m;
  }

  private static Map<ActionCategory, Double> defaultWarningThresholds() {
    Map<ActionCategory, Double> m = new EnumMap<>(ActionCategory.class);
    m.put(ActionCategory.MESSAGE, 0.8);
    m.put(ActionCategory.MEDIA, 0.7);
    m.put(ActionCategory.COMMAND, 0.9);
    return m;
  }

  private static Map<Severity, Duration> defaultBlockDurations() {
    Map<Severity, Duration> m = new EnumMap<>(Severity.class);
    m.put(Severity.WARNING, Duration.ZERO);
    m.put(Severity.SOFT, Duration.ofMinutes(5));
    m.put(Severity.HARD, Duration.ofMinutes(30));
    m.put(Severity.SEVERE, Duration.ofHours(2));
    return m;
  }

  private static <K extends Enum<K>, V> Map<K, V> merge(
      Class<K> type, Map<K, V> defaults, Map<K, V> overrides) {
    Map<K, V> out = new EnumMap<>(type);
    out.putAll(defaults);
    if (overrides != null) {
      overrides.forEach(
          (k, v) -> {
            if (k != null && v != null) {
              out.put(k, v);
            }
          });
    }
    return Collections.unmodifiableMap(out);
  }
}
