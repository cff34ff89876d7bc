package com.chatsentinel.botcore.ratelimit;

public record CategoryLimits(int perMinute, int perHour, int perDay) {

  public CategoryLimits {
    if (perMinute < 1 || perHour < 1 || perDay < 1) {
      throw new IllegalArgumentException("Rate limits must be positive");
    }
  }

  public int limitFor(WindowKind window) {
    return switch (window) {
      case MINUTE -> perMinute;
      case HOUR -> perHour;
      case DAY -> perDay;
    };
  }
}
