package com.chatsentinel.botcore.pipeline;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

@Component
public class PipelineCounters {

  final AtomicLong received = new AtomicLong();
  final AtomicLong skipped = new AtomicLong();
  final AtomicLong rejected = new AtomicLong();
  final AtomicLong processed = new AtomicLong();
  final AtomicLong failedStages = new AtomicLong();
  final AtomicLong spamFlags = new AtomicLong();
  final AtomicLong triggerResponses = new AtomicLong();

  public Snapshot snapshot() {
    return new Snapshot(
        received.get(),
        skipped.get(),
        rejected.get(),
        processed.get(),
        failedStages.get(),
        spamFlags.get(),
        triggerResponses.get());
  }

  public record Snapshot(
      long received,
      long skipped,
      long rejected,
      long processed,
      long failedStages,
      long spamFlags,
      long triggerResponses) {}
}
