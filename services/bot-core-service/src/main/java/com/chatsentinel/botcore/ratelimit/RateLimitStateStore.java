package com.chatsentinel.botcore.ratelimit;

import com.chatsentinel.botcore.config.RateLimitProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Component;

/**
 * In-memory home of all rate limiter state: sender activity and the blocked-sender registry.
 *
 * <p>Memory-only, so everything resets on restart. Sender activity that nobody touched for the
 * retention horizon is evicted; block records are removed by lookups and by the periodic sweep.
 */
@Component
public class RateLimitStateStore {

  private final Cache<String, SenderState> senders;
  private final ConcurrentMap<String, BlockRecord> blocks = new ConcurrentHashMap<>();

  public RateLimitStateStore(RateLimitProperties properties) {
    this.senders = Caffeine.newBuilder().expireAfterAccess(properties.retention()).build();
  }

  SenderState stateFor(String senderId) {
    return senders.get(senderId, k -> new SenderState());
  }

  SenderState existingState(String senderId) {
    return senders.getIfPresent(senderId);
  }

  Collection<SenderState> states() {
    return senders.asMap().values();
  }

  int trackedSenders() {
    return senders.asMap().size();
  }

  BlockRecord block(String senderId) {
    return blocks.get(senderId);
  }

  void putBlock(BlockRecord record) {
    blocks.put(record.senderId(), record);
  }

  /** Removes the record only if it is still the one the caller saw. */
  boolean removeBlock(String senderId, BlockRecord seen) {
    return blocks.remove(senderId, seen);
  }

  Map<String, BlockRecord> blocks() {
    return blocks;
  }

  int removeExpiredBlocks(Instant now) {
    int removed = 0;
    for (Map.Entry<String, BlockRecord> e : blocks.entrySet()) {
      if (e.getValue().isExpired(now) && blocks.remove(e.getKey(), e.getValue())) {
        removed++;
      }
    }
    return removed;
  }

  void clear(String senderId) {
    senders.invalidate(senderId);
    blocks.remove(senderId);
  }
}
