package com.chatsentinel.botcore.pipeline;

import com.chatsentinel.botcore.config.InboundProperties;
import com.chatsentinel.botcore.model.InboundEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Bounded hand-off between the transport and the pipeline.
 *
 * <p>Events are spread over fixed lanes by conversation. Each lane is a bounded queue drained by
 * exactly one worker, so one conversation is processed in arrival order while different
 * conversations run in parallel. A full lane pushes back on the producer. On stop, new events are
 * refused and every lane works off what it already accepted within the shutdown grace period.
 */
@Component
@Slf4j
public class InboundEventDispatcher {

  private static final long POLL_MILLIS = 200;

  private final InboundEventHandler handler;
  private final InboundProperties properties;
  private final List<BlockingQueue<InboundEvent>> lanes;
  // submitters share it, stop takes it exclusively: no offer can land after the final drain
  private final ReadWriteLock admission = new ReentrantReadWriteLock();

  private ExecutorService workers;
  private volatile boolean running;
  private volatile boolean stopped;

  public InboundEventDispatcher(InboundEventHandler handler, InboundProperties properties) {
    this.handler = handler;
    this.properties = properties;
    List<BlockingQueue<InboundEvent>> list = new ArrayList<>();
    for (int i = 0; i < properties.workers(); i++) {
      list.add(new ArrayBlockingQueue<>(properties.queueCapacity()));
    }
    this.lanes = List.copyOf(list);
  }

  @PostConstruct
  public synchronized void start() {
    if (running || stopped) {
      return;
    }
    running = true;
    AtomicInteger seq = new AtomicInteger();
    workers =
        Executors.newFixedThreadPool(
            lanes.size(),
            r -> {
              Thread t = new Thread(r, "inbound-lane-" + seq.getAndIncrement());
              t.setDaemon(true);
              return t;
            });
    for (BlockingQueue<InboundEvent> lane : lanes) {
      workers.execute(() -> drain(lane));
    }
    log.info(
        "Inbound dispatcher started: {} lane(s), capacity {} each",
        lanes.size(),
        properties.queueCapacity());
  }

  @PreDestroy
  public synchronized void stop() {
    if (stopped) {
      return;
    }
    admission.writeLock().lock();
    try {
      stopped = true;
    } finally {
      admission.writeLock().unlock();
    }
    if (!running) {
      return;
    }
    running = false;
    workers.shutdown();
    try {
      if (!workers.awaitTermination(
          properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        workers.shutdownNow();
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    int left = queueDepth();
    if (left > 0) {
      log.warn("Inbound dispatcher stopped with {} unprocessed event(s)", left);
    } else {
      log.info("Inbound dispatcher stopped, all accepted events handled");
    }
  }

  /**
   * Enqueues an event, waiting up to the configured offer timeout for room in its lane.
   *
   * @return false if the dispatcher is stopped, the lane stayed full or the caller was interrupted
   */
  public boolean submit(InboundEvent event) {
    if (event == null) {
      return false;
    }
    BlockingQueue<InboundEvent> lane = lanes.get(laneFor(event));
    admission.readLock().lock();
    try {
      if (stopped) {
        log.warn("Inbound dispatcher is stopped, refusing event {}", event.eventId());
        return false;
      }
      boolean accepted =
          lane.offer(event, properties.offerTimeout().toMillis(), TimeUnit.MILLISECONDS);
      if (!accepted) {
        log.warn(
            "Inbound lane full, dropping event {} of {}", event.eventId(), event.conversationKey());
      }
      return accepted;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      admission.readLock().unlock();
    }
  }

  public int queueDepth() {
    return lanes.stream().mapToInt(BlockingQueue::size).sum();
  }

  public boolean isRunning() {
    return running;
  }

  int laneFor(InboundEvent event) {
    String key = event.conversationKey() == null ? "" : event.conversationKey();
    return Math.floorMod(key.hashCode(), lanes.size());
  }

  private void drain(BlockingQueue<InboundEvent> lane) {
    while (running) {
      InboundEvent event;
      try {
        event = lane.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
      if (event != null) {
        dispatch(event);
      }
    }
    InboundEvent rest;
    while (!Thread.currentThread().isInterrupted() && (rest = lane.poll()) != null) {
      dispatch(rest);
    }
  }

  private void dispatch(InboundEvent event) {
    try {
      handler.handle(event);
    } catch (Throwable t) {
      // the lane has a single worker; letting anything escape would strand its queue
      log.error("Unhandled error while processing event {}", event.eventId(), t);
    }
  }
}
