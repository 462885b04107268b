package com.robomania.events;

import com.robomania.exceptions.FrameDecodeException;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.model.ScheduledEntity;
import com.robomania.scheduler.TaskPlan;
import com.robomania.scheduler.TaskRegistry;
import com.robomania.stream.FrameDecoder;
import com.robomania.stream.InboundFrame;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Applies an {@link EntityLifecycle}'s rules to inbound entity events. */
public final class EntityEventMapper<T extends ScheduledEntity> {
  private static final Logger logger = LoggerFactory.getLogger(EntityEventMapper.class);

  private final EntityLifecycle<T> lifecycle;
  private final TaskRegistry registry;
  private final FrameDecoder decoder;
  private final Clock clock;

  public EntityEventMapper(
      final EntityLifecycle<T> lifecycle,
      final TaskRegistry registry,
      final FrameDecoder decoder,
      final Clock clock) {
    this.lifecycle = lifecycle;
    this.registry = registry;
    this.decoder = decoder;
    this.clock = clock;
  }

  public void registerRoutes(final EventRouter router) {
    lifecycle
        .rules()
        .forEach(
            (action, rule) ->
                router.route(lifecycle.kind().type(action), frame -> handle(frame, rule)));
  }

  void handle(final InboundFrame frame, final EventRule rule) throws FrameDecodeException {
    final T entity =
        decoder.payload(frame, lifecycle.kind().payloadKey(), lifecycle.entityType());
    logger.info("({} #{}) Received {} event", lifecycle.kind().channel(), entity.id(),
        frame.type());

    switch (rule) {
      case SCHEDULE -> schedule(entity, frame.action());
      case CANCEL -> cancel(entity, false);
      case CANCEL_AND_NOTIFY -> cancel(entity, true);
      default -> throw new IllegalStateException("Unhandled rule " + rule);
    }
  }

  /**
   * Relays the immediate notice and replaces the entity's tasks.
   *
   * @return false when the entity was skipped
   */
  public boolean schedule(final T entity, final String action) {
    final Instant now = clock.instant();
    final Optional<Instant> due;
    try {
      due = lifecycle.dueTime(entity);
    } catch (final IllegalArgumentException e) {
      logger.warn("({} #{}) Ignoring {}: {}", lifecycle.kind().channel(), entity.id(), action,
          e.getMessage());
      return false;
    }

    if (due.isEmpty()) {
      logger.warn("({} #{}) Ignoring {}: no due time", lifecycle.kind().channel(), entity.id(),
          action);
      return false;
    }

    if (due.get().isBefore(now) && !lifecycle.reschedulesPastEntities()) {
      logger.debug("({} #{}) Due time {} already passed, skipping", lifecycle.kind().channel(),
          entity.id(), due.get());
      return false;
    }

    relayScheduled(entity, action);

    final List<TaskPlan> plans = lifecycle.plan(entity, now);
    registry.cancelAll(entity.id());
    plans.forEach(plan -> registry.schedule(entity.id(), plan));
    return true;
  }

  public void cancel(final T entity, final boolean notify) {
    registry.cancelAll(entity.id());
    if (notify && isUpcoming(entity)) {
      try {
        lifecycle.relayCancelled(entity);
      } catch (final RuntimeException e) {
        logger.error("({} #{}) Failed to relay cancellation: {}", lifecycle.kind().channel(),
            entity.id(), e.getMessage(), e);
      }
    }
  }

  private void relayScheduled(final T entity, final String action) {
    try {
      lifecycle.relayScheduled(entity, action);
    } catch (final RemoteUnavailableException e) {
      logger.error("({} #{}) Notification skipped, Roboweb unavailable: {}",
          lifecycle.kind().channel(), entity.id(), e.getMessage());
    } catch (final RuntimeException e) {
      logger.error("({} #{}) Failed to relay {}: {}", lifecycle.kind().channel(), entity.id(),
          action, e.getMessage(), e);
    }
  }

  /** Deletion payloads may carry only the id; those count as upcoming. */
  private boolean isUpcoming(final T entity) {
    try {
      return lifecycle.dueTime(entity).map(due -> !due.isBefore(clock.instant())).orElse(true);
    } catch (final IllegalArgumentException e) {
      return true;
    }
  }
}
