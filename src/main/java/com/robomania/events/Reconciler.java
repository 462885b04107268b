package com.robomania.events;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.model.ScheduledEntity;
import com.robomania.scheduler.EventLoop;
import com.robomania.scheduler.TaskPlan;
import com.robomania.scheduler.TaskRegistry;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a {@link TaskRegistry} from the panel's authoritative state. The registry ends up
 * either fully rebuilt or empty, never half-populated.
 */
public final class Reconciler<T extends ScheduledEntity> {
  private static final Logger logger = LoggerFactory.getLogger(Reconciler.class);

  private final EntityLifecycle<T> lifecycle;
  private final TaskRegistry registry;
  private final EventLoop loop;
  private final Clock clock;

  public Reconciler(
      final EntityLifecycle<T> lifecycle,
      final TaskRegistry registry,
      final EventLoop loop,
      final Clock clock) {
    this.lifecycle = lifecycle;
    this.registry = registry;
    this.loop = loop;
    this.clock = clock;
  }

  /** Runs {@link #reload()} on the event loop. */
  public CompletableFuture<ReloadReport> reloadAsync() {
    return loop.submit(this::reload);
  }

  /** Must be called on the event loop. */
  public ReloadReport reload() {
    final EventKind kind = lifecycle.kind();
    final List<T> current;
    try {
      current = lifecycle.fetchCurrent();
    } catch (final RemoteUnavailableException e) {
      logger.error("[{}] Failed to reload tasks: {}", kind.channel(), e.getMessage());
      return ReloadReport.failed(kind, e);
    }

    final Instant now = clock.instant();
    final Map<Long, List<TaskPlan>> plans = new LinkedHashMap<>();
    final List<T> expired = new ArrayList<>();
    try {
      for (final T entity : current) {
        final Optional<Instant> due = lifecycle.dueTime(entity);
        if (due.isEmpty()) {
          logger.warn("[{}] #{} has no due time, skipping", kind.channel(), entity.id());
        } else if (due.get().isBefore(now)) {
          expired.add(entity);
        } else {
          plans.put(entity.id(), lifecycle.plan(entity, now));
        }
      }
    } catch (final RuntimeException e) {
      registry.cancelEvery();
      logger.error("[{}] Failed to reload tasks, registry cleared: {}", kind.channel(),
          e.getMessage(), e);
      return ReloadReport.failed(kind, e);
    }

    registry.cancelEvery();
    plans.forEach(
        (entityId, entityPlans) -> entityPlans.forEach(plan -> registry.schedule(entityId, plan)));

    for (final T entity : expired) {
      try {
        lifecycle.expire(entity);
      } catch (final RuntimeException e) {
        logger.error("[{}] Failed to expire #{}: {}", kind.channel(), entity.id(), e.getMessage(),
            e);
      }
    }

    final int scheduled = plans.values().stream().mapToInt(List::size).sum();
    logger.info("[{}] Reloaded tasks: {} scheduled for {} entities, {} expired", kind.channel(),
        scheduled, plans.size(), expired.size());
    return ReloadReport.completed(kind, scheduled, expired.size());
  }
}
