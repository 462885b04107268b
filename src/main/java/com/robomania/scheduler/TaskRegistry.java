package com.robomania.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entity id to task name to {@link ScheduledTask}. At most one task exists per key; scheduling an
 * occupied key cancels the previous task first.
 *
 * <p>Not thread-safe: every method must be called from the owning {@link EventLoop}, which is also
 * where armed tasks fire.
 */
public final class TaskRegistry {
  private static final Logger logger = LoggerFactory.getLogger(TaskRegistry.class);

  private final String kind;
  private final EventLoop loop;
  private final Clock clock;
  private final Duration staleFireWindow;
  private final Map<Long, Map<String, ScheduledTask>> tasks = new HashMap<>();

  public TaskRegistry(
      final String kind, final EventLoop loop, final Clock clock, final Duration staleFireWindow) {
    this.kind = kind;
    this.loop = loop;
    this.clock = clock;
    this.staleFireWindow = staleFireWindow;
  }

  public ScheduledTask schedule(
      final long entityId, final String name, final Instant fireTime, final Runnable action) {
    cancel(entityId, name);

    final ScheduledTask task = new ScheduledTask(entityId, name, fireTime, action);
    tasks.computeIfAbsent(entityId, id -> new HashMap<>()).put(name, task);
    arm(task);

    logger.debug("({} #{}) Scheduled \"{}\" task at {}", kind, entityId, name, fireTime);
    return task;
  }

  public ScheduledTask schedule(final long entityId, final TaskPlan plan) {
    return schedule(entityId, plan.name(), plan.fireTime(), plan.action());
  }

  public boolean cancel(final long entityId, final String name) {
    final Map<String, ScheduledTask> entityTasks = tasks.get(entityId);
    if (entityTasks == null) {
      return false;
    }

    final ScheduledTask task = entityTasks.remove(name);
    if (entityTasks.isEmpty()) {
      tasks.remove(entityId);
    }
    if (task == null) {
      return false;
    }

    task.cancel();
    logger.debug("({} #{}) Cancelled existing \"{}\" task", kind, entityId, name);
    return true;
  }

  /** Cancels every task of one entity and returns how many were cancelled. */
  public int cancelAll(final long entityId) {
    final Map<String, ScheduledTask> entityTasks = tasks.remove(entityId);
    if (entityTasks == null) {
      return 0;
    }

    entityTasks.values().forEach(ScheduledTask::cancel);
    logger.debug("({} #{}) Cancelled {} task(s)", kind, entityId, entityTasks.size());
    return entityTasks.size();
  }

  /** Cancels and clears the whole registry. Reserved for reconciliation. */
  public int cancelEvery() {
    int cancelled = 0;
    for (final Map<String, ScheduledTask> entityTasks : tasks.values()) {
      for (final ScheduledTask task : entityTasks.values()) {
        task.cancel();
        cancelled++;
      }
    }
    tasks.clear();
    logger.debug("({}) Cleared registry, {} task(s) cancelled", kind, cancelled);
    return cancelled;
  }

  public Optional<ScheduledTask> find(final long entityId, final String name) {
    final Map<String, ScheduledTask> entityTasks = tasks.get(entityId);
    return entityTasks == null ? Optional.empty() : Optional.ofNullable(entityTasks.get(name));
  }

  public boolean isScheduled(final long entityId, final String name) {
    return find(entityId, name).isPresent();
  }

  public Map<String, ScheduledTask> tasksFor(final long entityId) {
    final Map<String, ScheduledTask> entityTasks = tasks.get(entityId);
    return entityTasks == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(entityTasks));
  }

  public Set<Long> entityIds() {
    return Set.copyOf(tasks.keySet());
  }

  public int size() {
    return tasks.values().stream().mapToInt(Map::size).sum();
  }

  private void arm(final ScheduledTask task) {
    final Duration delay = Duration.between(clock.instant(), task.getFireTime());
    task.arm(loop.schedule(() -> fire(task), delay));
  }

  void fire(final ScheduledTask task) {
    if (task.getStatus() != TaskStatus.SCHEDULED || !isCurrent(task)) {
      logger.debug("({} #{}) Ignoring superseded \"{}\" task", kind, task.getEntityId(),
          task.getName());
      return;
    }

    final Duration remaining = Duration.between(clock.instant(), task.getFireTime());
    if (remaining.compareTo(staleFireWindow) > 0) {
      logger.debug("({} #{}) \"{}\" task woke up {}s early, re-arming", kind,
          task.getEntityId(), task.getName(), remaining.toSeconds());
      arm(task);
      return;
    }

    try {
      task.getAction().run();
    } catch (final RuntimeException e) {
      logger.error("({} #{}) \"{}\" task failed: {}", kind, task.getEntityId(), task.getName(),
          e.getMessage(), e);
    } finally {
      task.markFired();
      removeIfCurrent(task);
    }
  }

  private boolean isCurrent(final ScheduledTask task) {
    return find(task.getEntityId(), task.getName()).filter(current -> current == task).isPresent();
  }

  private void removeIfCurrent(final ScheduledTask task) {
    final Map<String, ScheduledTask> entityTasks = tasks.get(task.getEntityId());
    if (entityTasks == null) {
      return;
    }

    entityTasks.remove(task.getName(), task);
    if (entityTasks.isEmpty()) {
      tasks.remove(task.getEntityId());
    }
  }
}
