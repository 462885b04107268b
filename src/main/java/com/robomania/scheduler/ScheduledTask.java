package com.robomania.scheduler;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/** A named deferred action bound to one entity. Cancelled and fired tasks never run again. */
public final class ScheduledTask {
  private final long entityId;
  private final String name;
  private final Instant fireTime;
  private final Runnable action;
  private TaskStatus status = TaskStatus.SCHEDULED;
  private ScheduledFuture<?> future;

  ScheduledTask(
      final long entityId, final String name, final Instant fireTime, final Runnable action) {
    this.entityId = entityId;
    this.name = name;
    this.fireTime = fireTime;
    this.action = action;
  }

  public long getEntityId() {
    return entityId;
  }

  public String getName() {
    return name;
  }

  public Instant getFireTime() {
    return fireTime;
  }

  public TaskStatus getStatus() {
    return status;
  }

  Runnable getAction() {
    return action;
  }

  void arm(final ScheduledFuture<?> future) {
    this.future = future;
  }

  boolean cancel() {
    if (status != TaskStatus.SCHEDULED) {
      return false;
    }
    status = TaskStatus.CANCELLED;
    if (future != null && !future.isDone()) {
      future.cancel(false);
    }
    return true;
  }

  void markFired() {
    if (status == TaskStatus.SCHEDULED) {
      status = TaskStatus.FIRED;
    }
  }

  @Override
  public String toString() {
    return "ScheduledTask{entity=" + entityId + ", name=" + name + ", fireTime=" + fireTime
        + ", status=" + status + "}";
  }
}
