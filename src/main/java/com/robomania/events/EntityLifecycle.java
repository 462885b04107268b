package com.robomania.events;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.model.ScheduledEntity;
import com.robomania.scheduler.TaskPlan;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scheduling rules for one entity kind: which events schedule or cancel, which tasks an entity
 * derives, and what gets relayed along the way.
 */
public interface EntityLifecycle<T extends ScheduledEntity> {

  EventKind kind();

  Class<T> entityType();

  /** Frame action (the part after the dot) to registry effect. */
  Map<String, EventRule> rules();

  /**
   * The timestamp that decides whether the entity is still relevant.
   *
   * @throws IllegalArgumentException when the timestamp is present but malformed
   */
  Optional<Instant> dueTime(T entity);

  /** Pin-style entities reschedule even when their due time has passed. */
  default boolean reschedulesPastEntities() {
    return false;
  }

  List<TaskPlan> plan(T entity, Instant now);

  void relayScheduled(T entity, String action) throws RemoteUnavailableException;

  void relayCancelled(T entity);

  /** Runs the end-of-life action right away for an entity found already past due. */
  void expire(T entity);

  /** Authoritative list of entities that should currently have tasks. */
  List<T> fetchCurrent() throws RemoteUnavailableException;
}
