package com.robomania.events;

/** What an entity event does to the task registry. */
public enum EventRule {
  /** Relay the immediate notice, then (re)schedule the derived tasks. */
  SCHEDULE,
  /** Cancel the entity's tasks silently. */
  CANCEL,
  /** Cancel the entity's tasks and relay a cancellation notice. */
  CANCEL_AND_NOTIFY
}
