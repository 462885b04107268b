package com.robomania.scheduler;

import java.time.Instant;

/** A deferred action derived from an entity, not yet registered. */
public record TaskPlan(String name, Instant fireTime, Runnable action) {}
