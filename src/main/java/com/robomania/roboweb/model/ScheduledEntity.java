package com.robomania.roboweb.model;

/** A Roboweb record whose lifecycle drives scheduled tasks. */
public interface ScheduledEntity {
  long id();
}
