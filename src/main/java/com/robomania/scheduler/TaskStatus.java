package com.robomania.scheduler;

public enum TaskStatus {
  SCHEDULED,
  FIRED,
  CANCELLED
}
