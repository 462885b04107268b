package com.robomania.roboweb.model;

public record WarningDetail(
    long id, long member, long operator, int points, String reason, String notes) {

  /** Negative points remove warnings. */
  public boolean isRemoval() {
    return points < 0;
  }

  public boolean hasNotes() {
    return notes != null && !notes.isBlank();
  }
}
