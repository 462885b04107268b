package com.robomania.roboweb.model;

import com.google.gson.annotations.SerializedName;

public record AbsentRequest(
    long id,
    long meeting,
    long member,
    String reason,
    String status,
    Long reviewer,
    @SerializedName("reviewer_comment") String reviewerComment) {

  public static final String PENDING = "pending";
  public static final String APPROVED = "approved";
  public static final String REJECTED = "rejected";

  public boolean isApproved() {
    return APPROVED.equals(status);
  }

  /** Pending and rejected requests still oblige the member to attend. */
  public boolean requiresAttendance() {
    return PENDING.equals(status) || REJECTED.equals(status);
  }

  public boolean hasReviewerComment() {
    return reviewerComment != null && !reviewerComment.isBlank();
  }
}
