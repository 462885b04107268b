package com.robomania.roboweb.model;

import com.google.gson.annotations.SerializedName;
import java.util.List;

public record Member(
    long id,
    @SerializedName("discord_id") String discordId,
    @SerializedName("real_name") String realName,
    int gen,
    @SerializedName("email_address") String emailAddress,
    List<String> jobs,
    @SerializedName("warning_points") int warningPoints) {

  public String mention() {
    return "<@" + discordId + ">";
  }

  public List<String> jobsOrEmpty() {
    return jobs == null ? List.of() : jobs;
  }
}
