package com.robomania.roboweb.model;

import com.google.gson.annotations.SerializedName;
import java.time.Duration;

public record Meeting(
    long id,
    String name,
    String description,
    @SerializedName("start_time") String startTime,
    @SerializedName("end_time") String endTime,
    String location,
    Long host,
    @SerializedName("can_absent") boolean canAbsent,
    @SerializedName("discord_notify_time") String discordNotifyTime)
    implements ScheduledEntity {

  public static final Duration DEFAULT_NOTIFY_OFFSET = Duration.ofMinutes(5);

  /** How long before {@code start_time} the reminder goes out. */
  public Duration notifyOffset() {
    if (discordNotifyTime == null || discordNotifyTime.isBlank()) {
      return DEFAULT_NOTIFY_OFFSET;
    }
    try {
      final long seconds = Long.parseLong(discordNotifyTime.trim());
      return seconds < 0 ? DEFAULT_NOTIFY_OFFSET : Duration.ofSeconds(seconds);
    } catch (final NumberFormatException e) {
      return DEFAULT_NOTIFY_OFFSET;
    }
  }

  public boolean hasDescription() {
    return description != null && !description.isBlank();
  }
}
