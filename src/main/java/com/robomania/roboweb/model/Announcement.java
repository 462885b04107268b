package com.robomania.roboweb.model;

import com.google.gson.annotations.SerializedName;

public record Announcement(
    long id, String title, String content, @SerializedName("pin_until") String pinUntil)
    implements ScheduledEntity {}
