package com.robomania.stream;

import com.google.gson.JsonObject;

/** A decoded event frame: the {@code type} discriminator plus the whole JSON object. */
public record InboundFrame(String type, JsonObject body) {

  /** Text before the first dot, e.g. {@code meeting} for {@code meeting.create}. */
  public String kind() {
    final int dot = type.indexOf('.');
    return dot < 0 ? type : type.substring(0, dot);
  }

  /** Text after the first dot, e.g. {@code create} for {@code meeting.create}. */
  public String action() {
    final int dot = type.indexOf('.');
    return dot < 0 ? "" : type.substring(dot + 1);
  }

  @Override
  public String toString() {
    return body.toString();
  }
}
