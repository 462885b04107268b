package com.robomania.stream;

import com.google.gson.JsonObject;

@FunctionalInterface
public interface OutboundSender {
  /** Returns false when the frame could not be queued, e.g. while disconnected. */
  boolean send(JsonObject frame);
}
