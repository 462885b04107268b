package com.robomania.stream;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.robomania.exceptions.FrameDecodeException;

public final class FrameDecoder {
  private static final String TYPE_FIELD = "type";

  private final Gson gson;

  public FrameDecoder(final Gson gson) {
    this.gson = gson;
  }

  public InboundFrame decode(final String text) throws FrameDecodeException {
    final JsonElement element;
    try {
      element = JsonParser.parseString(text);
    } catch (final JsonParseException e) {
      throw new FrameDecodeException("not valid JSON", e);
    }

    if (!element.isJsonObject()) {
      throw new FrameDecodeException("expected a JSON object");
    }

    final JsonObject body = element.getAsJsonObject();
    final JsonElement type = body.get(TYPE_FIELD);
    if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) {
      throw new FrameDecodeException("missing \"" + TYPE_FIELD + "\" discriminator");
    }

    return new InboundFrame(type.getAsString(), body);
  }

  /** Decodes the nested object stored under {@code key}, e.g. {@code "meeting"}. */
  public <T> T payload(final InboundFrame frame, final String key, final Class<T> type)
      throws FrameDecodeException {
    final JsonElement payload = frame.body().get(key);
    if (payload == null || !payload.isJsonObject()) {
      throw new FrameDecodeException(frame.type() + " has no \"" + key + "\" object");
    }

    try {
      return gson.fromJson(payload, type);
    } catch (final JsonParseException e) {
      throw new FrameDecodeException(frame.type() + " carries a malformed \"" + key + "\"", e);
    }
  }
}
