package com.robomania.events;

import java.util.Locale;

/** Panel event channels. The channel name doubles as the frame payload key and type prefix. */
public enum EventKind {
  ANNOUNCEMENT,
  MEETING,
  MEMBER;

  public String channel() {
    return name().toLowerCase(Locale.ROOT);
  }

  public String payloadKey() {
    return channel();
  }

  public String type(final String action) {
    return channel() + "." + action;
  }
}
