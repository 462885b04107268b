package com.robomania.events;

public record ReloadReport(
    EventKind kind, boolean success, int scheduled, int expired, String error) {

  public static ReloadReport completed(
      final EventKind kind, final int scheduled, final int expired) {
    return new ReloadReport(kind, true, scheduled, expired, null);
  }

  public static ReloadReport failed(final EventKind kind, final Throwable cause) {
    return new ReloadReport(
        kind, false, 0, 0, cause.getClass().getSimpleName() + ": " + cause.getMessage());
  }
}
