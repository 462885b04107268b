package com.robomania.relay;

import java.util.List;
import java.util.stream.Collectors;

/** Aggregated result of a best-effort fan-out. */
public record FanOutReport(String purpose, List<DeliveryResult> results) {

  public long deliveredCount() {
    return results.stream().filter(DeliveryResult::delivered).count();
  }

  public List<DeliveryResult> failures() {
    return results.stream().filter(result -> !result.delivered()).toList();
  }

  public String summary() {
    final String base =
        String.format("%s: delivered %d/%d", purpose, deliveredCount(), results.size());
    if (failures().isEmpty()) {
      return base;
    }
    return base
        + ", failed for "
        + failures().stream().map(DeliveryResult::recipient).collect(Collectors.joining(", "));
  }
}
