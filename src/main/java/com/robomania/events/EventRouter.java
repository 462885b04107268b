package com.robomania.events;

import com.robomania.exceptions.FrameDecodeException;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.exceptions.RobomaniaException;
import com.robomania.stream.FrameHandler;
import com.robomania.stream.InboundFrame;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dispatch table from full frame types ({@code meeting.create}) to actions for one stream.
 * Unknown types are logged and ignored.
 */
public final class EventRouter implements FrameHandler {
  private static final Logger logger = LoggerFactory.getLogger(EventRouter.class);

  private final EventKind kind;
  private final Map<String, FrameAction> routes = new HashMap<>();

  public EventRouter(final EventKind kind) {
    this.kind = kind;
  }

  public EventRouter route(final String type, final FrameAction action) {
    if (routes.putIfAbsent(type, action) != null) {
      throw new IllegalArgumentException("Route already registered for " + type);
    }
    return this;
  }

  public Set<String> routedTypes() {
    return Set.copyOf(routes.keySet());
  }

  @Override
  public void onFrame(final InboundFrame frame) {
    final FrameAction action = routes.get(frame.type());
    if (action == null) {
      logger.info("[{}] Received unknown event: {}", kind.channel(), frame);
      return;
    }

    try {
      action.handle(frame);
    } catch (final FrameDecodeException e) {
      logger.warn("[{}] Dropping {} event: {}", kind.channel(), frame.type(), e.getMessage());
    } catch (final RemoteUnavailableException e) {
      logger.error(
          "[{}] Skipped {} event, Roboweb unavailable: {}",
          kind.channel(),
          frame.type(),
          e.getMessage());
    } catch (final RobomaniaException e) {
      logger.error("[{}] Failed to handle {} event: {}", kind.channel(), frame.type(),
          e.getMessage(), e);
    }
  }
}
