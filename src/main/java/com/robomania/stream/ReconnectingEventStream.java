package com.robomania.stream;

import com.google.gson.JsonObject;
import com.robomania.exceptions.FrameDecodeException;
import com.robomania.scheduler.EventLoop;
import java.time.Duration;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps one WebSocket subscription to a panel event channel alive. Listener callbacks arrive on
 * OkHttp threads and are handed to the {@link EventLoop}; state below is only touched there.
 */
public final class ReconnectingEventStream implements OutboundSender {
  private static final Logger logger = LoggerFactory.getLogger(ReconnectingEventStream.class);

  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String TOKEN_PREFIX = "Token ";
  private static final int NORMAL_CLOSURE = 1000;
  private static final Duration PING_INTERVAL = Duration.ofSeconds(30);

  private final String channel;
  private final OkHttpClient client;
  private final Request handshake;
  private final FrameDecoder decoder;
  private final EventLoop loop;
  private final ConnectionState state;

  private FrameHandler handler = frame -> {};
  private Runnable onConnected = () -> {};
  private volatile WebSocket socket;
  private volatile boolean stopped;

  public ReconnectingEventStream(
      final String channel,
      final String websocketUrl,
      final String token,
      final OkHttpClient client,
      final FrameDecoder decoder,
      final EventLoop loop,
      final BackoffPolicy policy) {
    this.channel = channel;
    this.client = client;
    this.decoder = decoder;
    this.loop = loop;
    this.state = new ConnectionState(policy);
    this.handshake =
        new Request.Builder()
            .url(websocketUrl + channel + "/")
            .header(AUTHORIZATION_HEADER, TOKEN_PREFIX + token)
            .build();
  }

  /** Long-lived sockets must not inherit the REST client's read and call timeouts. */
  public static OkHttpClient createStreamClient(final OkHttpClient restClient) {
    return restClient
        .newBuilder()
        .readTimeout(Duration.ZERO)
        .callTimeout(Duration.ZERO)
        .pingInterval(PING_INTERVAL)
        .build();
  }

  /**
   * Starts connecting. {@code onConnected} runs on the event loop after every successful
   * handshake, before the first frame of that connection is dispatched.
   */
  public void start(final FrameHandler handler, final Runnable onConnected) {
    this.handler = handler;
    this.onConnected = onConnected;
    this.stopped = false;
    loop.execute(this::connect);
  }

  public void stop() {
    stopped = true;
    final WebSocket current = socket;
    socket = null;
    if (current != null) {
      current.close(NORMAL_CLOSURE, "Bot shutting down");
    }
    logger.info("[{}] Event stream stopped", channel);
  }

  @Override
  public boolean send(final JsonObject frame) {
    final WebSocket current = socket;
    if (current == null || state.getStatus() != ConnectionStatus.CONNECTED) {
      logger.warn("[{}] Cannot send {}: WebSocket not connected", channel, frame.get("type"));
      return false;
    }
    return current.send(frame.toString());
  }

  public String getChannel() {
    return channel;
  }

  public ConnectionState getState() {
    return state;
  }

  void connect() {
    if (stopped) {
      return;
    }

    state.markConnecting();
    logger.info(
        "[{}] Attempting to connect to WebSocket (Attempt {}/{})...",
        channel,
        state.getRetryCount() + 1,
        state.getMaxAttempts());
    socket = client.newWebSocket(handshake, new Listener());
  }

  void handleOpen(final WebSocket webSocket) {
    if (webSocket != socket) {
      return;
    }

    state.markConnected();
    logger.info("[{}] Connected to WebSocket successfully.", channel);
    try {
      onConnected.run();
    } catch (final RuntimeException e) {
      logger.error("[{}] Post-connect hook failed: {}", channel, e.getMessage(), e);
    }
  }

  void handleText(final WebSocket webSocket, final String text) {
    if (webSocket != socket) {
      return;
    }

    final InboundFrame frame;
    try {
      frame = decoder.decode(text);
    } catch (final FrameDecodeException e) {
      logger.warn("[{}] Dropping frame: {} ({})", channel, e.getMessage(), text);
      return;
    }

    try {
      handler.onFrame(frame);
    } catch (final RuntimeException e) {
      logger.error("[{}] Failed to handle {} event: {}", channel, frame.type(), e.getMessage(), e);
    }
  }

  void handleConnectionLost(final WebSocket webSocket, final String reason) {
    if (webSocket != socket) {
      return;
    }
    socket = null;
    if (stopped) {
      return;
    }

    final Optional<Duration> delay = state.recordFailure();
    if (delay.isEmpty()) {
      logger.error(
          "[{}] Max retries reached. Could not connect to WebSocket. Last error: {}",
          channel,
          reason);
      return;
    }

    logger.error(
        "[{}] An error occurred: {}. Attempting to reconnect in {} seconds...",
        channel,
        reason,
        delay.get().toSeconds());
    loop.schedule(this::connect, delay.get());
  }

  private final class Listener extends WebSocketListener {

    @Override
    public void onOpen(final WebSocket webSocket, final Response response) {
      loop.execute(() -> handleOpen(webSocket));
    }

    @Override
    public void onMessage(final WebSocket webSocket, final String text) {
      loop.execute(() -> handleText(webSocket, text));
    }

    @Override
    public void onClosing(final WebSocket webSocket, final int code, final String reason) {
      webSocket.close(NORMAL_CLOSURE, null);
    }

    @Override
    public void onClosed(final WebSocket webSocket, final int code, final String reason) {
      loop.execute(
          () -> handleConnectionLost(webSocket, "connection closed (" + code + " " + reason + ")"));
    }

    @Override
    public void onFailure(final WebSocket webSocket, final Throwable t, final Response response) {
      final String reason =
          response != null
              ? t.getClass().getSimpleName() + ": " + t.getMessage() + " (HTTP " + response.code()
                  + ")"
              : t.getClass().getSimpleName() + ": " + t.getMessage();
      loop.execute(() -> handleConnectionLost(webSocket, reason));
    }
  }
}
