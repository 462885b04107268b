package com.robomania.scheduler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-threaded loop that serializes inbound frames, timer fires and reloads. Everything that
 * touches a {@link TaskRegistry} runs here.
 */
public final class EventLoop implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(EventLoop.class);

  private final ScheduledExecutorService executor;

  public EventLoop(final String name) {
    this(
        Executors.newSingleThreadScheduledExecutor(
            runnable -> {
              final Thread thread = new Thread(runnable, name);
              thread.setDaemon(false);
              return thread;
            }));
  }

  public EventLoop(final ScheduledExecutorService executor) {
    this.executor = executor;
  }

  public void execute(final Runnable work) {
    executor.execute(guarded(work));
  }

  public ScheduledFuture<?> schedule(final Runnable work, final Duration delay) {
    final long delayMillis = Math.max(0L, delay.toMillis());
    return executor.schedule(guarded(work), delayMillis, TimeUnit.MILLISECONDS);
  }

  public <T> CompletableFuture<T> submit(final Supplier<T> work) {
    final CompletableFuture<T> result = new CompletableFuture<>();
    executor.execute(
        () -> {
          try {
            result.complete(work.get());
          } catch (final RuntimeException e) {
            logger.error("Error in event loop task: {}", e.getMessage(), e);
            result.completeExceptionally(e);
          }
        });
    return result;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  private static Runnable guarded(final Runnable work) {
    return () -> {
      try {
        work.run();
      } catch (final RuntimeException e) {
        logger.error("Error in event loop task: {}", e.getMessage(), e);
      }
    };
  }
}
