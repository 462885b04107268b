package com.robomania.testutils;

import static org.mockito.Mockito.*;

import com.robomania.scheduler.EventLoop;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public final class AsyncTestUtils {

  private AsyncTestUtils() {}

  /** A {@code schedule} call captured by {@link #createInlineScheduler}. */
  public record ScheduledCall(Runnable task, long delayMillis, ScheduledFuture<?> future) {}

  /**
   * Runs {@code execute} inline on the calling thread and records {@code schedule} calls without
   * running them, so tests decide when timers fire.
   */
  public static ScheduledExecutorService createInlineScheduler(final List<ScheduledCall> calls) {
    final ScheduledExecutorService scheduler = mock(ScheduledExecutorService.class);

    doAnswer(
            invocation -> {
              final Runnable task = invocation.getArgument(0);
              task.run();
              return null;
            })
        .when(scheduler)
        .execute(any(Runnable.class));

    when(scheduler.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class)))
        .thenAnswer(
            invocation -> {
              final ScheduledFuture<?> future = createMockScheduledFuture();
              final long delay = invocation.getArgument(1);
              final TimeUnit unit = invocation.getArgument(2);
              calls.add(new ScheduledCall(invocation.getArgument(0), unit.toMillis(delay), future));
              return future;
            });

    return scheduler;
  }

  public static EventLoop createInlineLoop(final List<ScheduledCall> calls) {
    return new EventLoop(createInlineScheduler(calls));
  }

  public static EventLoop createInlineLoop() {
    return createInlineLoop(new ArrayList<>());
  }

  public static ScheduledFuture<?> createMockScheduledFuture() {
    final ScheduledFuture<?> future = mock(ScheduledFuture.class);
    when(future.isDone()).thenReturn(false);
    when(future.cancel(anyBoolean())).thenReturn(true);
    return future;
  }

  /** Runs every captured call whose future was not cancelled, then forgets all of them. */
  public static int runPending(final List<ScheduledCall> calls) {
    final List<ScheduledCall> pending = new ArrayList<>(calls);
    calls.clear();
    int ran = 0;
    for (final ScheduledCall call : pending) {
      if (mockingDetails(call.future()).getInvocations().stream()
          .noneMatch(invocation -> invocation.getMethod().getName().equals("cancel"))) {
        call.task().run();
        ran++;
      }
    }
    return ran;
  }
}
