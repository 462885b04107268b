package com.robomania.events;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Announcement;
import com.robomania.roboweb.model.Meeting;
import com.robomania.scheduler.EventLoop;
import com.robomania.scheduler.TaskRegistry;
import com.robomania.stream.OutboundFrames;
import com.robomania.stream.OutboundSender;
import com.robomania.testutils.AsyncTestUtils;
import com.robomania.testutils.AsyncTestUtils.ScheduledCall;
import com.robomania.testutils.MutableClock;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class ReconcilerTest {

  private static final ZoneId TAIPEI = ZoneId.of("Asia/Taipei");
  private static final Instant NOW = Instant.parse("2024-05-01T01:50:00Z");

  private List<ScheduledCall> calls;
  private MutableClock clock;
  private EventLoop loop;
  private RobowebApi api;
  private NotificationRelay relay;
  private TaskRegistry registry;
  private Reconciler<Meeting> reconciler;

  @BeforeEach
  void setUp() {
    calls = new ArrayList<>();
    clock = new MutableClock(NOW);
    loop = AsyncTestUtils.createInlineLoop(calls);
    api = mock(RobowebApi.class);
    relay = mock(NotificationRelay.class);
    registry = new TaskRegistry("meeting", loop, clock, Duration.ofSeconds(1000));
    reconciler =
        new Reconciler<>(
            new MeetingLifecycle(api, relay, TAIPEI, 555L, "https://panel.example"),
            registry,
            loop,
            clock);
  }

  private static Meeting meeting(final long id, final String startTime) {
    return new Meeting(id, "Sync " + id, null, startTime, null, "Lab", null, true, "300");
  }

  private Map<String, Instant> snapshot() {
    final Map<String, Instant> tasks = new TreeMap<>();
    for (final long entityId : registry.entityIds()) {
      registry
          .tasksFor(entityId)
          .forEach((name, task) -> tasks.put(entityId + "/" + name, task.getFireTime()));
    }
    return tasks;
  }

  @Test
  void reload_ShouldScheduleEveryUpcomingEntity() throws Exception {
    when(api.getUpcomingMeetings())
        .thenReturn(
            List.of(
                meeting(1, "2024-05-01T10:00:00+08:00"), meeting(2, "2024-05-02T10:00:00+08:00")));

    final ReloadReport report = reconciler.reload();

    assertTrue(report.success());
    assertEquals(4, report.scheduled());
    assertEquals(0, report.expired());
    assertEquals(4, registry.size());
    verifyNoInteractions(relay);
  }

  @Test
  void reload_Twice_ShouldProduceSameRegistry() throws Exception {
    when(api.getUpcomingMeetings())
        .thenReturn(
            List.of(
                meeting(1, "2024-05-01T10:00:00+08:00"), meeting(2, "2024-05-02T10:00:00+08:00")));

    reconciler.reload();
    final Map<String, Instant> first = snapshot();
    reconciler.reload();

    assertEquals(first, snapshot());
    assertEquals(4, registry.size());
  }

  @Test
  void reload_ShouldDropTasksOfEntitiesNoLongerListed() throws Exception {
    registry.schedule(99, MeetingLifecycle.START_TASK, NOW.plusSeconds(600), () -> {});
    when(api.getUpcomingMeetings()).thenReturn(List.of(meeting(1, "2024-05-01T10:00:00+08:00")));

    reconciler.reload();

    assertFalse(registry.entityIds().contains(99L));
    assertEquals(2, registry.size());
  }

  @Test
  void reload_PastEntity_ShouldExpireInsteadOfScheduling() throws Exception {
    when(api.getUpcomingMeetings())
        .thenReturn(
            List.of(
                meeting(1, "2024-05-01T09:00:00+08:00"), meeting(2, "2024-05-01T10:00:00+08:00")));

    final ReloadReport report = reconciler.reload();

    assertEquals(1, report.expired());
    assertFalse(registry.entityIds().contains(1L));
    assertEquals(2, registry.size());
  }

  @Test
  void reload_FetchFails_ShouldLeaveRegistryUntouched() throws Exception {
    registry.schedule(1, MeetingLifecycle.START_TASK, NOW.plusSeconds(600), () -> {});
    when(api.getUpcomingMeetings())
        .thenThrow(new RemoteUnavailableException("list meetings", new IOException("timeout")));

    final ReloadReport report = reconciler.reload();

    assertFalse(report.success());
    assertTrue(report.error().contains("RemoteUnavailableException"));
    assertTrue(registry.isScheduled(1, MeetingLifecycle.START_TASK));
  }

  @Test
  void reload_PlanningFails_ShouldLeaveRegistryEmpty() throws Exception {
    registry.schedule(5, MeetingLifecycle.START_TASK, NOW.plusSeconds(600), () -> {});
    when(api.getUpcomingMeetings())
        .thenReturn(List.of(meeting(1, "2024-05-01T10:00:00+08:00"), meeting(2, "not a date")));

    final ReloadReport report = reconciler.reload();

    assertFalse(report.success());
    assertEquals(0, registry.size());
  }

  @Test
  void reload_EntityWithoutDueTime_ShouldBeSkipped() throws Exception {
    when(api.getUpcomingMeetings()).thenReturn(List.of(meeting(1, null)));

    final ReloadReport report = reconciler.reload();

    assertTrue(report.success());
    assertEquals(0, report.scheduled());
    assertEquals(0, registry.size());
  }

  @Test
  void reloadAsync_ShouldCompleteWithReport() throws Exception {
    when(api.getUpcomingMeetings()).thenReturn(List.of(meeting(1, "2024-05-01T10:00:00+08:00")));

    final ReloadReport report = reconciler.reloadAsync().join();

    assertEquals(EventKind.MEETING, report.kind());
    assertEquals(2, report.scheduled());
  }

  @Test
  void reload_ExpiredAnnouncement_ShouldUnpinRightAway() throws Exception {
    final OutboundSender sender = mock(OutboundSender.class);
    when(sender.send(any())).thenReturn(true);
    final TaskRegistry announcementTasks =
        new TaskRegistry("announcement", loop, clock, Duration.ofSeconds(1000));
    final Reconciler<Announcement> announcements =
        new Reconciler<>(
            new AnnouncementLifecycle(api, sender, TAIPEI), announcementTasks, loop, clock);
    when(api.getPinnedAnnouncements())
        .thenReturn(
            List.of(
                new Announcement(1, "Old", "c", "2024-04-30T10:00:00+08:00"),
                new Announcement(2, "New", "c", "2024-05-03T10:00:00+08:00")));

    final ReloadReport report = announcements.reload();

    assertEquals(1, report.scheduled());
    assertEquals(1, report.expired());
    verify(sender).send(OutboundFrames.announcementUnpin(1));
    assertTrue(announcementTasks.isScheduled(2, AnnouncementLifecycle.UNPIN_TASK));
  }

  @Test
  void reload_ExpireThrows_ShouldStillReport() throws Exception {
    final OutboundSender sender = mock(OutboundSender.class);
    when(sender.send(any())).thenThrow(new IllegalStateException("socket gone"));
    final Reconciler<Announcement> announcements =
        new Reconciler<>(
            new AnnouncementLifecycle(api, sender, TAIPEI),
            new TaskRegistry("announcement", loop, clock, Duration.ofSeconds(1000)),
            loop,
            clock);
    when(api.getPinnedAnnouncements())
        .thenReturn(List.of(new Announcement(1, "Old", "c", "2024-04-30T10:00:00+08:00")));

    final ReloadReport report = announcements.reload();

    assertTrue(report.success());
    assertEquals(1, report.expired());
  }
}
