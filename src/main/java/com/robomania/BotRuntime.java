package com.robomania;

import com.google.gson.Gson;
import com.robomania.botconfig.BotConfiguration;
import com.robomania.events.AbsentRequestRelay;
import com.robomania.events.AnnouncementBroadcastRelay;
import com.robomania.events.AnnouncementLifecycle;
import com.robomania.events.EntityEventMapper;
import com.robomania.events.EventKind;
import com.robomania.events.EventRouter;
import com.robomania.events.GuildSnapshotRelay;
import com.robomania.events.MeetingLifecycle;
import com.robomania.events.Reconciler;
import com.robomania.events.ReloadReport;
import com.robomania.events.WarningPointsRelay;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Announcement;
import com.robomania.roboweb.model.Meeting;
import com.robomania.scheduler.EventLoop;
import com.robomania.scheduler.TaskRegistry;
import com.robomania.stream.BackoffPolicy;
import com.robomania.stream.FrameDecoder;
import com.robomania.stream.OutboundFrames;
import com.robomania.stream.ReconnectingEventStream;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import net.dv8tion.jda.api.JDA;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the scheduler core: the event loop, one timer registry per entity kind and one event
 * stream per panel channel. Reconciliation runs after every successful handshake.
 */
public final class BotRuntime implements AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(BotRuntime.class);

  private final EventLoop loop;
  private final TaskRegistry meetingTasks;
  private final TaskRegistry announcementTasks;
  private final Reconciler<Meeting> meetingReconciler;
  private final Reconciler<Announcement> announcementReconciler;
  private final ReconnectingEventStream announcementStream;
  private final ReconnectingEventStream meetingStream;
  private final ReconnectingEventStream memberStream;
  private final EventRouter announcementRouter = new EventRouter(EventKind.ANNOUNCEMENT);
  private final EventRouter meetingRouter = new EventRouter(EventKind.MEETING);
  private final EventRouter memberRouter = new EventRouter(EventKind.MEMBER);

  public BotRuntime(
      final BotConfiguration config,
      final JDA jda,
      final RobowebApi api,
      final OkHttpClient httpClient,
      final Gson gson,
      final EventLoop loop,
      final Clock clock) {
    this.loop = loop;

    final FrameDecoder decoder = new FrameDecoder(gson);
    final BackoffPolicy backoff =
        BackoffPolicy.exponential(
            config.getBaseRetryDelay(), config.getMaxRetryDelay(), config.getMaxRetries());
    final NotificationRelay relay = new NotificationRelay(jda, config.getRelayTimeout());

    announcementStream =
        stream(EventKind.ANNOUNCEMENT, config, httpClient, decoder, loop, backoff);
    meetingStream = stream(EventKind.MEETING, config, httpClient, decoder, loop, backoff);
    memberStream = stream(EventKind.MEMBER, config, httpClient, decoder, loop, backoff);

    meetingTasks =
        new TaskRegistry(EventKind.MEETING.channel(), loop, clock, config.getStaleFireWindow());
    announcementTasks =
        new TaskRegistry(
            EventKind.ANNOUNCEMENT.channel(), loop, clock, config.getStaleFireWindow());

    final MeetingLifecycle meetings =
        new MeetingLifecycle(
            api, relay, config.getTimezone(), config.getNotifyChannelId(), config.getPanelUrl());
    final AnnouncementLifecycle announcements =
        new AnnouncementLifecycle(api, announcementStream, config.getTimezone());

    new EntityEventMapper<>(meetings, meetingTasks, decoder, clock).registerRoutes(meetingRouter);
    new EntityEventMapper<>(announcements, announcementTasks, decoder, clock)
        .registerRoutes(announcementRouter);
    meetingReconciler = new Reconciler<>(meetings, meetingTasks, loop, clock);
    announcementReconciler = new Reconciler<>(announcements, announcementTasks, loop, clock);

    new AnnouncementBroadcastRelay(relay, decoder, config.getAnnounceChannelId())
        .registerRoutes(announcementRouter);
    new AbsentRequestRelay(
            api, relay, decoder, config.getAbsentRequestChannelId(), config.getPanelUrl())
        .registerRoutes(meetingRouter);
    new WarningPointsRelay(api, relay, decoder).registerRoutes(memberRouter);

    final GuildSnapshotRelay snapshots = new GuildSnapshotRelay(jda, config.getGuildId());
    snapshots.registerRoutes(announcementRouter, EventKind.ANNOUNCEMENT, announcementStream);
    snapshots.registerRoutes(meetingRouter, EventKind.MEETING, meetingStream);
    snapshots.registerRoutes(memberRouter, EventKind.MEMBER, memberStream);
  }

  private static ReconnectingEventStream stream(
      final EventKind kind,
      final BotConfiguration config,
      final OkHttpClient httpClient,
      final FrameDecoder decoder,
      final EventLoop loop,
      final BackoffPolicy backoff) {
    return new ReconnectingEventStream(
        kind.channel(),
        config.getWebsocketUrl(),
        config.getRobowebApiToken(),
        httpClient,
        decoder,
        loop,
        backoff);
  }

  public void start() {
    announcementStream.start(announcementRouter, announcementReconciler::reload);
    meetingStream.start(meetingRouter, meetingReconciler::reload);
    memberStream.start(memberRouter, () -> {});
    logger.info("Event streams started");
  }

  public CompletableFuture<ReloadReport> reloadMeetings() {
    return meetingReconciler.reloadAsync();
  }

  public CompletableFuture<ReloadReport> reloadAnnouncements() {
    return announcementReconciler.reloadAsync();
  }

  /** Sends a {@code test.message} frame over the announcement stream. */
  public boolean sendTestMessage(final String message) {
    return announcementStream.send(OutboundFrames.testMessage(message));
  }

  public TaskRegistry getMeetingTasks() {
    return meetingTasks;
  }

  public TaskRegistry getAnnouncementTasks() {
    return announcementTasks;
  }

  List<String> routedTypes(final EventKind kind) {
    final EventRouter router =
        switch (kind) {
          case ANNOUNCEMENT -> announcementRouter;
          case MEETING -> meetingRouter;
          case MEMBER -> memberRouter;
        };
    return router.routedTypes().stream().sorted().toList();
  }

  @Override
  public void close() {
    announcementStream.stop();
    meetingStream.stop();
    memberStream.stop();
    loop.close();
    logger.info("Bot runtime stopped");
  }
}
