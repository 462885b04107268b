package com.robomania.events;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.MeetingEmbeds;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import com.robomania.scheduler.TaskPlan;
import com.robomania.utils.Timestamps;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Meetings get a reminder {@code discord_notify_time} seconds before they start and a notice at
 * the start time. Deleting an upcoming meeting relays a cancellation.
 */
public class MeetingLifecycle implements EntityLifecycle<Meeting> {
  private static final Logger logger = LoggerFactory.getLogger(MeetingLifecycle.class);

  public static final String NOTIFY_TASK = "notify";
  public static final String START_TASK = "start";
  public static final Duration NOTIFY_CLAMP = Duration.ofSeconds(5);

  private static final String EVERYONE = "@everyone";
  private static final Map<String, EventRule> RULES =
      Map.of(
          "create", EventRule.SCHEDULE,
          "edit", EventRule.SCHEDULE,
          "delete", EventRule.CANCEL_AND_NOTIFY);

  private final RobowebApi api;
  private final NotificationRelay relay;
  private final ZoneId zone;
  private final long notifyChannelId;
  private final String panelUrl;

  public MeetingLifecycle(
      final RobowebApi api,
      final NotificationRelay relay,
      final ZoneId zone,
      final long notifyChannelId,
      final String panelUrl) {
    this.api = api;
    this.relay = relay;
    this.zone = zone;
    this.notifyChannelId = notifyChannelId;
    this.panelUrl = panelUrl;
  }

  @Override
  public EventKind kind() {
    return EventKind.MEETING;
  }

  @Override
  public Class<Meeting> entityType() {
    return Meeting.class;
  }

  @Override
  public Map<String, EventRule> rules() {
    return RULES;
  }

  @Override
  public Optional<Instant> dueTime(final Meeting meeting) {
    return Timestamps.parseOptional(meeting.startTime(), zone);
  }

  @Override
  public List<TaskPlan> plan(final Meeting meeting, final Instant now) {
    final Instant start = Timestamps.parse(meeting.startTime(), zone);
    final Instant notifyAt = notifyTime(start, meeting.notifyOffset(), now);
    return List.of(
        new TaskPlan(NOTIFY_TASK, notifyAt, () -> notifyUpcoming(meeting)),
        new TaskPlan(START_TASK, start, () -> announceStart(meeting)));
  }

  /**
   * {@code start - offset}, or a few seconds from {@code now} when that moment is not in the
   * future, so late reminders still go through the timer.
   */
  static Instant notifyTime(final Instant start, final Duration offset, final Instant now) {
    final Instant notifyAt = start.minus(offset);
    if (!notifyAt.isAfter(now)) {
      logger.debug("Notify time {} already passed, using {} from now", notifyAt, NOTIFY_CLAMP);
      return now.plus(NOTIFY_CLAMP);
    }
    return notifyAt;
  }

  @Override
  public void relayScheduled(final Meeting meeting, final String action)
      throws RemoteUnavailableException {
    final String hostMention = hostMention(meeting);
    final Instant start = Timestamps.parse(meeting.startTime(), zone);
    final MessageEmbed embed =
        MeetingEmbeds.scheduled(meeting, "edit".equals(action), hostMention, start);

    relay.sendToChannel(
        notifyChannelId,
        new MessageCreateBuilder()
            .setEmbeds(embed)
            .addActionRow(MeetingEmbeds.detailsButton(panelUrl, meeting.id()))
            .build());
  }

  @Override
  public void relayCancelled(final Meeting meeting) {
    relay.sendToChannel(
        notifyChannelId,
        new MessageCreateBuilder().setEmbeds(MeetingEmbeds.cancelled(meeting)).build());
  }

  @Override
  public void expire(final Meeting meeting) {
    logger.debug("(meeting #{}) Already started, nothing to schedule", meeting.id());
  }

  @Override
  public List<Meeting> fetchCurrent() throws RemoteUnavailableException {
    return api.getUpcomingMeetings();
  }

  void notifyUpcoming(final Meeting meeting) {
    final Instant start = Timestamps.parse(meeting.startTime(), zone);
    relay.sendToChannel(
        notifyChannelId,
        new MessageCreateBuilder()
            .setContent(EVERYONE)
            .setEmbeds(MeetingEmbeds.startingSoon(meeting, start))
            .build());

    final List<AbsentRequest> requests;
    try {
      requests = api.getAbsentRequests(meeting.id());
    } catch (final RemoteUnavailableException e) {
      logger.error("(meeting #{}) Attendance reminders skipped: {}", meeting.id(), e.getMessage());
      return;
    }

    final Map<String, MessageEmbed> reminders = new LinkedHashMap<>();
    for (final AbsentRequest request : requests) {
      if (!request.requiresAttendance()) {
        continue;
      }
      try {
        final Member member = api.getMember(request.member(), true);
        reminders.put(
            member.discordId(), MeetingEmbeds.attendanceReminder(meeting, request, start));
      } catch (final RemoteUnavailableException e) {
        logger.warn("(meeting #{}) Cannot resolve member #{}: {}", meeting.id(), request.member(),
            e.getMessage());
      }
    }

    if (!reminders.isEmpty()) {
      relay.sendDirectToAll("Attendance reminders for meeting #" + meeting.id(), reminders);
    }
  }

  void announceStart(final Meeting meeting) {
    final Instant start = Timestamps.parse(meeting.startTime(), zone);

    Optional<String> host = Optional.empty();
    try {
      host = Optional.of(hostMention(meeting));
    } catch (final RemoteUnavailableException e) {
      logger.warn("(meeting #{}) Host lookup failed: {}", meeting.id(), e.getMessage());
    }

    final List<String> absentees = new ArrayList<>();
    try {
      for (final AbsentRequest request : api.getAbsentRequests(meeting.id())) {
        if (request.isApproved()) {
          final Member member = api.getMember(request.member(), true);
          absentees.add(member.mention() + " (" + member.realName() + ")");
        }
      }
    } catch (final RemoteUnavailableException e) {
      logger.warn("(meeting #{}) Absentee lookup failed: {}", meeting.id(), e.getMessage());
    }

    relay.sendToChannel(
        notifyChannelId,
        new MessageCreateBuilder()
            .setContent(EVERYONE)
            .setEmbeds(MeetingEmbeds.started(meeting, start, host, absentees))
            .build());
  }

  private String hostMention(final Meeting meeting) throws RemoteUnavailableException {
    if (meeting.host() == null) {
      return "(unknown)";
    }
    return api.getMember(meeting.host(), true).mention();
  }
}
