package com.robomania.events;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Announcement;
import com.robomania.scheduler.TaskPlan;
import com.robomania.stream.OutboundFrames;
import com.robomania.stream.OutboundSender;
import com.robomania.utils.Timestamps;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pinned announcements are unpinned at {@code pin_until} by asking the panel over the
 * announcement stream. Pins and edits always reschedule, so an expiry already in the past unpins
 * right away.
 */
public class AnnouncementLifecycle implements EntityLifecycle<Announcement> {
  private static final Logger logger = LoggerFactory.getLogger(AnnouncementLifecycle.class);

  public static final String UNPIN_TASK = "unpin";

  private static final Map<String, EventRule> RULES =
      Map.of(
          "pin", EventRule.SCHEDULE,
          "edit", EventRule.SCHEDULE,
          "unpin", EventRule.CANCEL,
          "delete", EventRule.CANCEL);

  private final RobowebApi api;
  private final OutboundSender sender;
  private final ZoneId zone;

  public AnnouncementLifecycle(
      final RobowebApi api, final OutboundSender sender, final ZoneId zone) {
    this.api = api;
    this.sender = sender;
    this.zone = zone;
  }

  @Override
  public EventKind kind() {
    return EventKind.ANNOUNCEMENT;
  }

  @Override
  public Class<Announcement> entityType() {
    return Announcement.class;
  }

  @Override
  public Map<String, EventRule> rules() {
    return RULES;
  }

  @Override
  public Optional<Instant> dueTime(final Announcement announcement) {
    return Timestamps.parseOptional(announcement.pinUntil(), zone);
  }

  @Override
  public boolean reschedulesPastEntities() {
    return true;
  }

  @Override
  public List<TaskPlan> plan(final Announcement announcement, final Instant now) {
    final Instant pinUntil = Timestamps.parse(announcement.pinUntil(), zone);
    return List.of(new TaskPlan(UNPIN_TASK, pinUntil, () -> unpin(announcement)));
  }

  @Override
  public void relayScheduled(final Announcement announcement, final String action) {
    logger.debug("(announcement #{}) Unpin scheduled for {}", announcement.id(),
        announcement.pinUntil());
  }

  @Override
  public void relayCancelled(final Announcement announcement) {
    // Announcement removals are not relayed to Discord.
  }

  @Override
  public void expire(final Announcement announcement) {
    unpin(announcement);
  }

  @Override
  public List<Announcement> fetchCurrent() throws RemoteUnavailableException {
    return api.getPinnedAnnouncements();
  }

  void unpin(final Announcement announcement) {
    if (sender.send(OutboundFrames.announcementUnpin(announcement.id()))) {
      logger.info("Unpinned announcement #{}", announcement.id());
    } else {
      logger.error("Unable to unpin announcement #{}: WebSocket not connected", announcement.id());
    }
  }
}
