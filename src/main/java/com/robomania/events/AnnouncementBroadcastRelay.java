package com.robomania.events;

import com.robomania.exceptions.FrameDecodeException;
import com.robomania.relay.AnnouncementMessages;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.model.Announcement;
import com.robomania.stream.FrameDecoder;
import com.robomania.stream.InboundFrame;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Posts {@code announcement.announce} events to the announcement channel. */
public final class AnnouncementBroadcastRelay {
  private static final Logger logger = LoggerFactory.getLogger(AnnouncementBroadcastRelay.class);

  public static final String ACTION = "announce";

  private final NotificationRelay relay;
  private final FrameDecoder decoder;
  private final long announceChannelId;

  public AnnouncementBroadcastRelay(
      final NotificationRelay relay, final FrameDecoder decoder, final long announceChannelId) {
    this.relay = relay;
    this.decoder = decoder;
    this.announceChannelId = announceChannelId;
  }

  public void registerRoutes(final EventRouter router) {
    router.route(EventKind.ANNOUNCEMENT.type(ACTION), this::broadcast);
  }

  void broadcast(final InboundFrame frame) throws FrameDecodeException {
    final Announcement announcement =
        decoder.payload(frame, EventKind.ANNOUNCEMENT.payloadKey(), Announcement.class);
    logger.info("(announcement #{}) Broadcasting", announcement.id());
    relay.sendToChannel(
        announceChannelId,
        new MessageCreateBuilder()
            .setContent(AnnouncementMessages.broadcast(announcement))
            .build());
  }
}
