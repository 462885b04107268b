package com.robomania.events;

import com.robomania.exceptions.FrameDecodeException;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.MeetingEmbeds;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import com.robomania.stream.FrameDecoder;
import com.robomania.stream.InboundFrame;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Absence-request events on the meeting stream. They never touch the timer registry: a new
 * request is posted for review, a reviewed one is sent to the requesting member.
 */
public final class AbsentRequestRelay {
  private static final Logger logger = LoggerFactory.getLogger(AbsentRequestRelay.class);

  public static final String NEW_REQUEST = "new_absent_request";
  public static final String REVIEWED_REQUEST = "review_absent_request";
  static final String PAYLOAD_KEY = "absent_request";

  private final RobowebApi api;
  private final NotificationRelay relay;
  private final FrameDecoder decoder;
  private final long absentRequestChannelId;
  private final String panelUrl;

  public AbsentRequestRelay(
      final RobowebApi api,
      final NotificationRelay relay,
      final FrameDecoder decoder,
      final long absentRequestChannelId,
      final String panelUrl) {
    this.api = api;
    this.relay = relay;
    this.decoder = decoder;
    this.absentRequestChannelId = absentRequestChannelId;
    this.panelUrl = panelUrl;
  }

  public void registerRoutes(final EventRouter router) {
    router.route(EventKind.MEETING.type(NEW_REQUEST), this::onNewRequest);
    router.route(EventKind.MEETING.type(REVIEWED_REQUEST), this::onReviewedRequest);
  }

  void onNewRequest(final InboundFrame frame)
      throws FrameDecodeException, RemoteUnavailableException {
    final AbsentRequest request = decoder.payload(frame, PAYLOAD_KEY, AbsentRequest.class);
    logger.info("Received new absent request event for request #{}", request.id());

    final Member member = api.getMember(request.member(), true);
    final Meeting meeting = api.getMeeting(request.meeting());
    relay.sendToChannel(
        absentRequestChannelId,
        new MessageCreateBuilder()
            .setEmbeds(MeetingEmbeds.newAbsentRequest(meeting, member.mention(), request))
            .addActionRow(MeetingEmbeds.detailsButton(panelUrl, meeting.id()))
            .build());
  }

  void onReviewedRequest(final InboundFrame frame)
      throws FrameDecodeException, RemoteUnavailableException {
    final AbsentRequest request = decoder.payload(frame, PAYLOAD_KEY, AbsentRequest.class);
    logger.info("Received absent request review event for request #{}", request.id());

    final Member member = api.getMember(request.member(), true);
    final String reviewerMention =
        request.reviewer() == null ? "(unknown)" : api.getMember(request.reviewer(), true).mention();
    final Meeting meeting = api.getMeeting(request.meeting());
    relay.sendDirect(
        member.discordId(), MeetingEmbeds.absentRequestReviewed(meeting, reviewerMention, request));
  }
}
