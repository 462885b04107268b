package com.robomania.events;

import com.robomania.exceptions.FrameDecodeException;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.MemberEmbeds;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Member;
import com.robomania.roboweb.model.WarningDetail;
import com.robomania.stream.FrameDecoder;
import com.robomania.stream.InboundFrame;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Sends {@code member.add_warning_points} events to the affected member as a direct message. */
public final class WarningPointsRelay {
  private static final Logger logger = LoggerFactory.getLogger(WarningPointsRelay.class);

  public static final String ACTION = "add_warning_points";
  static final String PAYLOAD_KEY = "warning_detail";

  private final RobowebApi api;
  private final NotificationRelay relay;
  private final FrameDecoder decoder;

  public WarningPointsRelay(
      final RobowebApi api, final NotificationRelay relay, final FrameDecoder decoder) {
    this.api = api;
    this.relay = relay;
    this.decoder = decoder;
  }

  public void registerRoutes(final EventRouter router) {
    router.route(EventKind.MEMBER.type(ACTION), this::onWarningPoints);
  }

  void onWarningPoints(final InboundFrame frame)
      throws FrameDecodeException, RemoteUnavailableException {
    final WarningDetail detail = decoder.payload(frame, PAYLOAD_KEY, WarningDetail.class);
    logger.info("Received warning points event for #{}", detail.id());

    final Member member = api.getMember(detail.member(), true);
    final Member operator = api.getMember(detail.operator(), true);
    // The index may hold a stale total, always ask the API.
    final int currentPoints = api.getMember(detail.member(), false).warningPoints();

    relay.sendDirect(
        member.discordId(),
        MemberEmbeds.warningPoints(detail, currentPoints, operator.mention()));
  }
}
