package com.robomania.events;

import com.robomania.stream.InboundFrame;
import com.robomania.stream.OutboundFrames;
import com.robomania.stream.OutboundSender;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.Guild;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Answers {@code {kind}.request_initial_data} by pushing the guild's roles and channels back over
 * the stream that asked.
 */
public final class GuildSnapshotRelay {
  private static final Logger logger = LoggerFactory.getLogger(GuildSnapshotRelay.class);

  public static final String ACTION = "request_initial_data";

  private final JDA jda;
  private final long guildId;

  public GuildSnapshotRelay(final JDA jda, final long guildId) {
    this.jda = jda;
    this.guildId = guildId;
  }

  public void registerRoutes(final EventRouter router, final EventKind kind,
      final OutboundSender sender) {
    router.route(kind.type(ACTION), frame -> push(frame, sender));
  }

  void push(final InboundFrame frame, final OutboundSender sender) {
    final Guild guild = jda.getGuildById(guildId);
    if (guild == null) {
      logger.error("Cannot answer {}: guild {} not found", frame.type(), guildId);
      return;
    }

    final boolean rolesSent = sender.send(OutboundFrames.rolesUpdate(guild.getRoles()));
    final boolean channelsSent = sender.send(OutboundFrames.channelsUpdate(guild.getChannels()));
    if (rolesSent && channelsSent) {
      logger.info("Sent initial data for guild {} ({} roles, {} channels)", guild.getName(),
          guild.getRoles().size(), guild.getChannels().size());
    } else {
      logger.error("Unable to send initial data for {}: WebSocket not connected", frame.type());
    }
  }
}
