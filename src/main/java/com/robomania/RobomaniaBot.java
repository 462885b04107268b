package com.robomania;

import com.google.gson.Gson;
import com.robomania.botconfig.BotConfiguration;
import com.robomania.commands.AnnouncementCommand;
import com.robomania.commands.ClearCommand;
import com.robomania.commands.CmdCommand;
import com.robomania.commands.CommandPermissions;
import com.robomania.commands.MeetingCommand;
import com.robomania.commands.MemberCommand;
import com.robomania.commands.PingCommand;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.listeners.CommandListener;
import com.robomania.roboweb.MemberIndex;
import com.robomania.roboweb.RobowebClient;
import com.robomania.scheduler.EventLoop;
import com.robomania.stream.ReconnectingEventStream;
import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class RobomaniaBot {
  private static final Logger logger = LoggerFactory.getLogger(RobomaniaBot.class);
  private static JDA jda;
  private static BotRuntime runtime;

  private RobomaniaBot() {}

  public static void main(final String[] args) {
    final BotConfiguration config;
    try {
      config = BotConfiguration.getInstance();
      config.validateConfiguration();
    } catch (final IllegalStateException e) {
      logger.error("Invalid configuration: {}", e.getMessage());
      return;
    }

    final Clock clock = Clock.systemUTC();
    final Gson gson = new Gson();
    final OkHttpClient httpClient = RobowebClient.createHttpClient(config.getHttpTimeout());
    final RobowebClient api =
        new RobowebClient(
            httpClient,
            gson,
            config.getRobowebApiUrl(),
            config.getRobowebApiToken(),
            new MemberIndex());
    final EventLoop loop = new EventLoop("robomania-events");

    try {
      jda =
          JDABuilder.createDefault(config.getDiscordBotToken())
              .enableIntents(EnumSet.of(GatewayIntent.GUILD_MEMBERS))
              .setMemberCachePolicy(MemberCachePolicy.ALL)
              .build();

      runtime =
          new BotRuntime(
              config,
              jda,
              api,
              ReconnectingEventStream.createStreamClient(httpClient),
              gson,
              loop,
              clock);

      final CommandPermissions permissions =
          new CommandPermissions(config.getOwnerId(), config.getAdminRoleId());
      final CommandListener commandListener =
          new CommandListener(
              List.of(
                  new PingCommand(),
                  new MemberCommand(api),
                  new MeetingCommand(
                      api,
                      runtime::reloadMeetings,
                      permissions,
                      config.getTimezone(),
                      config.getPanelUrl(),
                      clock),
                  new AnnouncementCommand(
                      runtime::reloadAnnouncements, runtime::sendTestMessage, permissions),
                  new ClearCommand(permissions),
                  new CmdCommand(permissions)));
      jda.addEventListener(commandListener);

      jda.awaitReady();
      logger.info("Bot is online and ready!");

      indexMembers(api);
      registerSlashCommands(commandListener);
      runtime.start();
      Runtime.getRuntime().addShutdownHook(new Thread(RobomaniaBot::shutdown, "shutdown"));
    } catch (final InterruptedException e) {
      logger.error("Bot startup was interrupted: ", e);
      Thread.currentThread().interrupt();
    } catch (final Exception e) {
      logger.error("Error starting the bot: ", e);
    }
  }

  private static void indexMembers(final RobowebClient api) {
    try {
      api.indexMembers();
    } catch (final RemoteUnavailableException e) {
      logger.warn("Member index unavailable, lookups will hit the API: {}", e.getMessage());
    }
  }

  private static void registerSlashCommands(final CommandListener commandListener) {
    logger.info("Registering Slash Commands...");
    jda.updateCommands()
        .addCommands(commandListener.getCommandData())
        .queue(
            success -> logger.info("Slash commands registered successfully!"),
            failure -> logger.error("Failed to register slash commands: ", failure));
  }

  private static void shutdown() {
    logger.info("Shutting down...");
    if (runtime != null) {
      runtime.close();
    }
    if (jda != null) {
      jda.shutdown();
    }
  }
}
