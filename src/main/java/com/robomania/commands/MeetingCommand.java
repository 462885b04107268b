package com.robomania.commands;

import com.robomania.events.ReloadReport;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.BotEmbeds;
import com.robomania.relay.MeetingEmbeds;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import com.robomania.utils.Timestamps;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MeetingCommand implements Command {
  private static final Logger logger = LoggerFactory.getLogger(MeetingCommand.class);

  static final String INFO = "info";
  static final String ABSENT = "absent";
  static final String CREATE = "create";
  static final String RELOAD = "reload";
  static final Duration ABSENCE_CUTOFF = Duration.ofMinutes(5);

  private final RobowebApi api;
  private final Supplier<CompletableFuture<ReloadReport>> reload;
  private final CommandPermissions permissions;
  private final ZoneId zone;
  private final String panelUrl;
  private final Clock clock;

  public MeetingCommand(
      final RobowebApi api,
      final Supplier<CompletableFuture<ReloadReport>> reload,
      final CommandPermissions permissions,
      final ZoneId zone,
      final String panelUrl,
      final Clock clock) {
    this.api = api;
    this.reload = reload;
    this.permissions = permissions;
    this.zone = zone;
    this.panelUrl = panelUrl;
    this.clock = clock;
  }

  @Override
  public String getName() {
    return "meeting";
  }

  @Override
  public String getDescription() {
    return "Meeting commands.";
  }

  @Override
  public SlashCommandData getCommandData() {
    final OptionData meetingId =
        new OptionData(OptionType.INTEGER, "id", "Meeting ID", true).setRequiredRange(1, 999);
    return Commands.slash(getName(), getDescription())
        .addSubcommands(
            new SubcommandData(INFO, "Shows the details of a meeting.").addOptions(meetingId),
            new SubcommandData(ABSENT, "Requests absence from a meeting.")
                .addOptions(
                    meetingId,
                    new OptionData(OptionType.STRING, "reason", "Reason for the absence", true)
                        .setRequiredLength(5, 100)),
            new SubcommandData(CREATE, "Schedules a new meeting on the web panel."),
            new SubcommandData(RELOAD, "Reloads all meeting reminders."));
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    final String subcommand = event.getSubcommandName();
    if (INFO.equals(subcommand)) {
      showInfo(event);
    } else if (ABSENT.equals(subcommand)) {
      requestAbsence(event);
    } else if (CREATE.equals(subcommand)) {
      showCreateLink(event);
    } else if (RELOAD.equals(subcommand)) {
      if (permissions.requireOwner(event)) {
        ReloadReplies.reloadAndReply(event, reload, "Meeting Reminders");
      }
    } else {
      event.reply("Unknown subcommand!").setEphemeral(true).queue();
    }
  }

  private void showInfo(final SlashCommandInteractionEvent event) {
    final long meetingId = event.getOption("id", 0L, OptionMapping::getAsLong);
    try {
      final Meeting meeting = api.getMeeting(meetingId);
      final String hostMention =
          meeting.host() == null ? "(unknown)" : api.getMember(meeting.host(), true).mention();
      final Instant start = Timestamps.parse(meeting.startTime(), zone);
      final Optional<Instant> end = Timestamps.parseOptional(meeting.endTime(), zone);
      event.replyEmbeds(MeetingEmbeds.info(meeting, hostMention, start, end)).queue();
    } catch (final RemoteUnavailableException | IllegalArgumentException e) {
      logger.warn("Meeting #{} lookup failed: {}", meetingId, e.getMessage());
      replyError(event, meetingNotFound(e));
    }
  }

  private void requestAbsence(final SlashCommandInteractionEvent event) {
    final long meetingId = event.getOption("id", 0L, OptionMapping::getAsLong);
    final String reason = event.getOption("reason", "", OptionMapping::getAsString);
    try {
      event.replyEmbeds(submitAbsence(meetingId, event.getUser().getId(), reason))
          .setEphemeral(true)
          .queue();
    } catch (final RemoteUnavailableException | IllegalArgumentException e) {
      logger.warn("Absence request for meeting #{} failed: {}", meetingId, e.getMessage());
      replyError(event, meetingNotFound(e));
    }
  }

  MessageEmbed submitAbsence(final long meetingId, final String discordId, final String reason)
      throws RemoteUnavailableException {
    final Meeting meeting = api.getMeeting(meetingId);
    if (!meeting.canAbsent()) {
      return BotEmbeds.error(
              "Error: Absence Not Allowed",
              "This meeting does not accept absence requests.\n"
                  + "Contact the host or the team leads directly to avoid warning points.")
          .build();
    }

    final Instant start = Timestamps.parse(meeting.startTime(), zone);
    final Instant now = clock.instant();
    if (start.isBefore(now)) {
      return BotEmbeds.error(
              "Error: Meeting Already Started", "This meeting has already started.")
          .build();
    }
    if (Duration.between(now, start).compareTo(ABSENCE_CUTOFF) <= 0) {
      return BotEmbeds.error(
              "Error: Meeting Starting Soon",
              "This meeting starts soon, absence can no longer be requested.")
          .build();
    }

    final List<Member> matches = api.searchMembersByDiscordId(discordId);
    if (matches.isEmpty()) {
      return BotEmbeds.error(
              "Error: Member Not Registered",
              "Your Discord account is not registered on the panel, so you cannot request "
                  + "absence.")
          .build();
    }

    final long memberId = matches.get(0).id();
    for (final AbsentRequest existing : api.getAbsentRequests(meetingId)) {
      if (existing.member() == memberId) {
        return BotEmbeds.error(
                "Error: Duplicate Request",
                "You already requested absence for meeting `#" + meetingId + "`.\n"
                    + "To change the reason, contact the host or the team leads directly.")
            .build();
      }
    }

    api.createAbsentRequest(meetingId, memberId, reason);
    logger.info("Member #{} requested absence from meeting #{}", memberId, meetingId);
    return BotEmbeds.success(
            "Success: Absence Requested",
            "Your absence request for meeting `#" + meetingId
                + "` was sent. Please wait for the host or team leads to review it.")
        .build();
  }

  private void showCreateLink(final SlashCommandInteractionEvent event) {
    if (!permissions.requireAdmin(event)) {
      return;
    }
    event
        .replyEmbeds(
            BotEmbeds.success("Schedule a Meeting", "Use the button below to create a meeting.")
                .build())
        .addActionRow(MeetingEmbeds.createButton(panelUrl))
        .setEphemeral(true)
        .queue();
  }

  private static MessageEmbed meetingNotFound(final Exception cause) {
    return BotEmbeds.error(
            "Error: Meeting Not Found",
            "The meeting ID may not exist, or the API returned an error.",
            cause)
        .build();
  }

  private static void replyError(
      final SlashCommandInteractionEvent event, final MessageEmbed embed) {
    event.replyEmbeds(embed).setEphemeral(true).queue();
  }
}
