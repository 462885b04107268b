package com.robomania.commands;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.BotEmbeds;
import com.robomania.relay.MemberEmbeds;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Member;
import java.util.List;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class MemberCommand implements Command {
  private static final Logger logger = LoggerFactory.getLogger(MemberCommand.class);

  static final String INFO = "info";
  static final String WARNINGS = "warnings";

  private final RobowebApi api;

  public MemberCommand(final RobowebApi api) {
    this.api = api;
  }

  @Override
  public String getName() {
    return "member";
  }

  @Override
  public String getDescription() {
    return "Team member commands.";
  }

  @Override
  public SlashCommandData getCommandData() {
    return Commands.slash(getName(), getDescription())
        .addSubcommands(
            new SubcommandData(INFO, "Shows a team member's profile.")
                .addOption(OptionType.USER, "member", "Member to look up (default: you)", false),
            new SubcommandData(WARNINGS, "Lists members with non-zero warning points."));
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    final String subcommand = event.getSubcommandName();
    if (INFO.equals(subcommand)) {
      showInfo(event);
    } else if (WARNINGS.equals(subcommand)) {
      showWarnings(event);
    } else {
      event.reply("Unknown subcommand!").setEphemeral(true).queue();
    }
  }

  private void showInfo(final SlashCommandInteractionEvent event) {
    final User target = event.getOption("member", event.getUser(), OptionMapping::getAsUser);

    final List<Member> matches;
    try {
      matches = api.searchMembersByDiscordId(target.getId());
    } catch (final RemoteUnavailableException e) {
      logger.error("Member lookup for {} failed: {}", target.getId(), e.getMessage());
      replyError(event, BotEmbeds.error("Error", "An unknown error occurred.", e).build());
      return;
    }

    if (matches.isEmpty()) {
      replyError(
          event,
          BotEmbeds.error(
                  "Member Not Found",
                  "No data found for this member. Make sure they have registered.")
              .build());
      return;
    }

    event
        .replyEmbeds(
            MemberEmbeds.info(matches.get(0), target.getAsMention(), target.getEffectiveAvatarUrl()))
        .queue();
  }

  private void showWarnings(final SlashCommandInteractionEvent event) {
    final List<Member> members;
    try {
      members = api.getMembersWithWarnings();
    } catch (final RemoteUnavailableException e) {
      logger.error("Warning leaderboard failed: {}", e.getMessage());
      replyError(event, BotEmbeds.error("Error", "An unknown error occurred.", e).build());
      return;
    }
    event.replyEmbeds(MemberEmbeds.warningLeaderboard(members)).queue();
  }

  private static void replyError(
      final SlashCommandInteractionEvent event, final MessageEmbed embed) {
    event.replyEmbeds(embed).setEphemeral(true).queue();
  }
}
