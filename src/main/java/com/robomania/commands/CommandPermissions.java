package com.robomania.commands;

import com.robomania.relay.BotEmbeds;
import net.dv8tion.jda.api.entities.Member;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;

/** Owner and admin-role checks. A failed check replies to the interaction itself. */
public final class CommandPermissions {
  private final long ownerId;
  private final long adminRoleId;

  public CommandPermissions(final long ownerId, final long adminRoleId) {
    this.ownerId = ownerId;
    this.adminRoleId = adminRoleId;
  }

  public boolean isOwner(final SlashCommandInteractionEvent event) {
    return ownerId != 0 && event.getUser().getIdLong() == ownerId;
  }

  public boolean isAdmin(final SlashCommandInteractionEvent event) {
    final Member member = event.getMember();
    return member != null
        && member.getRoles().stream().anyMatch(role -> role.getIdLong() == adminRoleId);
  }

  public boolean requireOwner(final SlashCommandInteractionEvent event) {
    if (isOwner(event)) {
      return true;
    }
    deny(event, "Only the bot owner can use this command.");
    return false;
  }

  public boolean requireAdmin(final SlashCommandInteractionEvent event) {
    if (isAdmin(event) || isOwner(event)) {
      return true;
    }
    deny(event, "You need the team lead role to use this command.");
    return false;
  }

  private static void deny(final SlashCommandInteractionEvent event, final String reason) {
    event
        .replyEmbeds(BotEmbeds.error("Missing Permissions", reason).build())
        .setEphemeral(true)
        .queue();
  }
}
