package com.robomania.commands;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;

public final class PingCommand implements Command {

  @Override
  public String getName() {
    return "ping";
  }

  @Override
  public String getDescription() {
    return "Checks whether the bot is alive.";
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    event.reply("Pong!").queue();
  }
}
