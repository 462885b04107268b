package com.robomania.commands;

import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;

public interface Command {

  String getName();

  String getDescription();

  void executeSlash(SlashCommandInteractionEvent event);

  /** Registration data; commands with options or subcommands override this. */
  default SlashCommandData getCommandData() {
    return Commands.slash(getName(), getDescription());
  }
}
