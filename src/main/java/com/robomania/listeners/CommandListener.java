package com.robomania.listeners;

import com.robomania.commands.Command;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.events.session.ReadyEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CommandListener extends ListenerAdapter {
  private static final Logger logger = LoggerFactory.getLogger(CommandListener.class);

  private final Map<String, Command> commands = new LinkedHashMap<>();

  public CommandListener(final List<Command> commands) {
    for (final Command command : commands) {
      if (this.commands.putIfAbsent(command.getName(), command) != null) {
        throw new IllegalArgumentException("Duplicate command: " + command.getName());
      }
    }
  }

  public List<SlashCommandData> getCommandData() {
    return commands.values().stream().map(Command::getCommandData).toList();
  }

  @Override
  public void onReady(final ReadyEvent event) {
    logger.info("{} is ready!", event.getJDA().getSelfUser().getName());
  }

  @Override
  public void onSlashCommandInteraction(final SlashCommandInteractionEvent event) {
    final String commandName = event.getName();
    final Command command = commands.get(commandName);

    if (command == null) {
      event.reply("Unknown command!").setEphemeral(true).queue();
      return;
    }

    logger.info("{} used /{}", event.getUser().getName(), event.getFullCommandName());
    try {
      command.executeSlash(event);
    } catch (final RuntimeException e) {
      logger.error("/{} failed: {}", event.getFullCommandName(), e.getMessage(), e);
    }
  }
}
