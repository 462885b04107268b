package com.robomania.commands;

import com.robomania.relay.BotEmbeds;
import net.dv8tion.jda.api.entities.channel.middleman.MessageChannel;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ClearCommand implements Command {
  private static final Logger logger = LoggerFactory.getLogger(ClearCommand.class);

  static final int MIN_COUNT = 1;
  static final int MAX_COUNT = 50;

  private final CommandPermissions permissions;

  public ClearCommand(final CommandPermissions permissions) {
    this.permissions = permissions;
  }

  @Override
  public String getName() {
    return "clear";
  }

  @Override
  public String getDescription() {
    return "Deletes recent messages in this channel.";
  }

  @Override
  public SlashCommandData getCommandData() {
    return Commands.slash(getName(), getDescription())
        .addOptions(
            new OptionData(OptionType.INTEGER, "count", "Number of messages to delete", true)
                .setRequiredRange(MIN_COUNT, MAX_COUNT));
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    if (!permissions.requireAdmin(event)) {
      return;
    }

    final int count = event.getOption("count", MIN_COUNT, OptionMapping::getAsInt);
    if (count < MIN_COUNT || count > MAX_COUNT) {
      event
          .replyEmbeds(
              BotEmbeds.error(
                      "Error", "Count must be between " + MIN_COUNT + " and " + MAX_COUNT + ".")
                  .build())
          .setEphemeral(true)
          .queue();
      return;
    }

    final MessageChannel channel = event.getChannel();
    event.deferReply(true).queue();
    channel
        .getIterableHistory()
        .takeAsync(count)
        .thenAccept(channel::purgeMessages)
        .whenComplete(
            (ignored, failure) -> {
              if (failure != null) {
                logger.error("Failed to clear messages in {}: {}", channel.getId(),
                    failure.getMessage());
                event
                    .getHook()
                    .sendMessageEmbeds(
                        BotEmbeds.error("Error", "An unknown error occurred.", failure).build())
                    .queue();
                return;
              }
              logger.info("Cleared {} messages in {}", count, channel.getId());
              event
                  .getHook()
                  .sendMessageEmbeds(
                      BotEmbeds.success(
                              "Messages Cleared",
                              "Deleted `" + count + "` message(s) in " + channel.getAsMention()
                                  + ".")
                          .build())
                  .queue();
            });
  }
}
