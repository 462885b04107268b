package com.robomania.commands;

import com.robomania.events.ReloadReport;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;
import java.util.function.Supplier;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;

public final class AnnouncementCommand implements Command {
  static final String RELOAD = "reload";
  static final String TEST = "test";
  static final String TEST_MESSAGE = "test";

  private final Supplier<CompletableFuture<ReloadReport>> reload;
  private final Predicate<String> testSender;
  private final CommandPermissions permissions;

  public AnnouncementCommand(
      final Supplier<CompletableFuture<ReloadReport>> reload,
      final Predicate<String> testSender,
      final CommandPermissions permissions) {
    this.reload = reload;
    this.testSender = testSender;
    this.permissions = permissions;
  }

  @Override
  public String getName() {
    return "announcement";
  }

  @Override
  public String getDescription() {
    return "Announcement commands.";
  }

  @Override
  public SlashCommandData getCommandData() {
    return Commands.slash(getName(), getDescription())
        .addSubcommands(
            new SubcommandData(RELOAD, "Reloads every announcement unpin task."),
            new SubcommandData(TEST, "Sends a test frame to the web panel."));
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    if (!permissions.requireOwner(event)) {
      return;
    }

    final String subcommand = event.getSubcommandName();
    if (RELOAD.equals(subcommand)) {
      ReloadReplies.reloadAndReply(event, reload, "Unpin Tasks");
    } else if (TEST.equals(subcommand)) {
      final boolean sent = testSender.test(TEST_MESSAGE);
      event
          .reply(sent ? "Test message sent." : "Test message not sent: WebSocket not connected.")
          .setEphemeral(true)
          .queue();
    } else {
      event.reply("Unknown subcommand!").setEphemeral(true).queue();
    }
  }
}
