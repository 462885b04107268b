package com.robomania.commands;

import com.robomania.events.ReloadReport;
import com.robomania.relay.BotEmbeds;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;

/** Runs a reload on the event loop and answers the deferred interaction with its report. */
final class ReloadReplies {

  private ReloadReplies() {}

  static void reloadAndReply(
      final SlashCommandInteractionEvent event,
      final Supplier<CompletableFuture<ReloadReport>> reload,
      final String what) {
    event.deferReply(true).queue();
    reload
        .get()
        .whenComplete(
            (report, failure) ->
                event.getHook().sendMessageEmbeds(describe(report, failure, what)).queue());
  }

  static MessageEmbed describe(
      final ReloadReport report, final Throwable failure, final String what) {
    if (failure != null) {
      return BotEmbeds.error(
              "Error: Could Not Reload " + what, "Reloading failed unexpectedly.", failure)
          .build();
    }
    if (!report.success()) {
      return BotEmbeds.error("Error: Could Not Reload " + what, "Reloading failed.")
          .addField("Error", "```" + report.error() + "```", false)
          .build();
    }
    return BotEmbeds.success(
            "Success: Reloaded " + what,
            "Scheduled `" + report.scheduled() + "` task(s), `" + report.expired()
                + "` already past due.")
        .build();
  }
}
