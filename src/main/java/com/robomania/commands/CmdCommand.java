package com.robomania.commands;

import com.robomania.relay.BotEmbeds;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.SlashCommandData;
import net.dv8tion.jda.api.utils.FileUpload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Owner-only shell access. Output too long for an embed is attached as a text file. */
public final class CmdCommand implements Command {
  private static final Logger logger = LoggerFactory.getLogger(CmdCommand.class);

  static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  static final int MAX_INLINE_OUTPUT = MessageEmbed.DESCRIPTION_MAX_LENGTH - 6;
  static final String OUTPUT_FILE = "full_msg.txt";

  private final CommandPermissions permissions;
  private final Duration timeout;

  public CmdCommand(final CommandPermissions permissions) {
    this(permissions, DEFAULT_TIMEOUT);
  }

  CmdCommand(final CommandPermissions permissions, final Duration timeout) {
    this.permissions = permissions;
    this.timeout = timeout;
  }

  record ProcessOutput(int exitCode, String output, boolean timedOut) {}

  @Override
  public String getName() {
    return "cmd";
  }

  @Override
  public String getDescription() {
    return "Runs a command on the server and returns its output.";
  }

  @Override
  public SlashCommandData getCommandData() {
    return Commands.slash(getName(), getDescription())
        .addOption(OptionType.STRING, "command", "Command to run", true)
        .addOption(OptionType.BOOLEAN, "private", "Reply privately (default: false)", false);
  }

  @Override
  public void executeSlash(final SlashCommandInteractionEvent event) {
    if (!permissions.requireOwner(event)) {
      return;
    }

    final String command = event.getOption("command", "", OptionMapping::getAsString);
    final boolean isPrivate = event.getOption("private", false, OptionMapping::getAsBoolean);
    final List<String> argv = tokenize(command);

    if (argv.isEmpty()) {
      event
          .replyEmbeds(BotEmbeds.error("Error", "No command given.").build())
          .setEphemeral(true)
          .queue();
      return;
    }
    if (getName().equals(argv.get(0))) {
      event
          .replyEmbeds(
              BotEmbeds.error("Error", "You cannot run this command for security reasons.")
                  .build())
          .setEphemeral(isPrivate)
          .queue();
      return;
    }

    event.deferReply(isPrivate).queue();
    final InteractionHook hook = event.getHook();
    CompletableFuture.runAsync(() -> runAndReply(argv, hook));
  }

  private void runAndReply(final List<String> argv, final InteractionHook hook) {
    final ProcessOutput result;
    try {
      result = run(argv);
    } catch (final IOException e) {
      logger.warn("Command {} failed to start: {}", argv, e.getMessage());
      hook.sendMessageEmbeds(BotEmbeds.error("Error", "An error occurred.", e).build()).queue();
      return;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      hook.sendMessageEmbeds(BotEmbeds.error("Error", "Interrupted.", e).build()).queue();
      return;
    }

    logger.info("Ran {} (exit {}, timed out: {})", argv, result.exitCode(), result.timedOut());
    final String output = result.output();
    if (output.length() > MAX_INLINE_OUTPUT) {
      hook.sendMessage("The output is too long, so it is attached as a text file.")
          .addFiles(FileUpload.fromData(output.getBytes(StandardCharsets.UTF_8), OUTPUT_FILE))
          .queue();
      return;
    }
    hook.sendMessageEmbeds(describe(result)).queue();
  }

  static MessageEmbed describe(final ProcessOutput result) {
    if (result.timedOut()) {
      return BotEmbeds.error(
              "Execution Result",
              "Timed out."
                  + (result.output().isEmpty() ? "" : "\n```" + result.output() + "```"))
          .build();
    }
    final String description =
        result.output().isEmpty()
            ? "The terminal returned no output."
            : "```" + result.output() + "```";
    return BotEmbeds.success("Execution Result", description).build();
  }

  ProcessOutput run(final List<String> argv) throws IOException, InterruptedException {
    final Process process = new ProcessBuilder(argv).redirectErrorStream(true).start();
    final CompletableFuture<String> output =
        CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));

    if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
      process.destroyForcibly();
      return new ProcessOutput(-1, output.getNow(""), true);
    }
    return new ProcessOutput(process.exitValue(), output.join(), false);
  }

  private static String readAll(final InputStream stream) {
    try (stream) {
      return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
    } catch (final IOException e) {
      logger.warn("Could not read command output: {}", e.getMessage());
      return "";
    }
  }

  /** Splits on whitespace, keeping single- or double-quoted sections together. */
  static List<String> tokenize(final String command) {
    final List<String> tokens = new ArrayList<>();
    final StringBuilder current = new StringBuilder();
    char quote = 0;
    boolean inToken = false;

    for (final char c : command.toCharArray()) {
      if (quote != 0) {
        if (c == quote) {
          quote = 0;
        } else {
          current.append(c);
        }
      } else if (c == '"' || c == '\'') {
        quote = c;
        inToken = true;
      } else if (Character.isWhitespace(c)) {
        if (inToken) {
          tokens.add(current.toString());
          current.setLength(0);
          inToken = false;
        }
      } else {
        current.append(c);
        inToken = true;
      }
    }
    if (inToken) {
      tokens.add(current.toString());
    }
    return tokens;
  }
}
