package com.robomania.relay;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.RestAction;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends relay messages through JDA. Every send is bounded by a timeout and completes with a
 * {@link DeliveryResult}; the returned futures never complete exceptionally.
 */
public class NotificationRelay {
  private static final Logger logger = LoggerFactory.getLogger(NotificationRelay.class);

  private final JDA jda;
  private final Duration timeout;

  public NotificationRelay(final JDA jda, final Duration timeout) {
    this.jda = jda;
    this.timeout = timeout;
  }

  public CompletableFuture<DeliveryResult> sendToChannel(
      final long channelId, final MessageCreateData message) {
    final String recipient = "channel " + channelId;
    final GuildMessageChannel channel = jda.getChannelById(GuildMessageChannel.class, channelId);
    if (channel == null) {
      logger.error("Cannot relay message: channel {} not found", channelId);
      return CompletableFuture.completedFuture(
          DeliveryResult.failed(recipient, "channel not found"));
    }
    return deliver(recipient, channel.sendMessage(message));
  }

  public CompletableFuture<DeliveryResult> sendDirect(
      final String discordId, final MessageEmbed embed) {
    final String recipient = "<@" + discordId + ">";
    final long userId;
    try {
      userId = Long.parseLong(discordId);
    } catch (final NumberFormatException e) {
      logger.warn("Cannot send direct message: invalid Discord id {}", discordId);
      return CompletableFuture.completedFuture(
          DeliveryResult.failed(recipient, "invalid Discord id"));
    }

    final RestAction<?> action =
        jda.retrieveUserById(userId)
            .flatMap(User::openPrivateChannel)
            .flatMap(privateChannel -> privateChannel.sendMessageEmbeds(embed));
    return deliver(recipient, action);
  }

  /**
   * Sends one direct message per recipient. Each attempt is independent; the aggregated report is
   * logged and returned, never thrown.
   */
  public CompletableFuture<FanOutReport> sendDirectToAll(
      final String purpose, final Map<String, MessageEmbed> embedsByDiscordId) {
    final List<CompletableFuture<DeliveryResult>> attempts = new ArrayList<>();
    embedsByDiscordId.forEach((discordId, embed) -> attempts.add(sendDirect(discordId, embed)));

    return CompletableFuture.allOf(attempts.toArray(new CompletableFuture<?>[0]))
        .thenApply(
            ignored -> {
              final FanOutReport report =
                  new FanOutReport(
                      purpose, attempts.stream().map(CompletableFuture::join).toList());
              if (report.failures().isEmpty()) {
                logger.info(report.summary());
              } else {
                logger.warn(report.summary());
              }
              return report;
            });
  }

  private CompletableFuture<DeliveryResult> deliver(
      final String recipient, final RestAction<?> action) {
    final CompletableFuture<DeliveryResult> result = new CompletableFuture<>();
    action
        .timeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
        .queue(
            success -> result.complete(DeliveryResult.delivered(recipient)),
            failure -> result.complete(describeFailure(recipient, failure)));
    return result;
  }

  private static DeliveryResult describeFailure(final String recipient, final Throwable failure) {
    if (failure instanceof ErrorResponseException errorResponse
        && errorResponse.getErrorResponse() == ErrorResponse.CANNOT_SEND_TO_USER) {
      logger.warn("{} seems to have direct messages disabled, notification not sent", recipient);
      return DeliveryResult.failed(recipient, "direct messages disabled");
    }

    logger.error(
        "Failed to relay message to {}: {}: {}",
        recipient,
        failure.getClass().getSimpleName(),
        failure.getMessage());
    return DeliveryResult.failed(recipient, failure.getMessage());
  }
}
