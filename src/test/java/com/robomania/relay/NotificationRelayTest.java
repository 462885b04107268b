package com.robomania.relay;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.robomania.testutils.MockDiscord;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.RestAction;
import net.dv8tion.jda.api.requests.restaction.CacheRestAction;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Answers;

final class NotificationRelayTest {

  private static final MessageEmbed EMBED = BotEmbeds.success("Title", "Body").build();

  private JDA jda;
  private NotificationRelay relay;

  @BeforeEach
  void setUp() {
    jda = MockDiscord.createMockJDA();
    relay = new NotificationRelay(jda, Duration.ofSeconds(15));
  }

  /** Stubs the DM chain for {@code userId}; a null {@code failure} means it succeeds. */
  @SuppressWarnings("unchecked")
  private void stubDirectMessage(final long userId, final Throwable failure) {
    final CacheRestAction<User> retrieve = mock(CacheRestAction.class, Answers.RETURNS_SELF);
    final RestAction<Object> chained = mock(RestAction.class, Answers.RETURNS_SELF);
    when(retrieve.flatMap(any())).thenReturn(chained);
    when(chained.flatMap(any())).thenReturn(chained);
    when(chained.timeout(anyLong(), any(TimeUnit.class))).thenReturn(chained);
    doAnswer(
            invocation -> {
              if (failure == null) {
                final Consumer<Object> success = invocation.getArgument(0);
                success.accept(new Object());
              } else {
                final Consumer<Throwable> onFailure = invocation.getArgument(1);
                onFailure.accept(failure);
              }
              return null;
            })
        .when(chained)
        .queue(any(), any());
    when(jda.retrieveUserById(userId)).thenReturn(retrieve);
  }

  @Test
  void sendToChannel_ExistingChannel_ShouldDeliver() {
    MockDiscord.createMockMessageChannel(jda, 555L);

    final DeliveryResult result =
        relay.sendToChannel(555L, new MessageCreateBuilder().setContent("hi").build()).join();

    assertTrue(result.delivered());
    assertEquals("channel 555", result.recipient());
  }

  @Test
  void sendToChannel_UnknownChannel_ShouldFailWithoutThrowing() {
    final DeliveryResult result =
        relay.sendToChannel(404L, new MessageCreateBuilder().setContent("hi").build()).join();

    assertFalse(result.delivered());
    assertEquals("channel not found", result.error());
  }

  @Test
  void sendDirect_InvalidId_ShouldFail() {
    final DeliveryResult result = relay.sendDirect("not-a-snowflake", EMBED).join();

    assertFalse(result.delivered());
    verify(jda, never()).retrieveUserById(anyLong());
  }

  @Test
  void sendDirect_Success_ShouldDeliver() {
    stubDirectMessage(111L, null);

    assertTrue(relay.sendDirect("111", EMBED).join().delivered());
  }

  @Test
  void sendDirect_DirectMessagesDisabled_ShouldReportIt() {
    final ErrorResponseException closed = mock(ErrorResponseException.class);
    when(closed.getErrorResponse()).thenReturn(ErrorResponse.CANNOT_SEND_TO_USER);
    stubDirectMessage(111L, closed);

    final DeliveryResult result = relay.sendDirect("111", EMBED).join();

    assertFalse(result.delivered());
    assertEquals("direct messages disabled", result.error());
  }

  @Test
  void sendDirectToAll_OneFailure_ShouldNotAffectOthers() {
    stubDirectMessage(111L, null);
    stubDirectMessage(222L, new IllegalStateException("rate limited"));
    stubDirectMessage(333L, null);
    final Map<String, MessageEmbed> embeds = new LinkedHashMap<>();
    embeds.put("111", EMBED);
    embeds.put("222", EMBED);
    embeds.put("333", EMBED);

    final FanOutReport report = relay.sendDirectToAll("Reminders", embeds).join();

    assertEquals(3, report.results().size());
    assertEquals(2, report.deliveredCount());
    assertEquals("<@222>", report.failures().get(0).recipient());
    assertEquals("Reminders: delivered 2/3, failed for <@222>", report.summary());
  }
}
