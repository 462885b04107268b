package com.robomania.events;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.google.gson.Gson;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.relay.NotificationRelay;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import com.robomania.stream.FrameDecoder;
import java.io.IOException;
import java.util.List;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

final class AbsentRequestRelayTest {

  private static final long REVIEW_CHANNEL = 777L;

  private RobowebApi api;
  private NotificationRelay relay;
  private FrameDecoder decoder;
  private EventRouter router;

  @BeforeEach
  void setUp() throws Exception {
    api = mock(RobowebApi.class);
    relay = mock(NotificationRelay.class);
    decoder = new FrameDecoder(new Gson());
    router = new EventRouter(EventKind.MEETING);
    new AbsentRequestRelay(api, relay, decoder, REVIEW_CHANNEL, "https://panel.example")
        .registerRoutes(router);

    when(api.getMember(2L, true))
        .thenReturn(new Member(2, "222", "Requester", 12, null, List.of(), 0));
    when(api.getMember(9L, true))
        .thenReturn(new Member(9, "999", "Reviewer", 10, null, List.of(), 0));
    when(api.getMeeting(7L))
        .thenReturn(
            new Meeting(7, "Sync", null, "2024-05-01T10:00:00+08:00", null, "Lab", 9L, true, null));
  }

  @Test
  void newRequest_ShouldPostForReviewWithDetailsButton() throws Exception {
    router.onFrame(
        decoder.decode(
            "{\"type\":\"meeting.new_absent_request\",\"absent_request\":{\"id\":40,"
                + "\"meeting\":7,\"member\":2,\"reason\":\"exam week\",\"status\":\"pending\"}}"));

    final ArgumentCaptor<MessageCreateData> message =
        ArgumentCaptor.forClass(MessageCreateData.class);
    verify(relay).sendToChannel(eq(REVIEW_CHANNEL), message.capture());
    final MessageEmbed embed = message.getValue().getEmbeds().get(0);
    assertEquals("New Absence Request", embed.getTitle());
    assertTrue(embed.getFields().stream().anyMatch(field -> "<@222>".equals(field.getValue())));
    assertEquals(1, message.getValue().getComponents().size());
  }

  @Test
  void reviewedRequest_ShouldDirectMessageRequester() throws Exception {
    router.onFrame(
        decoder.decode(
            "{\"type\":\"meeting.review_absent_request\",\"absent_request\":{\"id\":40,"
                + "\"meeting\":7,\"member\":2,\"reason\":\"exam week\",\"status\":\"approved\","
                + "\"reviewer\":9,\"reviewer_comment\":\"good luck\"}}"));

    final ArgumentCaptor<MessageEmbed> embed = ArgumentCaptor.forClass(MessageEmbed.class);
    verify(relay).sendDirect(eq("222"), embed.capture());
    assertTrue(
        embed.getValue().getFields().stream()
            .anyMatch(field -> "Result".equals(field.getName())
                && "✅ Approved".equals(field.getValue())));
    assertTrue(
        embed.getValue().getFields().stream().anyMatch(field -> "<@999>".equals(field.getValue())));
  }

  @Test
  void newRequest_RobowebDown_ShouldSkipRelay() throws Exception {
    when(api.getMeeting(7L))
        .thenThrow(new RemoteUnavailableException("get meeting", new IOException("down")));

    router.onFrame(
        decoder.decode(
            "{\"type\":\"meeting.new_absent_request\",\"absent_request\":{\"id\":40,"
                + "\"meeting\":7,\"member\":2,\"reason\":\"exam week\",\"status\":\"pending\"}}"));

    verifyNoInteractions(relay);
  }
}
