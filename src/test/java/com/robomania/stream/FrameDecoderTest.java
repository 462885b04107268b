package com.robomania.stream;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.Gson;
import com.robomania.exceptions.FrameDecodeException;
import com.robomania.roboweb.model.Meeting;
import org.junit.jupiter.api.Test;

final class FrameDecoderTest {

  private final FrameDecoder decoder = new FrameDecoder(new Gson());

  @Test
  void decode_TypedObject_ShouldSplitKindAndAction() throws FrameDecodeException {
    final InboundFrame frame = decoder.decode("{\"type\":\"meeting.create\",\"meeting\":{}}");

    assertEquals("meeting.create", frame.type());
    assertEquals("meeting", frame.kind());
    assertEquals("create", frame.action());
  }

  @Test
  void decode_NotJson_ShouldThrow() {
    final FrameDecodeException e =
        assertThrows(FrameDecodeException.class, () -> decoder.decode("{not json"));
    assertTrue(e.getMessage().contains("not valid JSON"));
  }

  @Test
  void decode_Array_ShouldThrow() {
    assertThrows(FrameDecodeException.class, () -> decoder.decode("[1,2]"));
  }

  @Test
  void decode_MissingType_ShouldThrow() {
    assertThrows(FrameDecodeException.class, () -> decoder.decode("{\"meeting\":{}}"));
  }

  @Test
  void decode_NonStringType_ShouldThrow() {
    assertThrows(FrameDecodeException.class, () -> decoder.decode("{\"type\":7}"));
  }

  @Test
  void payload_Meeting_ShouldDecodeSnakeCaseFields() throws FrameDecodeException {
    final InboundFrame frame =
        decoder.decode(
            "{\"type\":\"meeting.create\",\"meeting\":{\"id\":12,\"name\":\"Weekly\","
                + "\"start_time\":\"2024-05-01T10:00:00+08:00\",\"can_absent\":true,"
                + "\"discord_notify_time\":\"600\",\"host\":3}}");

    final Meeting meeting = decoder.payload(frame, "meeting", Meeting.class);

    assertEquals(12, meeting.id());
    assertEquals("2024-05-01T10:00:00+08:00", meeting.startTime());
    assertTrue(meeting.canAbsent());
    assertEquals(3L, meeting.host());
    assertEquals(600, meeting.notifyOffset().toSeconds());
  }

  @Test
  void payload_MissingKey_ShouldThrow() throws FrameDecodeException {
    final InboundFrame frame = decoder.decode("{\"type\":\"meeting.create\"}");

    assertThrows(
        FrameDecodeException.class, () -> decoder.payload(frame, "meeting", Meeting.class));
  }

  @Test
  void payload_WrongFieldType_ShouldThrow() throws FrameDecodeException {
    final InboundFrame frame =
        decoder.decode("{\"type\":\"meeting.create\",\"meeting\":{\"id\":\"abc\"}}");

    assertThrows(
        FrameDecodeException.class, () -> decoder.payload(frame, "meeting", Meeting.class));
  }
}
