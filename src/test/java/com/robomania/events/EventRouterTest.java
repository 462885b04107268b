package com.robomania.events;

import static org.junit.jupiter.api.Assertions.*;

import com.google.gson.JsonObject;
import com.robomania.exceptions.FrameDecodeException;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.stream.InboundFrame;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

final class EventRouterTest {

  private EventRouter router;
  private List<String> handled;

  @BeforeEach
  void setUp() {
    router = new EventRouter(EventKind.MEETING);
    handled = new ArrayList<>();
  }

  private static InboundFrame frame(final String type) {
    final JsonObject body = new JsonObject();
    body.addProperty("type", type);
    return new InboundFrame(type, body);
  }

  @Test
  void onFrame_KnownType_ShouldDispatch() {
    router.route("meeting.create", frame -> handled.add(frame.type()));

    router.onFrame(frame("meeting.create"));

    assertEquals(List.of("meeting.create"), handled);
  }

  @Test
  void onFrame_UnknownType_ShouldBeIgnored() {
    router.route("meeting.create", frame -> handled.add(frame.type()));

    assertDoesNotThrow(() -> router.onFrame(frame("meeting.archive")));
    assertTrue(handled.isEmpty());
  }

  @Test
  void route_DuplicateType_ShouldThrow() {
    router.route("meeting.create", frame -> {});

    assertThrows(IllegalArgumentException.class, () -> router.route("meeting.create", f -> {}));
  }

  @Test
  void onFrame_ActionFails_ShouldContainCheckedFailures() {
    router.route(
        "meeting.create",
        frame -> {
          throw new FrameDecodeException("bad payload");
        });
    router.route(
        "meeting.delete",
        frame -> {
          throw new RemoteUnavailableException("get meeting", new IOException("down"));
        });

    assertDoesNotThrow(() -> router.onFrame(frame("meeting.create")));
    assertDoesNotThrow(() -> router.onFrame(frame("meeting.delete")));
  }

  @Test
  void routedTypes_ShouldListRegisteredTypes() {
    router.route("meeting.create", frame -> {}).route("meeting.edit", frame -> {});

    assertEquals(2, router.routedTypes().size());
    assertTrue(router.routedTypes().contains("meeting.edit"));
  }
}
