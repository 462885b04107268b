package com.robomania.stream;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import java.util.List;
import java.util.Locale;
import net.dv8tion.jda.api.entities.Role;
import net.dv8tion.jda.api.entities.channel.middleman.GuildChannel;

/** Frames the bot pushes back to the panel. */
public final class OutboundFrames {
  public static final String ANNOUNCEMENT_UNPIN = "announcement.unpin";
  public static final String TEST_MESSAGE = "test.message";
  public static final String ROLES_UPDATE = "roles_update";
  public static final String CHANNELS_UPDATE = "channels_update";

  private OutboundFrames() {}

  public static JsonObject announcementUnpin(final long announcementId) {
    final JsonObject frame = typed(ANNOUNCEMENT_UNPIN);
    frame.addProperty("announcement_id", announcementId);
    return frame;
  }

  public static JsonObject testMessage(final String message) {
    final JsonObject frame = typed(TEST_MESSAGE);
    frame.addProperty("message", message);
    return frame;
  }

  public static JsonObject rolesUpdate(final List<Role> roles) {
    final JsonArray entries = new JsonArray();
    for (final Role role : roles) {
      if (role.isPublicRole() || role.isManaged()) {
        continue;
      }
      final JsonObject entry = new JsonObject();
      entry.addProperty("id", role.getId());
      entry.addProperty("name", role.getName());
      entry.addProperty("color", role.getColorRaw());
      entry.addProperty("position", role.getPosition());
      entries.add(entry);
    }

    final JsonObject frame = typed(ROLES_UPDATE);
    frame.add("roles", entries);
    return frame;
  }

  public static JsonObject channelsUpdate(final List<GuildChannel> channels) {
    final JsonArray entries = new JsonArray();
    for (final GuildChannel channel : channels) {
      final JsonObject entry = new JsonObject();
      entry.addProperty("id", channel.getId());
      entry.addProperty("name", channel.getName());
      entry.addProperty("type", channel.getType().name().toLowerCase(Locale.ROOT));
      entries.add(entry);
    }

    final JsonObject frame = typed(CHANNELS_UPDATE);
    frame.add("channels", entries);
    return frame;
  }

  private static JsonObject typed(final String type) {
    final JsonObject frame = new JsonObject();
    frame.addProperty("type", type);
    return frame;
  }
}
