package com.robomania.relay;

import com.robomania.roboweb.model.Announcement;
import net.dv8tion.jda.api.entities.Message;

public final class AnnouncementMessages {

  private AnnouncementMessages() {}

  public static String broadcast(final Announcement announcement) {
    final String message =
        """
        @everyone
        > This announcement was published from the Robomania Bot Web panel.
        # %s
        %s
        """
            .formatted(announcement.title(), announcement.content());

    if (message.length() > Message.MAX_CONTENT_LENGTH) {
      return message.substring(0, Message.MAX_CONTENT_LENGTH - 3) + "...";
    }
    return message;
  }
}
