package com.robomania.relay;

import java.awt.Color;
import net.dv8tion.jda.api.EmbedBuilder;

public final class BotEmbeds {
  public static final Color DEFAULT_COLOR = new Color(0x012A5E);
  public static final Color ERROR_COLOR = new Color(0xF1411C);

  private BotEmbeds() {}

  public static EmbedBuilder success(final String title, final String description) {
    return new EmbedBuilder().setTitle(title).setDescription(description).setColor(DEFAULT_COLOR);
  }

  public static EmbedBuilder error(final String title, final String description) {
    return new EmbedBuilder().setTitle(title).setDescription(description).setColor(ERROR_COLOR);
  }

  /** Generic failure notice plus the raw error for the operator. */
  public static EmbedBuilder error(
      final String title, final String description, final Throwable cause) {
    return error(title, description).addField("Error", describe(cause), false);
  }

  public static String describe(final Throwable cause) {
    final String detail =
        "```" + cause.getClass().getSimpleName() + ": " + cause.getMessage() + "```";
    return detail.length() > 1024 ? detail.substring(0, 1018) + "...```" : detail;
  }
}
