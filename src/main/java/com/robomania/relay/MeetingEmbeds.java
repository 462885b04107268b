package com.robomania.relay;

import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Meeting;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import net.dv8tion.jda.api.utils.TimeFormat;

public final class MeetingEmbeds {
  private static final String ABSENCE_ALLOWED = "Absence allowed";
  private static final String ABSENCE_NOT_ALLOWED = "Absence not allowed";
  private static final String ABSENCE_ALLOWED_TEXT =
      "Members can request absence through the web panel.";
  private static final String ABSENCE_NOT_ALLOWED_TEXT =
      "Absence requests are disabled for this meeting.\n"
          + "If you cannot attend, contact the team leads directly.";

  private MeetingEmbeds() {}

  public static Button detailsButton(final String panelUrl, final long meetingId) {
    return Button.link(panelUrl + "/meeting/" + meetingId + "/", "View meeting details")
        .withEmoji(Emoji.fromUnicode("🔗"));
  }

  public static Button createButton(final String panelUrl) {
    return Button.link(panelUrl + "/meeting/new/", "Create meeting")
        .withEmoji(Emoji.fromUnicode("📅"));
  }

  public static MessageEmbed scheduled(
      final Meeting meeting, final boolean edited, final String hostMention, final Instant start) {
    final EmbedBuilder embed =
        BotEmbeds.success(
            edited ? "Meeting Updated" : "New Meeting",
            edited
                ? "Meeting `#" + meeting.id() + "` has been updated."
                : "A new meeting `#" + meeting.id() + "` has been scheduled.");

    embed.addField("Name", meeting.name(), false);
    addAbsencePolicy(embed, meeting);
    embed.addField("Host", hostMention, false);
    embed.addField("Start Time", TimeFormat.DATE_TIME_LONG.format(start), false);
    embed.addField("Location", meeting.location(), false);
    embed.setFooter(
        "Use the web panel for anything else (editing, absence requests, reviewing requests).");
    return embed.build();
  }

  public static MessageEmbed cancelled(final Meeting meeting) {
    final EmbedBuilder embed =
        BotEmbeds.error("Meeting Cancelled", "Meeting `#" + meeting.id() + "` has been cancelled.");
    if (meeting.name() != null) {
      embed.addField("Name", meeting.name(), false);
    }
    return embed.build();
  }

  public static MessageEmbed startingSoon(final Meeting meeting, final Instant start) {
    final EmbedBuilder embed =
        BotEmbeds.success(
            "Meeting Starting Soon!",
            "Meeting **" + meeting.name() + "** (`#" + meeting.id() + "`) starts "
                + TimeFormat.RELATIVE.format(start) + "!");
    if (meeting.hasDescription()) {
      embed.addField("Description", meeting.description(), false);
    }
    embed.addField("Location", meeting.location(), false);
    return embed.build();
  }

  public static MessageEmbed started(
      final Meeting meeting,
      final Instant start,
      final Optional<String> hostMention,
      final List<String> approvedAbsentees) {
    final EmbedBuilder embed =
        BotEmbeds.success(
            "Meeting Started!",
            "Meeting **" + meeting.name() + "** (`#" + meeting.id() + "`) started at "
                + TimeFormat.DATE_TIME_LONG.format(start) + "!");
    if (meeting.hasDescription()) {
      embed.addField("Description", meeting.description(), false);
    }
    hostMention.ifPresent(mention -> embed.addField("Host", mention, false));
    embed.addField("Location", meeting.location(), false);
    if (!approvedAbsentees.isEmpty()) {
      embed.addField("Absent", String.join("\n", approvedAbsentees), false);
    }
    return embed.build();
  }

  public static MessageEmbed attendanceReminder(
      final Meeting meeting, final AbsentRequest request, final Instant start) {
    final String reason =
        AbsentRequest.PENDING.equals(request.status()) ? "has not been reviewed yet" : "was rejected";
    final EmbedBuilder embed =
        BotEmbeds.success(
            "Please Attend the Meeting on Time",
            "Your absence request **" + reason + "**, so you are still expected to attend.\n"
                + "If you cannot make it, tell the team leads right away.");
    embed.addField("Meeting", nameWithId(meeting), false);
    embed.addField("Start Time", TimeFormat.RELATIVE.format(start), false);
    return embed.build();
  }

  public static MessageEmbed newAbsentRequest(
      final Meeting meeting, final String memberMention, final AbsentRequest request) {
    final EmbedBuilder embed =
        BotEmbeds.success(
            "New Absence Request",
            "A new absence request is waiting for review on the web panel.");
    embed.addField("Meeting", nameWithId(meeting), false);
    embed.addField("Member", memberMention, false);
    embed.addField("Reason", request.reason(), false);
    return embed.build();
  }

  public static MessageEmbed absentRequestReviewed(
      final Meeting meeting, final String reviewerMention, final AbsentRequest request) {
    final EmbedBuilder embed =
        BotEmbeds.success(
            "Absence Request Reviewed", "Your absence request has been reviewed:");
    embed.addField("Meeting", nameWithId(meeting), false);
    embed.addField("Reviewer", reviewerMention, false);
    embed.addField("Result", reviewResult(request.status()), false);
    if (request.hasReviewerComment()) {
      embed.addField("Comment", request.reviewerComment(), false);
    }
    embed.setFooter("If you disagree with the decision, contact the team leads directly.");
    return embed.build();
  }

  public static MessageEmbed info(
      final Meeting meeting,
      final String hostMention,
      final Instant start,
      final Optional<Instant> end) {
    final EmbedBuilder embed =
        BotEmbeds.success("Meeting Info", "Details of meeting `#" + meeting.id() + "`");
    embed.addField("Name", meeting.name(), false);
    if (meeting.hasDescription()) {
      embed.addField("Description", meeting.description(), false);
    }
    embed.addField("Host", hostMention, false);
    embed.addField("Start Time", TimeFormat.DATE_TIME_LONG.format(start), false);
    end.ifPresent(endTime -> embed.addField("End Time", TimeFormat.DATE_TIME_LONG.format(endTime),
        false));
    embed.addField("Location", meeting.location(), false);
    addAbsencePolicy(embed, meeting);
    return embed.build();
  }

  static String reviewResult(final String status) {
    if (AbsentRequest.APPROVED.equals(status)) {
      return "✅ Approved";
    }
    if (AbsentRequest.REJECTED.equals(status)) {
      return "❌ Rejected";
    }
    return "Unknown";
  }

  private static String nameWithId(final Meeting meeting) {
    return meeting.name() + " (`#" + meeting.id() + "`)";
  }

  private static void addAbsencePolicy(final EmbedBuilder embed, final Meeting meeting) {
    if (meeting.canAbsent()) {
      embed.addField(ABSENCE_ALLOWED, ABSENCE_ALLOWED_TEXT, false);
    } else {
      embed.addField(ABSENCE_NOT_ALLOWED, ABSENCE_NOT_ALLOWED_TEXT, false);
    }
  }
}
