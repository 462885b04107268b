package com.robomania.relay;

import com.robomania.roboweb.model.Member;
import com.robomania.roboweb.model.WarningDetail;
import java.util.Comparator;
import java.util.List;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.entities.MessageEmbed;

public final class MemberEmbeds {
  public static final int MAX_LEADERBOARD_ENTRIES = 25;
  private static final String[] MEDALS = {"🥇", "🥈", "🥉"};

  private MemberEmbeds() {}

  public static MessageEmbed info(
      final Member member, final String discordMention, final String avatarUrl) {
    final List<String> jobs = member.jobsOrEmpty();
    final String jobList =
        jobs.isEmpty()
            ? "(none)"
            : String.join("\n", jobs.stream().map(job -> "- " + job).toList());

    return BotEmbeds.success("Member Info", "Information about " + discordMention)
        .addField("Real Name", member.realName(), false)
        .addField("Jobs", jobList, false)
        .addField("Warning Points", points(member.warningPoints()), false)
        .setThumbnail(avatarUrl)
        .build();
  }

  /** Members sorted by warning points, highest first, at most 25 entries. */
  public static MessageEmbed warningLeaderboard(final List<Member> members) {
    if (members.isEmpty()) {
      return BotEmbeds.success("No Warned Members", "No member currently has warning points.")
          .build();
    }

    final List<Member> ranked =
        members.stream()
            .sorted(Comparator.comparingInt(Member::warningPoints).reversed())
            .limit(MAX_LEADERBOARD_ENTRIES)
            .toList();

    final EmbedBuilder embed =
        BotEmbeds.success(
            "Warned Members",
            "Top " + ranked.size() + " members with non-zero warning points:");
    for (int i = 0; i < ranked.size(); i++) {
      final Member member = ranked.get(i);
      final String name = i < MEDALS.length ? MEDALS[i] + " " + member.realName() : member.realName();
      embed.addField(name, points(member.warningPoints()), false);
    }
    return embed.build();
  }

  public static MessageEmbed warningPoints(
      final WarningDetail detail, final int currentPoints, final String operatorMention) {
    final String operation = detail.isRemoval() ? "removed" : "added";
    final EmbedBuilder embed =
        BotEmbeds.success(
            detail.isRemoval() ? "Warning Points Removed" : "Warning Points Added",
            "A team lead just " + operation + " warning points on your record:");
    embed.addField("Points", points(detail.points()), false);
    embed.addField("Total After Change", points(currentPoints), false);
    embed.addField("Operator", operatorMention, false);
    embed.addField("Reason", detail.reason(), false);
    if (detail.hasNotes()) {
      embed.addField("Notes", detail.notes(), false);
    }
    embed.setFooter("If you have any questions, contact the team leads right away.");
    return embed.build();
  }

  private static String points(final int points) {
    return "`" + points + "` pts";
  }
}
