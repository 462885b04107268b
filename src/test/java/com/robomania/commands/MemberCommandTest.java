package com.robomania.commands;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.RobowebApi;
import com.robomania.roboweb.model.Member;
import com.robomania.testutils.MockDiscord;
import java.io.IOException;
import java.util.List;
import net.dv8tion.jda.api.entities.MessageEmbed;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

final class MemberCommandTest {

  private RobowebApi api;
  private MemberCommand command;
  private User user;

  @BeforeEach
  void setUp() {
    api = mock(RobowebApi.class);
    command = new MemberCommand(api);
    user = MockDiscord.createMockUser(111L, "alice");
  }

  private MessageEmbed repliedEmbed(final SlashCommandInteractionEvent event) {
    final ArgumentCaptor<MessageEmbed> embed = ArgumentCaptor.forClass(MessageEmbed.class);
    verify(event).replyEmbeds(embed.capture());
    return embed.getValue();
  }

  @Test
  void info_NoOption_ShouldDescribeCaller() throws Exception {
    final SlashCommandInteractionEvent event =
        MockDiscord.createMockSlashEvent("member", MemberCommand.INFO, user);
    when(event.getOption(eq("member"), any(User.class), any())).thenReturn(user);
    when(api.searchMembersByDiscordId("111"))
        .thenReturn(List.of(new Member(1, "111", "Alice Chen", 12, null, List.of("Captain"), 2)));

    command.executeSlash(event);

    final MessageEmbed embed = repliedEmbed(event);
    assertEquals("Member Info", embed.getTitle());
    assertEquals("https://cdn.example/avatar/111.png", embed.getThumbnail().getUrl());
  }

  @Test
  void info_Unregistered_ShouldReplyNotFound() throws Exception {
    final SlashCommandInteractionEvent event =
        MockDiscord.createMockSlashEvent("member", MemberCommand.INFO, user);
    when(event.getOption(eq("member"), any(User.class), any())).thenReturn(user);
    when(api.searchMembersByDiscordId("111")).thenReturn(List.of());

    command.executeSlash(event);

    assertEquals("Member Not Found", repliedEmbed(event).getTitle());
  }

  @Test
  void warnings_ApiDown_ShouldReplyError() throws Exception {
    final SlashCommandInteractionEvent event =
        MockDiscord.createMockSlashEvent("member", MemberCommand.WARNINGS, user);
    when(api.getMembersWithWarnings())
        .thenThrow(new RemoteUnavailableException("fetch bad guys", new IOException("down")));

    command.executeSlash(event);

    assertEquals("Error", repliedEmbed(event).getTitle());
  }

  @Test
  void warnings_ShouldShowLeaderboard() throws Exception {
    final SlashCommandInteractionEvent event =
        MockDiscord.createMockSlashEvent("member", MemberCommand.WARNINGS, user);
    when(api.getMembersWithWarnings())
        .thenReturn(List.of(new Member(1, "111", "Alice Chen", 12, null, List.of(), 2)));

    command.executeSlash(event);

    assertEquals("Warned Members", repliedEmbed(event).getTitle());
  }
}
