package com.robomania.roboweb;

import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Announcement;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import java.util.List;

/**
 * Call contract of the Roboweb panel API. Every method fails with {@link
 * RemoteUnavailableException} when the panel answers with a non-success status or cannot be
 * reached; callers log and carry on.
 */
public interface RobowebApi {

  List<Member> searchMembersByDiscordId(String discordId) throws RemoteUnavailableException;

  /** Fetches every member and refreshes the in-memory index. */
  List<Member> indexMembers() throws RemoteUnavailableException;

  /**
   * Looks a member up by primary key. With {@code fromIndex} the cached listing is consulted first
   * and the API is only hit on a miss.
   */
  Member getMember(long memberId, boolean fromIndex) throws RemoteUnavailableException;

  List<Member> getMembersWithWarnings() throws RemoteUnavailableException;

  Meeting getMeeting(long meetingId) throws RemoteUnavailableException;

  List<Meeting> getUpcomingMeetings() throws RemoteUnavailableException;

  List<Announcement> getPinnedAnnouncements() throws RemoteUnavailableException;

  List<AbsentRequest> getAbsentRequests(long meetingId) throws RemoteUnavailableException;

  AbsentRequest createAbsentRequest(long meetingId, long memberId, String reason)
      throws RemoteUnavailableException;
}
