package com.robomania.roboweb;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.robomania.exceptions.RemoteUnavailableException;
import com.robomania.roboweb.model.AbsentRequest;
import com.robomania.roboweb.model.Announcement;
import com.robomania.roboweb.model.Meeting;
import com.robomania.roboweb.model.Member;
import java.io.IOException;
import java.lang.reflect.Type;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class RobowebClient implements RobowebApi {
  private static final Logger logger = LoggerFactory.getLogger(RobowebClient.class);
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private static final String AUTHORIZATION_HEADER = "Authorization";
  private static final String TOKEN_PREFIX = "Token ";

  private static final Type MEMBER_LIST = new TypeToken<List<Member>>() {}.getType();
  private static final Type MEETING_LIST = new TypeToken<List<Meeting>>() {}.getType();
  private static final Type ANNOUNCEMENT_LIST = new TypeToken<List<Announcement>>() {}.getType();
  private static final Type ABSENT_REQUEST_LIST =
      new TypeToken<List<AbsentRequest>>() {}.getType();

  private final OkHttpClient client;
  private final Gson gson;
  private final HttpUrl baseUrl;
  private final String token;
  private final MemberIndex memberIndex;

  public RobowebClient(
      final OkHttpClient client,
      final Gson gson,
      final String baseUrl,
      final String token,
      final MemberIndex memberIndex) {
    this.client = client;
    this.gson = gson;
    this.baseUrl = HttpUrl.get(baseUrl);
    this.token = token;
    this.memberIndex = memberIndex;
  }

  public static OkHttpClient createHttpClient(final Duration timeout) {
    return new OkHttpClient.Builder()
        .connectTimeout(timeout)
        .readTimeout(timeout)
        .callTimeout(timeout.multipliedBy(2))
        .build();
  }

  @Override
  public List<Member> searchMembersByDiscordId(final String discordId)
      throws RemoteUnavailableException {
    final HttpUrl url =
        path("members").newBuilder().addQueryParameter("discord_id", discordId).build();
    return get(url, "search members", MEMBER_LIST);
  }

  @Override
  public List<Member> indexMembers() throws RemoteUnavailableException {
    final List<Member> members = get(path("members"), "index members", MEMBER_LIST);
    memberIndex.replaceAll(members);
    logger.info("Indexed {} members", members.size());
    return members;
  }

  @Override
  public Member getMember(final long memberId, final boolean fromIndex)
      throws RemoteUnavailableException {
    if (fromIndex) {
      final Optional<Member> cached = memberIndex.find(memberId);
      if (cached.isPresent()) {
        return cached.get();
      }
      logger.debug("Member #{} not in index, fetching from API", memberId);
    }

    final Member member =
        get(path("members", String.valueOf(memberId)), "fetch member info", Member.class);
    memberIndex.put(member);
    return member;
  }

  @Override
  public List<Member> getMembersWithWarnings() throws RemoteUnavailableException {
    return get(path("members", "bad_guys"), "fetch bad guys", MEMBER_LIST);
  }

  @Override
  public Meeting getMeeting(final long meetingId) throws RemoteUnavailableException {
    return get(path("meetings", String.valueOf(meetingId)), "fetch meeting info", Meeting.class);
  }

  @Override
  public List<Meeting> getUpcomingMeetings() throws RemoteUnavailableException {
    return get(path("meetings", "upcoming"), "fetch upcoming meetings", MEETING_LIST);
  }

  @Override
  public List<Announcement> getPinnedAnnouncements() throws RemoteUnavailableException {
    return get(
        path("announcements", "pinned"), "fetch pinned announcements", ANNOUNCEMENT_LIST);
  }

  @Override
  public List<AbsentRequest> getAbsentRequests(final long meetingId)
      throws RemoteUnavailableException {
    final HttpUrl url =
        path("absent_requests").newBuilder()
            .addQueryParameter("meeting__id", String.valueOf(meetingId))
            .build();
    return get(url, "fetch absent requests", ABSENT_REQUEST_LIST);
  }

  @Override
  public AbsentRequest createAbsentRequest(
      final long meetingId, final long memberId, final String reason)
      throws RemoteUnavailableException {
    final Map<String, Object> payload = new HashMap<>();
    payload.put("meeting", meetingId);
    payload.put("member", memberId);
    payload.put("reason", reason);

    final Request request =
        authorized(path("absent_requests"))
            .post(RequestBody.create(gson.toJson(payload), JSON))
            .build();
    return execute(request, "create absent request", 201, AbsentRequest.class);
  }

  /** Builds {@code base/segment/.../} with the trailing slash the panel's router expects. */
  private HttpUrl path(final String... segments) {
    final HttpUrl.Builder builder = baseUrl.newBuilder();
    for (final String segment : segments) {
      builder.addPathSegment(segment);
    }
    return builder.addPathSegment("").build();
  }

  private Request.Builder authorized(final HttpUrl url) {
    return new Request.Builder().url(url).header(AUTHORIZATION_HEADER, TOKEN_PREFIX + token);
  }

  private <T> T get(final HttpUrl url, final String operation, final Type type)
      throws RemoteUnavailableException {
    return execute(authorized(url).get().build(), operation, 200, type);
  }

  private <T> T execute(
      final Request request, final String operation, final int expectedStatus, final Type type)
      throws RemoteUnavailableException {
    try (Response response = client.newCall(request).execute()) {
      final ResponseBody body = response.body();
      final String responseBody = body != null ? body.string() : "";

      if (response.code() != expectedStatus) {
        throw new RemoteUnavailableException(operation, response.code(), responseBody);
      }

      final T result = gson.fromJson(responseBody, type);
      if (result == null) {
        throw new RemoteUnavailableException(operation, response.code(), "empty response body");
      }
      return result;
    } catch (final IOException | JsonParseException e) {
      throw new RemoteUnavailableException(operation, e);
    }
  }
}
