package com.robomania.roboweb;

import com.robomania.roboweb.model.Member;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Last known member listing, keyed by Roboweb member id. */
public final class MemberIndex {
  private final Map<Long, Member> membersById = new ConcurrentHashMap<>();

  public void replaceAll(final Collection<Member> members) {
    membersById.clear();
    members.forEach(this::put);
  }

  public void put(final Member member) {
    membersById.put(member.id(), member);
  }

  public Optional<Member> find(final long memberId) {
    return Optional.ofNullable(membersById.get(memberId));
  }

  public int size() {
    return membersById.size();
  }
}
