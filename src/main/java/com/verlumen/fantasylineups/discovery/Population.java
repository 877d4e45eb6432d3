package com.verlumen.fantasylineups.discovery;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.lineup.Lineup;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lineups accumulated over a single search. Members are only ever appended; ranking happens once,
 * when the search asks for its best members.
 */
public final class Population {
  /** Highest projection first; ties keep insertion order. */
  static final Comparator<Lineup> BY_PROJECTION_DESCENDING =
      Comparator.comparingDouble(Lineup::projection).reversed();

  private final List<Lineup> members = new ArrayList<>();

  public void add(Lineup lineup) {
    members.add(lineup);
  }

  public int size() {
    return members.size();
  }

  /** Returns up to {@code count} members sorted by descending projection. */
  public ImmutableList<Lineup> best(int count) {
    checkArgument(count >= 0, "Count must be non-negative: %s", count);
    return members.stream()
        .sorted(BY_PROJECTION_DESCENDING)
        .limit(count)
        .collect(toImmutableList());
  }

  /** Returns all members in insertion order. */
  public ImmutableList<Lineup> members() {
    return ImmutableList.copyOf(members);
  }
}
