package com.verlumen.fantasylineups.lineup;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.roster.Player;

/**
 * A validated lineup: nine players in slot order followed by the lineup's total salary and its
 * rounded projected score. Instances normally come from {@link LineupValidator}.
 */
public record Lineup(ImmutableList<Player> players, int salary, double projection) {
  public Lineup {
    checkArgument(
        players.size() == LineupConstraints.LINEUP_SIZE,
        "Lineup must have %s players, got %s",
        LineupConstraints.LINEUP_SIZE,
        players.size());
  }

  /** Players occupying the given group's slots, in slot order. */
  public ImmutableList<Player> playersIn(SlotGroup group) {
    int first = group.firstSlot();
    return players.subList(first, first + group.slotCount());
  }

  public ImmutableList<String> playerNames() {
    return players.stream().map(Player::name).collect(toImmutableList());
  }
}
