package com.verlumen.fantasylineups.lineup;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.roster.Player;
import java.util.Optional;

/** Scores candidate lineups and decides whether they satisfy the contest rules. */
public interface LineupValidator {
  /**
   * Validates a candidate lineup.
   *
   * @param candidate nine players in slot order
   * @return the scored lineup, or empty if the candidate breaks the salary cap, spans too few
   *     teams, or repeats a player
   * @throws IllegalArgumentException if the candidate does not have exactly nine slots
   */
  Optional<Lineup> validate(ImmutableList<Player> candidate);
}
