package com.verlumen.fantasylineups.discovery;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static com.google.common.truth.Truth.assertThat;

import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.lineup.LineupConstraints;
import com.verlumen.fantasylineups.roster.Player;

final class LineupAssertions {
  private LineupAssertions() {}

  static void assertSatisfiesContestRules(Lineup lineup) {
    assertThat(lineup.players()).hasSize(LineupConstraints.LINEUP_SIZE);
    assertThat(lineup.salary()).isLessThan(LineupConstraints.SALARY_CAP);
    assertThat(lineup.salary()).isEqualTo(lineup.players().stream().mapToInt(Player::salary).sum());
    assertThat(lineup.players().stream().map(Player::team).collect(toImmutableSet()).size())
        .isAtLeast(LineupConstraints.MIN_DISTINCT_TEAMS);
    assertThat(lineup.players().stream().map(Player::name).collect(toImmutableSet()))
        .hasSize(LineupConstraints.LINEUP_SIZE);
  }
}
