package com.verlumen.fantasylineups.lineup;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.roster.Player;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;

final class LineupValidatorImpl implements LineupValidator {
  @Inject
  LineupValidatorImpl() {}

  @Override
  public Optional<Lineup> validate(ImmutableList<Player> candidate) {
    checkArgument(
        candidate.size() == LineupConstraints.LINEUP_SIZE,
        "Candidate must have %s slots, got %s",
        LineupConstraints.LINEUP_SIZE,
        candidate.size());

    int salary = candidate.stream().mapToInt(Player::salary).sum();
    // Summed left to right in slot order.
    double projection =
        roundProjection(
            candidate.stream().mapToDouble(Player::projectedPoints).reduce(0.0, Double::sum));
    int distinctTeams = candidate.stream().map(Player::team).collect(toImmutableSet()).size();
    int distinctPlayers = candidate.stream().map(Player::name).collect(toImmutableSet()).size();

    if (salary < LineupConstraints.SALARY_CAP
        && distinctTeams >= LineupConstraints.MIN_DISTINCT_TEAMS
        && distinctPlayers == LineupConstraints.LINEUP_SIZE) {
      return Optional.of(new Lineup(candidate, salary, projection));
    }
    return Optional.empty();
  }

  private static double roundProjection(double projection) {
    // Rounds the exact binary value, not its shortest decimal rendering.
    return new BigDecimal(projection)
        .setScale(LineupConstraints.PROJECTION_SCALE, RoundingMode.HALF_EVEN)
        .doubleValue();
  }
}
