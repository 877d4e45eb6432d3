package com.verlumen.fantasylineups.roster;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.isNullOrEmpty;

/**
 * A single entry from the salary roster.
 *
 * <p>Players are identified by {@link #name()}. Two entries with the same name are the same
 * player for lineup uniqueness purposes, regardless of the slot they were drawn into.
 */
public record Player(
    String name, Position position, int salary, String team, double projectedPoints) {
  public Player {
    checkArgument(!isNullOrEmpty(name), "Player name must not be empty");
    checkArgument(position != null, "Position must not be null for %s", name);
    checkArgument(salary > 0, "Salary must be positive for %s: %s", name, salary);
    checkArgument(!isNullOrEmpty(team), "Team must not be empty for %s", name);
    checkArgument(projectedPoints >= 0, "Projection must be non-negative for %s", name);
  }

  public static Player create(
      String name, Position position, int salary, String team, double projectedPoints) {
    return new Player(name, position, salary, team, projectedPoints);
  }

  /** A player averaging zero points is treated as inactive and never enters the pool. */
  public boolean isActive() {
    return projectedPoints != 0;
  }
}
