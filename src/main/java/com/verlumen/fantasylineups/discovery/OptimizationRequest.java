package com.verlumen.fantasylineups.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import com.verlumen.fantasylineups.roster.PlayerPool;
import java.time.Duration;

/**
 * Inputs to a lineup search.
 *
 * @param pool players to build lineups from
 * @param numLineups how many of the best lineups to keep once the search ends
 * @param duration wall-clock budget; a round already underway always completes
 */
public record OptimizationRequest(PlayerPool pool, int numLineups, Duration duration) {
  public OptimizationRequest {
    checkArgument(pool != null, "Player pool must not be null");
    checkArgument(numLineups > 0, "Number of lineups must be positive: %s", numLineups);
    checkArgument(!duration.isNegative(), "Duration must not be negative: %s", duration);
  }

  public static OptimizationRequest create(PlayerPool pool, int numLineups, Duration duration) {
    return new OptimizationRequest(pool, numLineups, duration);
  }
}
