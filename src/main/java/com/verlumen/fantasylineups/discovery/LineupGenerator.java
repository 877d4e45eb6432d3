package com.verlumen.fantasylineups.discovery;

import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.roster.PlayerPool;

/** Produces random lineups that satisfy the contest rules. */
public interface LineupGenerator {
  /**
   * Draws every slot independently and uniformly from its candidates, resampling the whole
   * lineup until it validates.
   *
   * @throws NoFeasibleLineupException if the retry ceiling is reached
   */
  Lineup generate(PlayerPool pool);
}
