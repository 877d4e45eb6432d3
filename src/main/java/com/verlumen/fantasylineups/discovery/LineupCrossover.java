package com.verlumen.fantasylineups.discovery;

import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.roster.PlayerPool;

/** Breeds a child lineup from two parents. */
public interface LineupCrossover {
  /**
   * Builds, for every slot group, a candidate list of both parents' players in that group plus
   * one fresh random player from the pool, then samples the group's slots from it without
   * replacement. The whole child is resampled until it validates.
   *
   * @param first the first parent
   * @param second the second parent
   * @param pool source of the extra random player per group
   * @return a valid child lineup
   * @throws NoFeasibleLineupException if the retry ceiling is reached
   */
  Lineup mate(Lineup first, Lineup second, PlayerPool pool);
}
