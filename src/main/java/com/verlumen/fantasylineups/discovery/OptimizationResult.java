package com.verlumen.fantasylineups.discovery;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.lineup.Lineup;

/**
 * Outcome of a lineup search.
 *
 * @param lineups the best lineups, highest projection first
 * @param roundsCompleted number of full rounds run before the deadline
 * @param populationSize lineups accumulated before truncation
 */
public record OptimizationResult(
    ImmutableList<Lineup> lineups, int roundsCompleted, int populationSize) {}
