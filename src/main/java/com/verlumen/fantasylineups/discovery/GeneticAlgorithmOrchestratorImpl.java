package com.verlumen.fantasylineups.discovery;

import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.roster.PlayerPool;
import java.util.stream.Stream;

/**
 * Implementation of the GeneticAlgorithmOrchestrator interface. Owns the population for a single
 * search and delegates lineup creation to the generator and the crossover.
 */
final class GeneticAlgorithmOrchestratorImpl implements GeneticAlgorithmOrchestrator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LineupGenerator generator;
  private final LineupCrossover crossover;
  private final Ticker ticker;

  @Inject
  GeneticAlgorithmOrchestratorImpl(
      LineupGenerator generator, LineupCrossover crossover, Ticker ticker) {
    this.generator = generator;
    this.crossover = crossover;
    this.ticker = ticker;
  }

  @Override
  public OptimizationResult runOptimization(OptimizationRequest request) {
    PlayerPool pool = request.pool();
    pool.checkDrawable();
    logger.atInfo().log(
        "Searching %s for %d lineups over %s", pool, request.numLineups(), request.duration());

    Population population = new Population();
    long deadline = ticker.read() + request.duration().toNanos();
    int rounds = 0;
    // The deadline is only checked between rounds. Compared by difference to tolerate overflow.
    while (deadline - ticker.read() > 0) {
      runRound(pool, population);
      rounds++;
      logger.atFine().log("Completed round %d, population size %d", rounds, population.size());
    }

    ImmutableList<Lineup> best = population.best(request.numLineups());
    logger.atInfo().log(
        "Search finished after %d rounds with %d lineups; best projection %s",
        rounds, population.size(), best.isEmpty() ? "n/a" : best.get(0).projection());
    return new OptimizationResult(best, rounds, population.size());
  }

  /** Appends exactly {@link GAConstants#LINEUPS_PER_ROUND} lineups to the population. */
  void runRound(PlayerPool pool, Population population) {
    ImmutableList<Lineup> ranked =
        Stream.generate(() -> generator.generate(pool))
            .limit(GAConstants.BATCH_SIZE)
            .sorted(Population.BY_PROJECTION_DESCENDING)
            .collect(toImmutableList());

    ImmutableList<Lineup> elite = ranked.subList(0, GAConstants.ELITE_COUNT);
    elite.forEach(population::add);

    for (int i = 0; i < elite.size(); i++) {
      for (int j = i + 1; j < elite.size(); j++) {
        population.add(crossover.mate(elite.get(i), elite.get(j), pool));
      }
    }

    for (int i = 0; i < GAConstants.FRESH_LINEUPS_PER_ROUND; i++) {
      population.add(generator.generate(pool));
    }
  }
}
