package com.verlumen.fantasylineups.discovery;

/**
 * Runs the time-boxed evolutionary lineup search.
 *
 * <p>Each round:
 *
 * <ul>
 *   <li>Generates a batch of random lineups and ranks it by projection.
 *   <li>Keeps the top three and breeds every pair of them.
 *   <li>Adds a few more independent lineups.
 * </ul>
 *
 * <p>Rounds repeat until the deadline; the accumulated population is then ranked and truncated.
 */
public interface GeneticAlgorithmOrchestrator {
  /**
   * Searches for high-scoring lineups.
   *
   * @param request the pool, lineup count and time budget
   * @return the best lineups found along with search statistics
   * @throws NoFeasibleLineupException if the pool cannot produce a valid lineup
   */
  OptimizationResult runOptimization(OptimizationRequest request);
}
