package com.verlumen.fantasylineups.discovery;

/**
 * Constants that shape each round of the lineup search. Extracted to a separate class to keep the
 * round structure in one place.
 */
final class GAConstants {
  /** Fresh lineups generated and ranked at the start of every round. */
  static final int BATCH_SIZE = 10;

  /** Top-ranked lineups of each batch kept and bred with one another. */
  static final int ELITE_COUNT = 3;

  /** Independent lineups generated after breeding, to keep exploring. */
  static final int FRESH_LINEUPS_PER_ROUND = 4;

  /** Pairwise matings among the elite: 1x2, 1x3, 2x3. */
  static final int MATINGS_PER_ROUND = ELITE_COUNT * (ELITE_COUNT - 1) / 2;

  static final int LINEUPS_PER_ROUND = ELITE_COUNT + MATINGS_PER_ROUND + FRESH_LINEUPS_PER_ROUND;

  static final int DEFAULT_MAX_ATTEMPTS = 100_000;

  private GAConstants() {}
}
