package com.verlumen.fantasylineups.discovery;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.lineup.LineupValidator;
import com.verlumen.fantasylineups.lineup.SlotGroup;
import com.verlumen.fantasylineups.roster.Player;
import com.verlumen.fantasylineups.roster.PlayerPool;
import java.util.Optional;
import java.util.random.RandomGenerator;

final class LineupGeneratorImpl implements LineupGenerator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LineupValidator validator;
  private final RandomGenerator random;
  private final RetryPolicy retryPolicy;

  @Inject
  LineupGeneratorImpl(LineupValidator validator, RandomGenerator random, RetryPolicy retryPolicy) {
    this.validator = validator;
    this.random = random;
    this.retryPolicy = retryPolicy;
  }

  @Override
  public Lineup generate(PlayerPool pool) {
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      Optional<Lineup> lineup = validator.validate(drawCandidate(pool));
      if (lineup.isPresent()) {
        logger.atFinest().log("Generated lineup after %d attempts", attempt);
        return lineup.get();
      }
    }
    throw new NoFeasibleLineupException("generation", retryPolicy.maxAttempts());
  }

  private ImmutableList<Player> drawCandidate(PlayerPool pool) {
    ImmutableList.Builder<Player> candidate = ImmutableList.builder();
    for (SlotGroup group : SlotGroup.values()) {
      ImmutableList<Player> candidates = group.candidates(pool);
      for (int slot = 0; slot < group.slotCount(); slot++) {
        candidate.add(RandomDraws.pick(candidates, random));
      }
    }
    return candidate.build();
  }
}
