package com.verlumen.fantasylineups.discovery;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.lineup.LineupValidator;
import com.verlumen.fantasylineups.lineup.SlotGroup;
import com.verlumen.fantasylineups.roster.Player;
import com.verlumen.fantasylineups.roster.PlayerPool;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.random.RandomGenerator;

final class LineupCrossoverImpl implements LineupCrossover {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LineupValidator validator;
  private final RandomGenerator random;
  private final RetryPolicy retryPolicy;

  @Inject
  LineupCrossoverImpl(LineupValidator validator, RandomGenerator random, RetryPolicy retryPolicy) {
    this.validator = validator;
    this.random = random;
    this.retryPolicy = retryPolicy;
  }

  @Override
  public Lineup mate(Lineup first, Lineup second, PlayerPool pool) {
    for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
      Optional<Lineup> child = validator.validate(sampleChild(genePools(first, second, pool)));
      if (child.isPresent()) {
        logger.atFinest().log("Mated lineup after %d attempts", attempt);
        return child.get();
      }
    }
    throw new NoFeasibleLineupException("crossover", retryPolicy.maxAttempts());
  }

  /**
   * Candidate lists per slot group: both parents' players for the group followed by one random
   * draw from the group's pool sequence. Rebuilt on every attempt so each retry gets new draws.
   */
  Map<SlotGroup, List<Player>> genePools(Lineup first, Lineup second, PlayerPool pool) {
    Map<SlotGroup, List<Player>> genePools = new EnumMap<>(SlotGroup.class);
    for (SlotGroup group : SlotGroup.values()) {
      List<Player> genePool = new ArrayList<>(first.playersIn(group));
      genePool.addAll(second.playersIn(group));
      genePool.add(RandomDraws.pick(group.candidates(pool), random));
      genePools.put(group, genePool);
    }
    return genePools;
  }

  private ImmutableList<Player> sampleChild(Map<SlotGroup, List<Player>> genePools) {
    ImmutableList.Builder<Player> child = ImmutableList.builder();
    for (SlotGroup group : SlotGroup.values()) {
      List<Player> genePool = genePools.get(group);
      for (int slot = 0; slot < group.slotCount(); slot++) {
        child.add(RandomDraws.take(genePool, random));
      }
    }
    return child.build();
  }
}
