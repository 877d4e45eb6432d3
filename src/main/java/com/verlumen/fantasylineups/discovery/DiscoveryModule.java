package com.verlumen.fantasylineups.discovery;

import com.google.auto.value.AutoValue;
import com.google.common.base.Ticker;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.jenetics.util.RandomRegistry;
import java.util.Optional;
import java.util.SplittableRandom;
import java.util.random.RandomGenerator;

@AutoValue
public abstract class DiscoveryModule extends AbstractModule {
  public static DiscoveryModule create(RetryPolicy retryPolicy, Optional<Long> seed) {
    return new AutoValue_DiscoveryModule(retryPolicy, seed);
  }

  abstract RetryPolicy retryPolicy();

  abstract Optional<Long> seed();

  @Override
  protected void configure() {
    bind(LineupGenerator.class).to(LineupGeneratorImpl.class);
    bind(LineupCrossover.class).to(LineupCrossoverImpl.class);
    bind(GeneticAlgorithmOrchestrator.class).to(GeneticAlgorithmOrchestratorImpl.class);
    bind(Ticker.class).toInstance(Ticker.systemTicker());
  }

  @Provides
  RetryPolicy provideRetryPolicy() {
    return retryPolicy();
  }

  /** One random stream shared by generation and crossover, seeded when reproducibility is asked. */
  @Provides
  @Singleton
  RandomGenerator provideRandomGenerator() {
    return seed().<RandomGenerator>map(SplittableRandom::new).orElseGet(RandomRegistry::random);
  }
}
