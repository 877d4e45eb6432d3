package com.verlumen.fantasylineups.discovery;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;
import java.util.random.RandomGenerator;

/** Uniform sampling helpers shared by generation and crossover. */
final class RandomDraws {
  private RandomDraws() {}

  /** Returns a uniformly chosen element, leaving the list untouched. */
  static <T> T pick(List<T> elements, RandomGenerator random) {
    checkArgument(!elements.isEmpty(), "Cannot draw from an empty candidate list");
    return elements.get(random.nextInt(elements.size()));
  }

  /** Removes and returns a uniformly chosen element. */
  static <T> T take(List<T> elements, RandomGenerator random) {
    checkArgument(!elements.isEmpty(), "Cannot draw from an empty candidate list");
    return elements.remove(random.nextInt(elements.size()));
  }
}
