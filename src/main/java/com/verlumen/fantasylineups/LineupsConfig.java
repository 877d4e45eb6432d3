package com.verlumen.fantasylineups;

import static com.google.common.base.Preconditions.checkArgument;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.Namespace;

/** Run configuration resolved from the command line. */
record LineupsConfig(
    Path rosterPath,
    int numLineups,
    Duration duration,
    Path outputDirectory,
    int maxAttempts,
    Optional<Long> seed) {
  LineupsConfig {
    checkArgument(numLineups > 0, "Number of lineups must be positive: %s", numLineups);
    checkArgument(!duration.isNegative(), "Duration must not be negative: %s", duration);
    checkArgument(maxAttempts > 0, "Max attempts must be positive: %s", maxAttempts);
  }

  static LineupsConfig fromNamespace(Namespace namespace) {
    return new LineupsConfig(
        Paths.get(namespace.getString("roster")),
        namespace.getInt("numLineups"),
        Duration.ofSeconds(namespace.getInt("durationSeconds")),
        Paths.get(namespace.getString("outputDir")),
        namespace.getInt("maxAttempts"),
        Optional.ofNullable(namespace.getLong("seed")));
  }
}
