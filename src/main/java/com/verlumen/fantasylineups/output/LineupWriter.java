package com.verlumen.fantasylineups.output;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.lineup.Lineup;
import java.io.IOException;
import java.nio.file.Path;

/** Persists the final lineups of a search. */
public interface LineupWriter {
  /**
   * Writes the lineups, best first, into {@code outputDirectory}.
   *
   * @throws IOException if a file cannot be written
   */
  void write(ImmutableList<Lineup> lineups, Path outputDirectory) throws IOException;
}
