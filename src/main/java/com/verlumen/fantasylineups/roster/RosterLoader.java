package com.verlumen.fantasylineups.roster;

import java.nio.file.Path;

/** Reads a roster source into a {@link PlayerPool}. */
public interface RosterLoader {
  /**
   * Loads every active player from the given source.
   *
   * @param source location of the roster export
   * @return the populated pool
   * @throws RosterLoadException if the source is missing, truncated or malformed
   */
  PlayerPool load(Path source) throws RosterLoadException;
}
