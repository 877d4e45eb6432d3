package com.verlumen.fantasylineups.roster;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.io.MoreFiles;
import com.google.inject.Inject;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Loads a comma separated salary export. The leading instruction rows are skipped
 * unconditionally; every following non-blank row must carry all configured columns.
 */
final class CsvRosterLoader implements RosterLoader {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();
  private static final Splitter CELL_SPLITTER = Splitter.on(',');
  private static final CharMatcher QUOTE = CharMatcher.is('"');

  private final RosterColumns columns;

  @Inject
  CsvRosterLoader(RosterColumns columns) {
    this.columns = columns;
  }

  @Override
  public PlayerPool load(Path source) throws RosterLoadException {
    logger.atInfo().log("Loading roster from %s", source);
    List<String> lines;
    try {
      lines = MoreFiles.asCharSource(source, UTF_8).readLines();
    } catch (IOException e) {
      throw new RosterLoadException("Unable to read roster: " + source, e);
    }

    if (lines.size() < columns.skippedRows()) {
      throw new RosterLoadException(
          String.format(
              "Roster %s has %d rows, expected at least %d header rows",
              source, lines.size(), columns.skippedRows()));
    }

    ImmutableList.Builder<Player> players = ImmutableList.builder();
    int inactive = 0;
    for (int row = columns.skippedRows(); row < lines.size(); row++) {
      String line = lines.get(row);
      if (line.isBlank()) {
        continue;
      }
      Player player = parseRow(line, row + 1, source);
      if (!player.isActive()) {
        inactive++;
      }
      players.add(player);
    }

    PlayerPool pool = PlayerPool.of(players.build());
    logger.atInfo().log(
        "Loaded %d active players (%s), skipped %d inactive", pool.size(), pool, inactive);
    return pool;
  }

  private Player parseRow(String line, int rowNumber, Path source) throws RosterLoadException {
    List<String> cells = CELL_SPLITTER.splitToList(line);
    if (cells.size() < columns.requiredWidth()) {
      throw new RosterLoadException(
          String.format(
              "Row %d of %s has %d columns, expected at least %d",
              rowNumber, source, cells.size(), columns.requiredWidth()));
    }

    try {
      return Player.create(
          cell(cells, columns.nameColumn()),
          Position.fromDescriptor(cell(cells, columns.positionColumn())),
          Integer.parseInt(cell(cells, columns.salaryColumn())),
          cell(cells, columns.teamColumn()),
          Double.parseDouble(cell(cells, columns.pointsColumn())));
    } catch (IllegalArgumentException e) {
      // NumberFormatException is an IllegalArgumentException as well.
      throw new RosterLoadException(
          String.format("Malformed row %d of %s: %s", rowNumber, source, e.getMessage()), e);
    }
  }

  private static String cell(List<String> cells, int column) {
    return QUOTE.trimFrom(cells.get(column).trim());
  }
}
