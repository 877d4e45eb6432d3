package com.verlumen.fantasylineups.roster;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.stream.IntStream;

/** Zero-based column layout of a roster export, plus the number of leading rows to skip. */
public record RosterColumns(
    int skippedRows,
    int nameColumn,
    int positionColumn,
    int salaryColumn,
    int teamColumn,
    int pointsColumn) {
  /**
   * Layout of the DraftKings salary download: eight instruction and header rows, with player
   * data starting in the twelfth column.
   */
  public static final RosterColumns DRAFTKINGS = new RosterColumns(8, 11, 14, 15, 17, 18);

  public RosterColumns {
    checkArgument(skippedRows >= 0, "Skipped rows must be non-negative: %s", skippedRows);
    checkArgument(
        IntStream.of(nameColumn, positionColumn, salaryColumn, teamColumn, pointsColumn)
            .allMatch(column -> column >= 0),
        "Column indices must be non-negative");
  }

  /** Minimum number of cells a data row needs for every column to be present. */
  public int requiredWidth() {
    return IntStream.of(nameColumn, positionColumn, salaryColumn, teamColumn, pointsColumn)
            .max()
            .getAsInt()
        + 1;
  }
}
