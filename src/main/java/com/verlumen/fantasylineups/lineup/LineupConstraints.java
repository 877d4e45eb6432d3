package com.verlumen.fantasylineups.lineup;

/** Contest rules every accepted lineup must satisfy. */
public final class LineupConstraints {
  /** Exclusive upper bound on the summed salary of a lineup. */
  public static final int SALARY_CAP = 50_000;

  public static final int MIN_DISTINCT_TEAMS = 3;
  public static final int LINEUP_SIZE = 9;

  /** Decimal places the summed projection is rounded to. */
  static final int PROJECTION_SCALE = 2;

  private LineupConstraints() {}
}
