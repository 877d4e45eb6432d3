package com.verlumen.fantasylineups.discovery;

/**
 * Thrown when repeated sampling fails to produce a valid lineup within the retry ceiling, which
 * usually means the pool is too small or spans too few teams.
 */
public final class NoFeasibleLineupException extends RuntimeException {
  private final int attempts;

  NoFeasibleLineupException(String operation, int attempts) {
    super(String.format("No feasible lineup found by %s after %d attempts", operation, attempts));
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}
