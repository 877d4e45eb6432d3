package com.verlumen.fantasylineups.roster;

/** Thrown when a roster source is missing or cannot be parsed. */
public final class RosterLoadException extends Exception {
  public RosterLoadException(String message) {
    super(message);
  }

  public RosterLoadException(String message, Throwable cause) {
    super(message, cause);
  }
}
