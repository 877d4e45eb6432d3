package com.verlumen.fantasylineups.roster;

import java.util.Arrays;

/** Primary hockey roles a player can be listed under. */
public enum Position {
  GOALIE('G'),
  CENTER('C'),
  WINGER('W'),
  DEFENSEMAN('D');

  private final char code;

  Position(char code) {
    this.code = code;
  }

  public char code() {
    return code;
  }

  /**
   * Resolves a position from a roster descriptor. Only the first character is significant, so
   * {@code "C/W"} is a center. Codes outside G/C/W/D, such as {@code "LW"}, are rejected.
   *
   * @throws IllegalArgumentException if the descriptor is empty or its first character is not a
   *     known position code
   */
  public static Position fromDescriptor(String descriptor) {
    if (descriptor == null || descriptor.isEmpty()) {
      throw new IllegalArgumentException("Position descriptor must not be null or empty.");
    }
    char first = Character.toUpperCase(descriptor.charAt(0));
    return Arrays.stream(values())
        .filter(position -> position.code == first)
        .findFirst()
        .orElseThrow(
            () -> new IllegalArgumentException("Unknown position descriptor: " + descriptor));
  }

  /** Every skater may fill the utility slot; goalies may not. */
  public boolean isUtilityEligible() {
    return this != GOALIE;
  }
}
