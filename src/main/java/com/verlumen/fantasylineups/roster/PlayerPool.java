package com.verlumen.fantasylineups.roster;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import java.util.Arrays;

/**
 * Players available for lineup construction, bucketed by position. Built once before the search
 * and read-only afterwards.
 */
public final class PlayerPool {
  private final ImmutableListMultimap<Position, Player> byPosition;
  private final ImmutableList<Player> utilityPlayers;

  private PlayerPool(
      ImmutableListMultimap<Position, Player> byPosition, ImmutableList<Player> utilityPlayers) {
    this.byPosition = byPosition;
    this.utilityPlayers = utilityPlayers;
  }

  /**
   * Buckets the given players by position, preserving input order. Inactive players are dropped.
   * Every active skater is also appended to the utility sequence.
   */
  public static PlayerPool of(Iterable<Player> players) {
    ImmutableListMultimap.Builder<Position, Player> byPosition = ImmutableListMultimap.builder();
    ImmutableList.Builder<Player> utilityPlayers = ImmutableList.builder();
    for (Player player : players) {
      if (!player.isActive()) {
        continue;
      }
      byPosition.put(player.position(), player);
      if (player.position().isUtilityEligible()) {
        utilityPlayers.add(player);
      }
    }
    return new PlayerPool(byPosition.build(), utilityPlayers.build());
  }

  public ImmutableList<Player> players(Position position) {
    return byPosition.get(position);
  }

  public ImmutableList<Player> goalies() {
    return players(Position.GOALIE);
  }

  public ImmutableList<Player> centers() {
    return players(Position.CENTER);
  }

  public ImmutableList<Player> wingers() {
    return players(Position.WINGER);
  }

  public ImmutableList<Player> defensemen() {
    return players(Position.DEFENSEMAN);
  }

  public ImmutableList<Player> utilityPlayers() {
    return utilityPlayers;
  }

  /** Total number of distinct active players in the pool. */
  public int size() {
    return byPosition.size();
  }

  /**
   * Fails fast when a position has no candidates, since no lineup could ever be drawn from such
   * a pool.
   *
   * @throws IllegalArgumentException naming the first empty position
   */
  public void checkDrawable() {
    ImmutableList<Position> empty =
        Arrays.stream(Position.values())
            .filter(position -> byPosition.get(position).isEmpty())
            .collect(toImmutableList());
    checkArgument(empty.isEmpty(), "Player pool has no players for positions: %s", empty);
  }

  @Override
  public String toString() {
    return String.format(
        "PlayerPool{G=%d, C=%d, W=%d, D=%d, UTIL=%d}",
        goalies().size(),
        centers().size(),
        wingers().size(),
        defensemen().size(),
        utilityPlayers.size());
  }
}
