package com.verlumen.fantasylineups.lineup;

import com.google.common.collect.ImmutableList;
import com.verlumen.fantasylineups.roster.PlayerPool;
import com.verlumen.fantasylineups.roster.Player;
import com.verlumen.fantasylineups.roster.Position;
import java.util.function.Function;

/**
 * The role groups of a lineup, in slot order. Each group knows how many slots it occupies and
 * which pool sequence its players are drawn from, so generation and crossover can treat every
 * group the same way.
 */
public enum SlotGroup {
  CENTER("C", 2, pool -> pool.players(Position.CENTER)),
  WINGER("W", 3, pool -> pool.players(Position.WINGER)),
  DEFENSEMAN("D", 2, pool -> pool.players(Position.DEFENSEMAN)),
  GOALIE("G", 1, pool -> pool.players(Position.GOALIE)),
  UTILITY("UTIL", 1, PlayerPool::utilityPlayers);

  private final String label;
  private final int slotCount;
  private final Function<PlayerPool, ImmutableList<Player>> candidates;

  SlotGroup(String label, int slotCount, Function<PlayerPool, ImmutableList<Player>> candidates) {
    this.label = label;
    this.slotCount = slotCount;
    this.candidates = candidates;
  }

  /** Column heading used for each slot of this group. */
  public String label() {
    return label;
  }

  public int slotCount() {
    return slotCount;
  }

  /** Index of this group's first slot within a lineup. */
  public int firstSlot() {
    int offset = 0;
    for (SlotGroup group : values()) {
      if (group == this) {
        break;
      }
      offset += group.slotCount;
    }
    return offset;
  }

  /** Players eligible for this group's slots. */
  public ImmutableList<Player> candidates(PlayerPool pool) {
    return candidates.apply(pool);
  }

  /** Slot headings for a full lineup, e.g. {@code [C, C, W, W, W, D, D, G, UTIL]}. */
  public static ImmutableList<String> slotLabels() {
    ImmutableList.Builder<String> labels = ImmutableList.builder();
    for (SlotGroup group : values()) {
      for (int i = 0; i < group.slotCount; i++) {
        labels.add(group.label);
      }
    }
    return labels.build();
  }
}
