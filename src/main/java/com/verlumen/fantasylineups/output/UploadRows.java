package com.verlumen.fantasylineups.output;

import com.google.common.collect.ImmutableList;
import java.util.List;

/** Row shaping for the contest upload file. */
final class UploadRows {
  private UploadRows() {}

  /**
   * Drops every row equal to the row right after it. Only neighbours are compared, so duplicates
   * separated by another row survive. The last row is always kept.
   */
  static <T> ImmutableList<T> removeAdjacentDuplicates(List<T> rows) {
    ImmutableList.Builder<T> kept = ImmutableList.builder();
    for (int i = 0; i < rows.size(); i++) {
      boolean last = i == rows.size() - 1;
      if (last || !rows.get(i).equals(rows.get(i + 1))) {
        kept.add(rows.get(i));
      }
    }
    return kept.build();
  }
}
