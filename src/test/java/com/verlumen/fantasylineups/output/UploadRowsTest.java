package com.verlumen.fantasylineups.output;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.collect.ImmutableList;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class UploadRowsTest {
  @Test
  public void removeAdjacentDuplicates_dropsRowEqualToNext() {
    assertThat(UploadRows.removeAdjacentDuplicates(ImmutableList.of("a", "a", "b")))
        .containsExactly("a", "b")
        .inOrder();
  }

  @Test
  public void removeAdjacentDuplicates_keepsNonAdjacentDuplicates() {
    assertThat(UploadRows.removeAdjacentDuplicates(ImmutableList.of("a", "b", "a")))
        .containsExactly("a", "b", "a")
        .inOrder();
  }

  @Test
  public void removeAdjacentDuplicates_keepsLastRow() {
    assertThat(UploadRows.removeAdjacentDuplicates(ImmutableList.of("a", "b", "c", "c")))
        .containsExactly("a", "b", "c")
        .inOrder();
  }

  @Test
  public void removeAdjacentDuplicates_emptyInput_returnsEmpty() {
    assertThat(UploadRows.removeAdjacentDuplicates(ImmutableList.of())).isEmpty();
  }
}
