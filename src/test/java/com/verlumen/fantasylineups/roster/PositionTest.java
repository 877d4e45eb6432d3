package com.verlumen.fantasylineups.roster;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.testing.junit.testparameterinjector.TestParameter;
import com.google.testing.junit.testparameterinjector.TestParameterInjector;
import org.junit.Test;
import org.junit.runner.RunWith;

@RunWith(TestParameterInjector.class)
public class PositionTest {
  @Test
  public void fromDescriptor_singleCode_resolvesPosition(@TestParameter Position position) {
    assertThat(Position.fromDescriptor(String.valueOf(position.code()))).isEqualTo(position);
  }

  @Test
  public void fromDescriptor_usesFirstCharacterOnly(
      @TestParameter({"C/UTIL", "C/W", "Center"}) String descriptor) {
    assertThat(Position.fromDescriptor(descriptor)).isEqualTo(Position.CENTER);
  }

  @Test
  public void fromDescriptor_lowercase_resolvesPosition() {
    assertThat(Position.fromDescriptor("d")).isEqualTo(Position.DEFENSEMAN);
  }

  @Test
  public void fromDescriptor_unknownCode_throwsException(
      @TestParameter({"LW", "X", "UTIL"}) String descriptor) {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> Position.fromDescriptor(descriptor));

    assertThat(thrown).hasMessageThat().contains(descriptor);
  }

  @Test
  public void fromDescriptor_leftWing_rejectedRatherThanReadAsWinger() {
    IllegalArgumentException thrown =
        assertThrows(IllegalArgumentException.class, () -> Position.fromDescriptor("LW"));

    assertThat(thrown).hasMessageThat().isEqualTo("Unknown position descriptor: LW");
  }

  @Test
  public void fromDescriptor_empty_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> Position.fromDescriptor(""));
  }

  @Test
  public void isUtilityEligible_onlyGoaliesExcluded(@TestParameter Position position) {
    assertThat(position.isUtilityEligible()).isEqualTo(position != Position.GOALIE);
  }
}
