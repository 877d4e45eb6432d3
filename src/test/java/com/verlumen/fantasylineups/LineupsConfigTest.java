package com.verlumen.fantasylineups;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.verlumen.fantasylineups.discovery.RetryPolicy;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Optional;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class LineupsConfigTest {
  @Test
  public void parseConfig_noArguments_usesDefaults() throws Exception {
    LineupsConfig config = App.parseConfig(new String[0]);

    assertThat(config.rosterPath()).isEqualTo(Paths.get("./DKSalaries.csv"));
    assertThat(config.numLineups()).isEqualTo(100);
    assertThat(config.duration()).isEqualTo(Duration.ofSeconds(60));
    assertThat(config.outputDirectory()).isEqualTo(Paths.get("."));
    assertThat(config.maxAttempts()).isEqualTo(RetryPolicy.defaultPolicy().maxAttempts());
    assertThat(config.seed()).isEqualTo(Optional.empty());
  }

  @Test
  public void parseConfig_overrides_areApplied() throws Exception {
    LineupsConfig config =
        App.parseConfig(
            new String[] {
              "--roster", "slate.csv",
              "--numLineups", "20",
              "--durationSeconds", "5",
              "--outputDir", "results",
              "--maxAttempts", "300",
              "--seed", "99"
            });

    assertThat(config.rosterPath()).isEqualTo(Paths.get("slate.csv"));
    assertThat(config.numLineups()).isEqualTo(20);
    assertThat(config.duration()).isEqualTo(Duration.ofSeconds(5));
    assertThat(config.outputDirectory()).isEqualTo(Paths.get("results"));
    assertThat(config.maxAttempts()).isEqualTo(300);
    assertThat(config.seed()).isEqualTo(Optional.of(99L));
  }

  @Test
  public void parseConfig_nonPositiveLineupCount_throwsException() {
    IllegalArgumentException thrown =
        assertThrows(
            IllegalArgumentException.class,
            () -> App.parseConfig(new String[] {"--numLineups", "0"}));

    assertThat(thrown).hasMessageThat().contains("Number of lineups");
  }

  @Test
  public void parseConfig_negativeDuration_throwsException() {
    assertThrows(
        IllegalArgumentException.class,
        () -> App.parseConfig(new String[] {"--durationSeconds=-1"}));
  }

  @Test
  public void parseConfig_nonNumericCount_throwsParserException() {
    assertThrows(
        ArgumentParserException.class,
        () -> App.parseConfig(new String[] {"--numLineups", "lots"}));
  }
}
