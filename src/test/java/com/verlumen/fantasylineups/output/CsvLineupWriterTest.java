package com.verlumen.fantasylineups.output;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.roster.Player;
import com.verlumen.fantasylineups.roster.Position;
import com.verlumen.fantasylineups.roster.TestPlayers;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class CsvLineupWriterTest {
  private static final String PLAYER_NAMES =
      "Center One,Center Two,Wing One,Wing Two,Wing Three,Defense One,Defense Two,Goalie One,"
          + "Utility One";

  @Rule public TemporaryFolder temporaryFolder = new TemporaryFolder();

  @Inject private LineupWriter writer;

  private Path outputDirectory;

  @Before
  public void setUp() throws Exception {
    Guice.createInjector(OutputModule.create()).injectMembers(this);
    outputDirectory = temporaryFolder.getRoot().toPath().resolve("out");
  }

  @Test
  public void write_lineupsFile_hasHeaderAndSalaryProjection() throws Exception {
    writer.write(ImmutableList.of(TestPlayers.lineupWithProjection(87.25)), outputDirectory);

    List<String> lines = read(CsvLineupWriter.LINEUPS_FILE);
    assertThat(lines)
        .containsExactly("C,C,W,W,W,D,D,G,UTIL,Salary,Projection", PLAYER_NAMES + ",36000,87.25")
        .inOrder();
  }

  @Test
  public void write_uploadFile_stripsSalaryAndProjection() throws Exception {
    writer.write(ImmutableList.of(TestPlayers.lineupWithProjection(87.25)), outputDirectory);

    assertThat(read(CsvLineupWriter.UPLOAD_FILE))
        .containsExactly("C,C,W,W,W,D,D,G,UTIL", PLAYER_NAMES)
        .inOrder();
  }

  @Test
  public void write_adjacentDuplicates_removedFromUploadOnly() throws Exception {
    Lineup lineup = TestPlayers.lineupWithProjection(50.0);

    writer.write(ImmutableList.of(lineup, lineup, lineup), outputDirectory);

    assertThat(read(CsvLineupWriter.LINEUPS_FILE)).hasSize(4);
    assertThat(read(CsvLineupWriter.UPLOAD_FILE)).hasSize(2);
  }

  @Test
  public void write_nameWithComma_isQuoted() throws Exception {
    List<Player> players = new ArrayList<>(TestPlayers.validCandidate());
    players.set(0, Player.create("Smith, Jr.", Position.CENTER, 4_000, "BOS", 1.0));
    Lineup lineup = new Lineup(ImmutableList.copyOf(players), 36_000, 9.0);

    writer.write(ImmutableList.of(lineup), outputDirectory);

    assertThat(read(CsvLineupWriter.UPLOAD_FILE).get(1)).startsWith("\"Smith, Jr.\",Center Two");
  }

  @Test
  public void write_noLineups_writesHeadersOnly() throws Exception {
    writer.write(ImmutableList.of(), outputDirectory);

    assertThat(read(CsvLineupWriter.LINEUPS_FILE)).hasSize(1);
    assertThat(read(CsvLineupWriter.UPLOAD_FILE)).hasSize(1);
  }

  private List<String> read(String fileName) throws Exception {
    return Files.readAllLines(outputDirectory.resolve(fileName), UTF_8);
  }
}
