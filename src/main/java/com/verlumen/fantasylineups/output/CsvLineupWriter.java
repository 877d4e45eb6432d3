package com.verlumen.fantasylineups.output;

import static com.google.common.collect.ImmutableList.toImmutableList;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.lineup.Lineup;
import com.verlumen.fantasylineups.lineup.SlotGroup;
import java.io.IOException;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes two CSV files: {@value #LINEUPS_FILE} with each lineup's salary and projection, and
 * {@value #UPLOAD_FILE} with player names only, ready for contest upload.
 */
final class CsvLineupWriter implements LineupWriter {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  static final String LINEUPS_FILE = "lineups.csv";
  static final String UPLOAD_FILE = "lineups_for_upload.csv";

  private static final Joiner CELL_JOINER = Joiner.on(',');
  private static final CharMatcher NEEDS_QUOTING = CharMatcher.anyOf(",\"\r\n");

  @Inject
  CsvLineupWriter() {}

  @Override
  public void write(ImmutableList<Lineup> lineups, Path outputDirectory) throws IOException {
    Files.createDirectories(outputDirectory);

    ImmutableList<String> slotLabels = SlotGroup.slotLabels();
    ImmutableList<String> header =
        ImmutableList.<String>builder().addAll(slotLabels).add("Salary", "Projection").build();
    ImmutableList<ImmutableList<String>> rows =
        lineups.stream().map(CsvLineupWriter::fullRow).collect(toImmutableList());
    writeFile(outputDirectory.resolve(LINEUPS_FILE), header, rows);

    ImmutableList<ImmutableList<String>> uploadRows =
        UploadRows.removeAdjacentDuplicates(
            lineups.stream().map(Lineup::playerNames).collect(toImmutableList()));
    writeFile(outputDirectory.resolve(UPLOAD_FILE), slotLabels, uploadRows);

    logger.atInfo().log(
        "Wrote %d lineups and %d upload rows to %s",
        rows.size(), uploadRows.size(), outputDirectory);
  }

  private static ImmutableList<String> fullRow(Lineup lineup) {
    return ImmutableList.<String>builder()
        .addAll(lineup.playerNames())
        .add(Integer.toString(lineup.salary()))
        .add(Double.toString(lineup.projection()))
        .build();
  }

  private static void writeFile(Path file, List<String> header, List<ImmutableList<String>> rows)
      throws IOException {
    try (Writer writer = Files.newBufferedWriter(file, UTF_8)) {
      writeRow(writer, header);
      for (List<String> row : rows) {
        writeRow(writer, row);
      }
    } catch (IOException e) {
      logger.atSevere().withCause(e).log("Failed to write %s", file);
      throw e;
    }
  }

  private static void writeRow(Writer writer, List<String> cells) throws IOException {
    writer.write(
        CELL_JOINER.join(cells.stream().map(CsvLineupWriter::escape).collect(toImmutableList())));
    writer.write('\n');
  }

  private static String escape(String cell) {
    if (!NEEDS_QUOTING.matchesAnyOf(cell)) {
      return cell;
    }
    return '"' + cell.replace("\"", "\"\"") + '"';
  }
}
