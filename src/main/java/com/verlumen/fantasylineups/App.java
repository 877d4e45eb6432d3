package com.verlumen.fantasylineups;

import com.google.common.flogger.FluentLogger;
import com.google.inject.Guice;
import com.google.inject.Inject;
import com.verlumen.fantasylineups.discovery.GeneticAlgorithmOrchestrator;
import com.verlumen.fantasylineups.discovery.OptimizationRequest;
import com.verlumen.fantasylineups.discovery.OptimizationResult;
import com.verlumen.fantasylineups.discovery.RetryPolicy;
import com.verlumen.fantasylineups.output.LineupWriter;
import com.verlumen.fantasylineups.roster.PlayerPool;
import com.verlumen.fantasylineups.roster.RosterLoadException;
import com.verlumen.fantasylineups.roster.RosterLoader;
import java.io.IOException;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.ArgumentParserException;
import net.sourceforge.argparse4j.inf.Namespace;

final class App {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final LineupsConfig config;
  private final RosterLoader rosterLoader;
  private final GeneticAlgorithmOrchestrator orchestrator;
  private final LineupWriter lineupWriter;

  @Inject
  App(
      LineupsConfig config,
      RosterLoader rosterLoader,
      GeneticAlgorithmOrchestrator orchestrator,
      LineupWriter lineupWriter) {
    this.config = config;
    this.rosterLoader = rosterLoader;
    this.orchestrator = orchestrator;
    this.lineupWriter = lineupWriter;
  }

  void run() throws RosterLoadException, IOException {
    PlayerPool pool = rosterLoader.load(config.rosterPath());
    OptimizationResult result =
        orchestrator.runOptimization(
            OptimizationRequest.create(pool, config.numLineups(), config.duration()));
    logger.atInfo().log(
        "Kept %d of %d lineups from %d rounds",
        result.lineups().size(), result.populationSize(), result.roundsCompleted());
    lineupWriter.write(result.lineups(), config.outputDirectory());
  }

  public static void main(String[] args) throws Exception {
    logger.atInfo().log("Lineup search starting up with %d arguments", args.length);
    try {
      LineupsConfig config = parseConfig(args);
      App app = Guice.createInjector(LineupsModule.create(config)).getInstance(App.class);
      app.run();
    } catch (Exception e) {
      logger.atSevere().withCause(e).log("Fatal error during lineup search");
      throw e;
    }
  }

  static LineupsConfig parseConfig(String[] args) throws ArgumentParserException {
    Namespace namespace = createParser().parseArgs(args);
    return LineupsConfig.fromNamespace(namespace);
  }

  private static ArgumentParser createParser() {
    ArgumentParser parser = ArgumentParsers.newFor("FantasyLineups")
      .build()
      .defaultHelp(true)
      .description("Searches for high-projection fantasy hockey lineups under the salary cap");

    parser.addArgument("--roster")
      .setDefault("./DKSalaries.csv")
      .help("Salary roster CSV to load players from");

    parser.addArgument("--numLineups")
      .type(Integer.class)
      .setDefault(100)
      .help("Number of lineups to keep");

    parser.addArgument("--durationSeconds")
      .type(Integer.class)
      .setDefault(60)
      .help("How long to search, in seconds");

    parser.addArgument("--outputDir")
      .setDefault(".")
      .help("Directory to write lineup files to");

    parser.addArgument("--maxAttempts")
      .type(Integer.class)
      .setDefault(RetryPolicy.defaultPolicy().maxAttempts())
      .help("Resampling attempts allowed per lineup before giving up");

    parser.addArgument("--seed")
      .type(Long.class)
      .help("Seed for a reproducible random stream (default: unseeded)");

    return parser;
  }
}
