package com.verlumen.fantasylineups;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.verlumen.fantasylineups.discovery.DiscoveryModule;
import com.verlumen.fantasylineups.discovery.RetryPolicy;
import com.verlumen.fantasylineups.lineup.LineupModule;
import com.verlumen.fantasylineups.output.OutputModule;
import com.verlumen.fantasylineups.roster.RosterColumns;
import com.verlumen.fantasylineups.roster.RosterModule;

@AutoValue
abstract class LineupsModule extends AbstractModule {
  static LineupsModule create(LineupsConfig config) {
    return new AutoValue_LineupsModule(config);
  }

  abstract LineupsConfig config();

  @Override
  protected void configure() {
    install(RosterModule.create(RosterColumns.DRAFTKINGS));
    install(LineupModule.create());
    install(DiscoveryModule.create(RetryPolicy.create(config().maxAttempts()), config().seed()));
    install(OutputModule.create());
  }

  @Provides
  LineupsConfig provideLineupsConfig() {
    return config();
  }
}
