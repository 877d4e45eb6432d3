package com.verlumen.fantasylineups.roster;

import com.google.auto.value.AutoValue;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;

@AutoValue
public abstract class RosterModule extends AbstractModule {
  public static RosterModule create(RosterColumns columns) {
    return new AutoValue_RosterModule(columns);
  }

  abstract RosterColumns columns();

  @Override
  protected void configure() {
    bind(RosterLoader.class).to(CsvRosterLoader.class);
  }

  @Provides
  RosterColumns provideRosterColumns() {
    return columns();
  }
}
