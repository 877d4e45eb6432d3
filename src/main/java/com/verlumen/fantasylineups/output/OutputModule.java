package com.verlumen.fantasylineups.output;

import com.google.inject.AbstractModule;

public final class OutputModule extends AbstractModule {
  public static OutputModule create() {
    return new OutputModule();
  }

  private OutputModule() {}

  @Override
  protected void configure() {
    bind(LineupWriter.class).to(CsvLineupWriter.class);
  }
}
