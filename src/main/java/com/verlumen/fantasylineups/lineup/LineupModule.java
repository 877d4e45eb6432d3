package com.verlumen.fantasylineups.lineup;

import com.google.inject.AbstractModule;

public final class LineupModule extends AbstractModule {
  public static LineupModule create() {
    return new LineupModule();
  }

  private LineupModule() {}

  @Override
  protected void configure() {
    bind(LineupValidator.class).to(LineupValidatorImpl.class);
  }
}
