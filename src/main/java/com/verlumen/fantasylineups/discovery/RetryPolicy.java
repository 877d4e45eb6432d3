package com.verlumen.fantasylineups.discovery;

import static com.google.common.base.Preconditions.checkArgument;

/** Upper bound on resampling attempts before giving up on a single lineup. */
public record RetryPolicy(int maxAttempts) {
  public RetryPolicy {
    checkArgument(maxAttempts > 0, "Max attempts must be positive: %s", maxAttempts);
  }

  public static RetryPolicy create(int maxAttempts) {
    return new RetryPolicy(maxAttempts);
  }

  public static RetryPolicy defaultPolicy() {
    return new RetryPolicy(GAConstants.DEFAULT_MAX_ATTEMPTS);
  }
}
