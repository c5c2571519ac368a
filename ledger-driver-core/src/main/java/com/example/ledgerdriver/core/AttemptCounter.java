package com.example.ledgerdriver.core;

/**
 * Retry attempts consumed by one {@link LedgerDriver#execute(ExecutorFunction, RetryConfig)} call.
 *
 * <p>A single counter is shared by every session the call runs on, so replacing a dead session
 * does not reset the retry budget. Only the calling thread touches it.
 */
final class AttemptCounter {

  private int attempts;

  /** Records one more retry and returns the new count. */
  int increment() {
    return ++attempts;
  }

  int get() {
    return attempts;
  }

  boolean hasRemaining(final RetryConfig config) {
    return attempts < config.retryLimit();
  }
}
