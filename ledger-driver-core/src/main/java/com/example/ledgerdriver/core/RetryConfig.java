package com.example.ledgerdriver.core;

/**
 * Retry and backoff configuration for {@link LedgerDriver#execute(ExecutorFunction, RetryConfig)}.
 *
 * <p>Transactions are retried on OCC conflicts, retriable transport errors, expired transactions and
 * failures to start a transaction. Between attempts the driver sleeps for an equal-jitter exponential
 * delay derived from {@code baseMillis}, capped at 5 seconds, unless a custom strategy is given.
 *
 * <pre>{@code
 * // up to 6 retries, 20 ms base delay
 * var config = RetryConfig.of(6, 20L);
 *
 * // linear backoff, ignores baseMillis
 * var linear = RetryConfig.custom(4, (attempt, error, txnId) -> attempt * 100L);
 *
 * // count retries
 * var counted =
 *     RetryConfig.defaults().withRetryListener((attempt, error, txnId) -> retries.increment());
 * }</pre>
 *
 * @param retryLimit number of retries after the first attempt, must be >= 0
 * @param baseMillis base delay of the exponential backoff in milliseconds, must be >= 0
 * @param customBackoff optional strategy replacing the exponential backoff, may be null
 * @param retryListener optional callback run before each retried transaction, may be null
 */
public record RetryConfig(
    int retryLimit, long baseMillis, BackoffStrategy customBackoff, RetryListener retryListener) {

  public static final int DEFAULT_RETRY_LIMIT = 4;
  public static final long DEFAULT_BASE_MILLIS = 10L;

  public RetryConfig {
    if (retryLimit < 0) throw new IllegalArgumentException("retryLimit must be >= 0");
    if (baseMillis < 0) throw new IllegalArgumentException("baseMillis must be >= 0");
  }

  public RetryConfig(
      final int retryLimit, final long baseMillis, final BackoffStrategy customBackoff) {
    this(retryLimit, baseMillis, customBackoff, null);
  }

  /** Four retries with a 10 ms base delay. */
  public static RetryConfig defaults() {
    return new RetryConfig(DEFAULT_RETRY_LIMIT, DEFAULT_BASE_MILLIS, null);
  }

  public static RetryConfig of(final int retryLimit) {
    return new RetryConfig(retryLimit, DEFAULT_BASE_MILLIS, null);
  }

  public static RetryConfig of(final int retryLimit, final long baseMillis) {
    return new RetryConfig(retryLimit, baseMillis, null);
  }

  public static RetryConfig custom(final int retryLimit, final BackoffStrategy strategy) {
    if (strategy == null) throw new IllegalArgumentException("strategy cannot be null");
    return new RetryConfig(retryLimit, DEFAULT_BASE_MILLIS, strategy);
  }

  /**
   * Returns a copy that calls {@code listener} before each retry.
   *
   * @param listener the callback, or null to remove it
   */
  public RetryConfig withRetryListener(final RetryListener listener) {
    return new RetryConfig(retryLimit, baseMillis, customBackoff, listener);
  }

  /** Computes the delay before a retry. Negative results are treated as zero. */
  @FunctionalInterface
  public interface BackoffStrategy {
    /**
     * @param retryAttempt the retry about to be made, starting at 1
     * @param error the error that caused the retry
     * @param transactionId the failed transaction's id, null if none was started
     * @return delay in milliseconds
     */
    long calculateDelay(int retryAttempt, RuntimeException error, String transactionId);
  }

  /**
   * Notified before a transaction is retried. An exception thrown by the listener ends the call
   * with that exception.
   */
  @FunctionalInterface
  public interface RetryListener {
    /**
     * @param retryAttempt the retry about to be made, starting at 1
     * @param error the error that caused the retry
     * @param transactionId the failed transaction's id, null if none was started
     */
    void onRetry(int retryAttempt, RuntimeException error, String transactionId);
  }
}
