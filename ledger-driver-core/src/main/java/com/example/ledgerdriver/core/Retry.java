package com.example.ledgerdriver.core;

import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.qldbsession.model.BadRequestException;
import software.amazon.awssdk.services.qldbsession.model.InvalidSessionException;
import software.amazon.awssdk.services.qldbsession.model.OccConflictException;

/**
 * Backoff calculation and classification of errors returned by the ledger.
 *
 * <p>These predicates are the only place that interprets remote error payloads; the session retry
 * loop decides what to do based on them.
 */
public final class Retry {

  static final long MAX_BACKOFF_MILLIS = 5_000L;

  // largest power of two applied to the base delay
  static final int MAX_SHIFT = 62;

  private static final Pattern TRANSACTION_EXPIRED = Pattern.compile("Transaction .* has expired");

  private static final String[] TRANSIENT_CONN_KEYWORDS =
      new String[] {
        "connection refused",
        "connection reset",
        "connection closed",
        "i/o error",
        "socket closed",
        "broken pipe",
        "no http response",
        "failed to respond",
        "timeout",
        "timed out"
      };

  private Retry() {}

  /**
   * Computes the delay before retry attempt {@code attempt}.
   *
   * <p>Uses {@link RetryConfig#customBackoff()} when set, clamping negative results to zero.
   * Otherwise applies equal-jitter exponential backoff: with {@code seed = min(base * 2^attempt,
   * 5000)}, the delay is uniformly distributed in {@code [seed / 2, seed]}.
   *
   * @param attempt retry attempt, starting at 1
   * @param error the error that triggered the retry
   * @param transactionId id of the failed transaction, may be null
   * @param config retry configuration
   * @return delay in milliseconds, never negative
   */
  public static long computeBackoff(
      final int attempt,
      final RuntimeException error,
      final String transactionId,
      final RetryConfig config) {
    if (config.customBackoff() != null) {
      return Math.max(0L, config.customBackoff().calculateDelay(attempt, error, transactionId));
    }

    final var seed = backoffSeed(attempt, config.baseMillis());
    final var half = seed / 2;
    return half + ThreadLocalRandom.current().nextLong(half + 1);
  }

  /**
   * Sleeps before a retry. When interrupted, restores the interrupt flag and rethrows {@code error}
   * instead of retrying.
   */
  static void sleep(final long delayMillis, final RuntimeException error) {
    if (delayMillis <= 0) return;
    try {
      Thread.sleep(delayMillis);
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw error;
    }
  }

  static long backoffSeed(final int attempt, final long baseMillis) {
    final int shift = Math.max(0, Math.min(attempt, MAX_SHIFT));
    if (baseMillis > (MAX_BACKOFF_MILLIS >> shift)) return MAX_BACKOFF_MILLIS;
    return Math.min(baseMillis << shift, MAX_BACKOFF_MILLIS);
  }

  /** True if the ledger rejected the commit because of an optimistic concurrency conflict. */
  public static boolean isOccConflict(final Throwable e) {
    return e instanceof OccConflictException;
  }

  /** True if the ledger no longer accepts the session token, including expired transactions. */
  public static boolean isInvalidSession(final Throwable e) {
    return e instanceof InvalidSessionException;
  }

  /**
   * True if the error is the invalid-session variant raised for an expired transaction. The session
   * itself stays usable in that case.
   */
  public static boolean isTransactionExpired(final Throwable e) {
    if (!(e instanceof InvalidSessionException ise)) return false;
    final var message = errorMessage(ise);
    return message != null && TRANSACTION_EXPIRED.matcher(message).find();
  }

  public static boolean isBadRequest(final Throwable e) {
    return e instanceof BadRequestException;
  }

  /**
   * Detects transport failures likely to recover on retry.
   *
   * <p>Service errors with status 500 or 503 are retriable. Client-side errors are retriable when
   * their cause chain contains a socket timeout or socket failure, or when the message carries a
   * transient connection keyword.
   *
   * @param e the error to check
   * @return true if the error is a retriable transport error
   */
  public static boolean isRetriableTransport(final Throwable e) {
    if (e instanceof AwsServiceException ase) {
      final var status = ase.statusCode();
      return status == 500 || status == 503;
    }
    if (!(e instanceof SdkClientException)) return false;

    Throwable cur = e;
    while (cur != null) {
      if (cur instanceof SocketTimeoutException || cur instanceof SocketException) return true;
      if (cur instanceof IOException
          && cur.getClass().getSimpleName().contains("NoHttpResponseException")) return true;
      if (hasTransientKeyword(cur.getMessage())) return true;
      cur = cur.getCause();
    }
    return false;
  }

  private static boolean hasTransientKeyword(final String msg) {
    if (msg == null) return false;
    final var lower = msg.toLowerCase(Locale.ROOT);
    for (final var keyword : TRANSIENT_CONN_KEYWORDS) if (lower.contains(keyword)) return true;
    return false;
  }

  private static String errorMessage(final AwsServiceException e) {
    final var details = e.awsErrorDetails();
    if (details != null && details.errorMessage() != null) return details.errorMessage();
    return e.getMessage();
  }
}
