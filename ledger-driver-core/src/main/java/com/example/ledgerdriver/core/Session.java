package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.WARNING;

import com.example.ledgerdriver.core.codec.ValueCodec;
import com.example.ledgerdriver.core.exceptions.LambdaAbortedException;
import com.example.ledgerdriver.core.exceptions.SessionClosedException;
import com.example.ledgerdriver.core.exceptions.StartTransactionException;
import java.util.concurrent.Executor;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.qldbsession.model.BadRequestException;

/**
 * A session to the ledger, running transactions one at a time with retries.
 *
 * <p>A session is checked out by a single caller at a time and needs no locking. Its lifespan is
 * bounded by the ledger: once the ledger rejects the session token the session is marked dead and
 * the driver discards it instead of returning it to the pool.
 */
final class Session {

  private static final System.Logger LOGGER = System.getLogger(Session.class.getName());

  private final SessionClient client;
  private final int readAhead;
  private final Executor readAheadExecutor;
  private final ValueCodec codec;

  private boolean alive = true;

  Session(
      final SessionClient client,
      final int readAhead,
      final Executor readAheadExecutor,
      final ValueCodec codec) {
    this.client = client;
    this.readAhead = readAhead;
    this.readAheadExecutor = readAheadExecutor;
    this.codec = codec;
  }

  String id() {
    return client.id();
  }

  String token() {
    return client.token();
  }

  String ledgerName() {
    return client.ledgerName();
  }

  boolean isAlive() {
    return alive;
  }

  /**
   * Runs {@code function} in a new transaction and commits it, retrying on retriable failures.
   *
   * <p>Each retry consumes one attempt from {@code attempts}, notifies the configured {@link
   * RetryConfig.RetryListener} and waits for the backoff computed by {@link Retry#computeBackoff}.
   * Once the retry limit is reached the last error is rethrown as is. An invalid-session error that
   * is not a transaction expiry marks this session dead and is rethrown immediately. When a failed
   * abort kills the session before a retry, the retry is handed back to the caller as a {@link
   * RetryOnNewSessionException}.
   *
   * @param function transaction body
   * @param config retry configuration
   * @param attempts attempt counter shared by all sessions used for the same driver call
   * @param <T> result type
   * @return the function's result, buffered if it was a streamed result
   */
  <T> T executeWithRetry(
      final ExecutorFunction<T> function, final RetryConfig config, final AttemptCounter attempts) {
    while (true) {
      Transaction transaction = null;
      try {
        transaction = startTransaction();
        final var result = bufferIfLive(function.execute(new TransactionExecutor(transaction)));
        transaction.commit();
        return result;
      } catch (final LambdaAbortedException e) {
        abortQuietly(transaction);
        throw e;
      } catch (final StartTransactionException e) {
        abortQuietly(null);
        retryOrThrow(e.getCause(), config, attempts, null);
        if (!alive) throw new RetryOnNewSessionException(e.getCause());
      } catch (final RuntimeException e) {
        final var transactionId = transaction == null ? null : transaction.id();

        if (Retry.isInvalidSession(e) && !Retry.isTransactionExpired(e)) {
          LOGGER.log(DEBUG, "Session {0} is no longer valid", id());
          alive = false;
          throw e;
        }
        if (Retry.isOccConflict(e)) {
          LOGGER.log(DEBUG, "OCC conflict on transaction {0}", transactionId);
          retryOrThrow(e, config, attempts, transactionId);
          continue;
        }

        abortQuietly(transaction);
        if (Retry.isRetriableTransport(e) || Retry.isTransactionExpired(e)) {
          retryOrThrow(e, config, attempts, transactionId);
          if (!alive) throw new RetryOnNewSessionException(e);
          continue;
        }
        throw e;
      }
    }
  }

  /**
   * Starts a transaction on this session.
   *
   * @throws SessionClosedException if the session is dead
   * @throws StartTransactionException if the ledger rejected the request
   */
  Transaction startTransaction() {
    if (!alive) throw new SessionClosedException();
    try {
      final var transactionId = client.startTransaction().transactionId();
      return new Transaction(client, transactionId, readAhead, readAheadExecutor, codec);
    } catch (final BadRequestException e) {
      throw new StartTransactionException(e);
    }
  }

  /** Ends the remote session. No-op if it is already dead. */
  void end() {
    if (alive) {
      alive = false;
      client.close();
    }
  }

  @SuppressWarnings("unchecked")
  private static <T> T bufferIfLive(final T result) {
    if (result instanceof LiveCursor cursor && cursor.isOpen()) return (T) cursor.buffer();
    return result;
  }

  private void retryOrThrow(
      final RuntimeException error,
      final RetryConfig config,
      final AttemptCounter attempts,
      final String transactionId) {
    if (!attempts.hasRemaining(config)) {
      LOGGER.log(WARNING, "All {0} retry attempts failed", attempts.get());
      throw error;
    }

    final var attempt = attempts.increment();
    if (config.retryListener() != null)
      config.retryListener().onRetry(attempt, error, transactionId);
    final var delay = Retry.computeBackoff(attempt, error, transactionId, config);
    LOGGER.log(DEBUG, "Retry attempt {0} in {1} ms after: {2}", attempt, delay, error.toString());
    Retry.sleep(delay, error);
  }

  /**
   * Aborts the transaction, or any transaction the session may hold when none was started. A
   * failure leaves the session in an unknown state, so the session is marked dead.
   */
  private void abortQuietly(final Transaction transaction) {
    if (!alive) return;
    try {
      if (transaction == null) client.abortTransaction();
      else transaction.abort();
    } catch (final SdkException e) {
      alive = false;
      LOGGER.log(WARNING, "Ignored error aborting transaction during execution", e);
    }
  }

  /**
   * Signals that a retry is due but this session can no longer run it. The retry attempt has
   * already been counted and its backoff has elapsed.
   */
  static final class RetryOnNewSessionException extends RuntimeException {

    RetryOnNewSessionException(final RuntimeException error) {
      super(error.getMessage(), error, false, false);
    }

    /** The error that caused the retry. */
    RuntimeException error() {
      return (RuntimeException) getCause();
    }
  }
}
