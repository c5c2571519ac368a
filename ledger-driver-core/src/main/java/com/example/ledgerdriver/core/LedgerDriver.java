package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.*;

import com.example.ledgerdriver.core.client.QldbSessionClientProvider;
import com.example.ledgerdriver.core.codec.IonValueCodec;
import com.example.ledgerdriver.core.codec.ValueCodec;
import com.example.ledgerdriver.core.exceptions.DriverClosedException;
import com.fasterxml.jackson.databind.JsonNode;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import software.amazon.awssdk.services.qldbsession.QldbSessionClient;

/**
 * Entry point for running transactions against a ledger.
 *
 * <p>The driver keeps a bounded pool of sessions, runs each function in its own transaction and
 * retries the whole function when the ledger reports an optimistic concurrency conflict, an expired
 * transaction or a transient transport failure. A driver is safe to share between threads.
 *
 * <h2>Basic Usage</h2>
 *
 * <pre>{@code
 * try (var driver = LedgerDriver.builder().ledgerName("vehicle-registration").build()) {
 *   var owners = driver.execute(txn -> txn.execute("SELECT * FROM Person WHERE age > ?", 30));
 *   owners.forEach(System.out::println);
 * }
 * }</pre>
 *
 * <h2>Custom Retry</h2>
 *
 * <pre>{@code
 * var driver = LedgerDriver.builder()
 *     .ledgerName("vehicle-registration")
 *     .retryConfig(RetryConfig.custom(6, (attempt, error, txnId) -> 100L * attempt))
 *     .readAhead(4)
 *     .build();
 * }</pre>
 *
 * <p>Results returned from a function are buffered before the transaction commits, so they remain
 * readable after {@code execute} returns. Streaming results used inside the function are closed on
 * commit.
 */
public final class LedgerDriver implements AutoCloseable {

  private static final System.Logger LOGGER = System.getLogger(LedgerDriver.class.getName());

  static final String LIST_TABLES_STATEMENT =
      "SELECT VALUE name FROM information_schema.user_tables WHERE status = 'ACTIVE'";

  // sessions may be replaced at most this many times beyond the pool's capacity per call
  static final int EXTRA_SESSION_REPLACEMENTS = 3;

  private final String ledgerName;
  private final QldbSessionClient client;
  private final boolean ownsClient;
  private final RetryConfig retryConfig;
  private final int readAhead;
  private final Executor readAheadExecutor;
  private final ValueCodec codec;
  private final SessionPool pool;

  private LedgerDriver(final Builder builder, final QldbSessionClient client, final int capacity) {
    this.ledgerName = builder.ledgerName;
    this.client = client;
    this.ownsClient = builder.sessionClient == null;
    this.retryConfig = builder.retryConfig;
    this.readAhead = builder.readAhead;
    this.readAheadExecutor = builder.readAheadExecutor;
    this.codec = builder.valueCodec;
    this.pool = new SessionPool(capacity, builder.sessionAcquireTimeout);
  }

  /**
   * Creates a new builder instance.
   *
   * @return new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Builder for {@link LedgerDriver}.
   *
   * <pre>{@code
   * var driver = LedgerDriver.builder()
   *     .ledgerName("vehicle-registration")
   *     .transportMaxConnections(20)
   *     .maxConcurrentTransactions(10)
   *     .sessionAcquireTimeout(Duration.ofSeconds(5))
   *     .build();
   * }</pre>
   */
  public static class Builder {
    private String ledgerName;
    private QldbSessionClient sessionClient;
    private int transportMaxConnections = QldbSessionClientProvider.DEFAULT_MAX_CONNECTIONS;
    private int maxConcurrentTransactions = 0;
    private RetryConfig retryConfig = RetryConfig.defaults();
    private int readAhead = 0;
    private Executor readAheadExecutor;
    private Duration sessionAcquireTimeout = Duration.ofSeconds(30);
    private ValueCodec valueCodec;

    private Builder() {}

    /**
     * Sets the ledger name (required).
     *
     * @param ledgerName name of the ledger
     * @return this builder
     */
    public Builder ledgerName(final String ledgerName) {
      this.ledgerName = ledgerName;
      return this;
    }

    /**
     * Uses an existing low level client. The driver does not close it.
     *
     * <p>Default: a client built by {@link QldbSessionClientProvider}, closed with the driver
     *
     * @param sessionClient low level client
     * @return this builder
     */
    public Builder sessionClient(final QldbSessionClient sessionClient) {
      this.sessionClient = sessionClient;
      return this;
    }

    /**
     * Sets the maximum number of HTTP connections of the transport.
     *
     * <p>Default: 50
     *
     * @param transportMaxConnections connection limit, must be >= 1
     * @return this builder
     */
    public Builder transportMaxConnections(final int transportMaxConnections) {
      this.transportMaxConnections = transportMaxConnections;
      return this;
    }

    /**
     * Sets the number of transactions that may run at the same time, which is also the session
     * pool capacity.
     *
     * <p>Default: 0 (use the transport's connection limit)
     *
     * @param maxConcurrentTransactions limit, at most the transport's connection limit
     * @return this builder
     */
    public Builder maxConcurrentTransactions(final int maxConcurrentTransactions) {
      this.maxConcurrentTransactions = maxConcurrentTransactions;
      return this;
    }

    /**
     * Sets the default retry configuration.
     *
     * <p>Default: {@link RetryConfig#defaults()}
     *
     * @param retryConfig retry configuration
     * @return this builder
     */
    public Builder retryConfig(final RetryConfig retryConfig) {
      this.retryConfig = retryConfig;
      return this;
    }

    /**
     * Sets how many result pages are fetched ahead of the consumer.
     *
     * <p>Default: 0 (fetch pages on demand)
     *
     * @param readAhead 0, or at least 2
     * @return this builder
     */
    public Builder readAhead(final int readAhead) {
      this.readAhead = readAhead;
      return this;
    }

    /**
     * Sets the executor running read-ahead fetches. A daemon thread per result is used otherwise.
     *
     * @param readAheadExecutor executor, may be null
     * @return this builder
     */
    public Builder readAheadExecutor(final Executor readAheadExecutor) {
      this.readAheadExecutor = readAheadExecutor;
      return this;
    }

    /**
     * Sets how long a call waits for a free session.
     *
     * <p>Default: 30 seconds
     *
     * @param sessionAcquireTimeout wait limit
     * @return this builder
     */
    public Builder sessionAcquireTimeout(final Duration sessionAcquireTimeout) {
      this.sessionAcquireTimeout = sessionAcquireTimeout;
      return this;
    }

    /**
     * Sets the codec converting parameters and result values.
     *
     * <p>Default: {@link IonValueCodec}
     *
     * @param valueCodec codec
     * @return this builder
     */
    public Builder valueCodec(final ValueCodec valueCodec) {
      this.valueCodec = valueCodec;
      return this;
    }

    /**
     * Builds the driver.
     *
     * @return configured driver
     * @throws IllegalStateException if required fields are not set
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public LedgerDriver build() {
      if (ledgerName == null || ledgerName.isBlank())
        throw new IllegalStateException("ledgerName is required");
      if (retryConfig == null) throw new IllegalStateException("retryConfig cannot be null");
      if (transportMaxConnections < 1)
        throw new IllegalArgumentException("transportMaxConnections must be >= 1");
      if (maxConcurrentTransactions < 0)
        throw new IllegalArgumentException("maxConcurrentTransactions must be >= 0");
      if (maxConcurrentTransactions > transportMaxConnections)
        throw new IllegalArgumentException(
            "maxConcurrentTransactions must not exceed transportMaxConnections");
      if (readAhead < 0 || readAhead == 1)
        throw new IllegalArgumentException("readAhead must be 0 or >= 2");
      if (sessionAcquireTimeout == null || sessionAcquireTimeout.isNegative())
        throw new IllegalArgumentException("sessionAcquireTimeout must be non-negative");
      if (valueCodec == null) valueCodec = new IonValueCodec();

      final var capacity =
          maxConcurrentTransactions == 0 ? transportMaxConnections : maxConcurrentTransactions;
      final var client =
          sessionClient != null
              ? sessionClient
              : QldbSessionClientProvider.buildClient(transportMaxConnections);
      return new LedgerDriver(this, client, capacity);
    }
  }

  /**
   * Runs {@code function} in a transaction using the driver's retry configuration.
   *
   * @see #execute(ExecutorFunction, RetryConfig)
   */
  public <T> T execute(final ExecutorFunction<T> function) {
    return execute(function, retryConfig);
  }

  /**
   * Runs {@code function} in a transaction and commits it.
   *
   * <p>The function may be invoked more than once: after an optimistic concurrency conflict, an
   * expired transaction or a transient transport error it is run again in a fresh transaction, up
   * to {@link RetryConfig#retryLimit()} times. A session the ledger no longer accepts, or one left
   * in an unknown state by a failed abort, is discarded and the call continues on a new one.
   *
   * @param function transaction body; must not keep streaming results past its return
   * @param config retry configuration for this call
   * @param <T> result type
   * @return the function's result; streaming results are buffered
   * @throws DriverClosedException if the driver was closed
   * @throws com.example.ledgerdriver.core.exceptions.SessionPoolEmptyException if no session
   *     became available in time
   * @throws com.example.ledgerdriver.core.exceptions.LambdaAbortedException if the function called
   *     {@link TransactionExecutor#abort()}
   */
  public <T> T execute(final ExecutorFunction<T> function, final RetryConfig config) {
    if (function == null) throw new IllegalArgumentException("function cannot be null");
    if (config == null) throw new IllegalArgumentException("config cannot be null");
    if (pool.isClosed()) throw new DriverClosedException();

    final var attempts = new AttemptCounter();
    var forceNew = false;
    var replacements = 0;

    while (true) {
      final Session session;
      try {
        session = pool.acquire(forceNew, this::startSession);
      } catch (final RuntimeException e) {
        if (!(Retry.isRetriableTransport(e) || Retry.isInvalidSession(e))
            || ++replacements > maxReplacements()) throw e;
        LOGGER.log(DEBUG, "Failed to start a session, retrying: {0}", e.toString());
        Retry.sleep(Retry.computeBackoff(replacements, e, null, config), e);
        forceNew = true;
        continue;
      }

      try {
        return session.executeWithRetry(function, config, attempts);
      } catch (final Session.RetryOnNewSessionException e) {
        if (++replacements > maxReplacements()) throw e.error();
        LOGGER.log(INFO, "Session {0} was discarded, retrying on a new session", session.id());
        forceNew = true;
      } catch (final RuntimeException e) {
        if (session.isAlive() || !Retry.isInvalidSession(e) || ++replacements > maxReplacements())
          throw e;
        LOGGER.log(INFO, "Session {0} is no longer valid, retrying on a new session", session.id());
        forceNew = true;
      } finally {
        pool.release(session);
      }
    }
  }

  /**
   * Runs a single statement in its own transaction.
   *
   * @param statement statement text
   * @param parameters placeholder values
   * @return the buffered result
   */
  public Result execute(final String statement, final Object... parameters) {
    return execute(txn -> txn.execute(statement, parameters));
  }

  /**
   * Lists the names of the ledger's active tables.
   *
   * @return table names
   */
  public List<String> listTables() {
    final var result = execute(txn -> txn.execute(LIST_TABLES_STATEMENT));
    final var tables = new ArrayList<String>();
    for (final JsonNode value : result) tables.add(value.asText());
    return tables;
  }

  /**
   * Closes the driver. Idle sessions are ended, sessions in use are ended when released, and the
   * low level client is closed if the driver created it. Calling it again has no effect.
   */
  @Override
  public void close() {
    if (!pool.close()) return;
    LOGGER.log(INFO, "Closed driver for ledger {0}", ledgerName);
    if (ownsClient) client.close();
  }

  public String ledgerName() {
    return ledgerName;
  }

  public int readAhead() {
    return readAhead;
  }

  public RetryConfig retryConfig() {
    return retryConfig;
  }

  public int maxConcurrentTransactions() {
    return pool.capacity();
  }

  int idleSessionCount() {
    return pool.idleCount();
  }

  int availablePermits() {
    return pool.availablePermits();
  }

  private int maxReplacements() {
    return pool.capacity() + EXTRA_SESSION_REPLACEMENTS;
  }

  private Session startSession() {
    return new Session(SessionClient.start(ledgerName, client), readAhead, readAheadExecutor, codec);
  }
}
