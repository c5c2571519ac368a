/**
 * Root package of the ledger driver.
 *
 * <p>The driver runs application functions as ledger transactions over a pool of sessions,
 * retrying them on conflicts and transient failures and verifying the commit digest of every
 * transaction.
 *
 * <p>Package contents:
 *
 * <ul>
 *   <li>{@link com.example.ledgerdriver.core.LedgerDriver} – entry point; owns the session pool and
 *       the retry loop across sessions.
 *   <li>{@link com.example.ledgerdriver.core.TransactionExecutor} – handle given to transaction
 *       functions for running statements.
 *   <li>{@link com.example.ledgerdriver.core.RetryConfig} – retry limit and backoff settings.
 *   <li>{@link com.example.ledgerdriver.core.Retry} – backoff calculation and classification of
 *       ledger errors.
 *   <li>{@link com.example.ledgerdriver.core.Result} and {@link
 *       com.example.ledgerdriver.core.BufferedResult} – statement results.
 *   <li>{@link com.example.ledgerdriver.core.QueryStats} – IO and timing metrics of a result.
 *   <li>{@link com.example.ledgerdriver.core.hash.LedgerHash} – commutative hash used for commit
 *       digests.
 *   <li>{@link com.example.ledgerdriver.core.codec.IonValueCodec} – Jackson Ion conversion of
 *       parameters and result values.
 *   <li>{@link com.example.ledgerdriver.core.client.QldbSessionClientProvider} – builds the low
 *       level client from system properties or environment variables.
 * </ul>
 */
package com.example.ledgerdriver.core;
