package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ledgerdriver.core.codec.ValueCodec;
import com.example.ledgerdriver.core.exceptions.DigestMismatchException;
import com.example.ledgerdriver.core.exceptions.TransactionClosedException;
import com.example.ledgerdriver.core.hash.LedgerHash;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import software.amazon.awssdk.core.SdkBytes;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.qldbsession.model.OccConflictException;
import software.amazon.awssdk.services.qldbsession.model.Page;
import software.amazon.awssdk.services.qldbsession.model.ValueHolder;

/**
 * One open transaction on a session.
 *
 * <p>The transaction keeps a running digest over every statement and parameter it sends and checks
 * it against the digest the ledger returns on commit. Committing or aborting closes the
 * transaction for good, together with every cursor it produced.
 *
 * <p>Errors raised while the transaction is open leave its state ambiguous; it must not be reused
 * after one.
 */
final class Transaction {

  private static final System.Logger LOGGER = System.getLogger(Transaction.class.getName());

  private final SessionClient session;
  private final String id;
  private final int readAhead;
  private final Executor executor;
  private final ValueCodec codec;
  private final List<LiveCursor> cursors = new ArrayList<>();

  private LedgerHash digest;
  private boolean closed;
  private boolean abortPending;

  Transaction(
      final SessionClient session,
      final String id,
      final int readAhead,
      final Executor executor,
      final ValueCodec codec) {
    this.session = session;
    this.id = id;
    this.readAhead = readAhead;
    this.executor = executor;
    this.codec = codec;
    this.digest = LedgerHash.of(codec.encode(id));
  }

  String id() {
    return id;
  }

  boolean isClosed() {
    return closed;
  }

  /** Current running digest. */
  LedgerHash digest() {
    return digest;
  }

  /**
   * Executes a statement.
   *
   * @param statement statement text
   * @param parameters values bound to the statement's placeholders, in order
   * @return streaming cursor over the statement's result
   * @throws TransactionClosedException if the transaction was committed or aborted
   */
  Result execute(final String statement, final Object... parameters) {
    if (closed) throw new TransactionClosedException();

    final var encoded = new ArrayList<byte[]>(parameters.length);
    for (final var parameter : parameters) encoded.add(codec.encode(parameter));
    updateDigest(statement, encoded);

    final var holders =
        encoded.stream()
            .map(bytes -> ValueHolder.builder().ionBinary(SdkBytes.fromByteArray(bytes)).build())
            .toList();
    final var result = session.executeStatement(id, statement, holders);

    final var firstPage = result.firstPage() == null ? Page.builder().build() : result.firstPage();
    final var stats = QueryStats.from(result.consumedIOs(), result.timingInformation());
    final LiveCursor cursor =
        readAhead > 0
            ? new ReadAheadCursor(session, id, firstPage, stats, codec, readAhead, executor)
            : new StreamCursor(session, id, firstPage, stats, codec);
    cursors.add(cursor);
    return cursor;
  }

  /**
   * Commits the transaction. The transaction is closed afterwards whatever the outcome.
   *
   * <p>A failed commit other than an OCC conflict leaves the transaction open on the ledger; the
   * caller is expected to {@link #abort()} it.
   *
   * @throws TransactionClosedException if the transaction was already committed or aborted
   * @throws DigestMismatchException if the ledger's digest differs from the local one
   */
  void commit() {
    if (closed) throw new TransactionClosedException();

    try {
      final var result = session.commitTransaction(id, digest.toByteArray());
      final var serverDigest = result.commitDigest();
      if (serverDigest == null || !digest.matches(serverDigest.asByteArray()))
        throw new DigestMismatchException(id);
      LOGGER.log(DEBUG, "Committed transaction {0}", id);
    } catch (final OccConflictException e) {
      // the ledger has already discarded the transaction
      throw e;
    } catch (final RuntimeException e) {
      abortPending = true;
      throw e;
    } finally {
      close();
    }
  }

  /**
   * Aborts the transaction. No-op if it was committed or already aborted; a transaction whose
   * commit failed is still aborted on the ledger.
   *
   * @throws SdkException if the abort request fails; the transaction is closed regardless
   */
  void abort() {
    if (closed && !abortPending) return;
    abortPending = false;
    close();
    session.abortTransaction();
  }

  private void close() {
    closed = true;
    for (final var cursor : cursors) cursor.close();
    cursors.clear();
  }

  private void updateDigest(final String statement, final List<byte[]> parameters) {
    var statementHash = LedgerHash.of(codec.encode(statement));
    for (final var parameter : parameters) {
      statementHash = statementHash.dot(LedgerHash.of(parameter));
    }
    digest = digest.dot(statementHash);
  }
}
