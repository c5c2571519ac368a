package com.example.ledgerdriver.core;

import static org.junit.jupiter.api.Assertions.*;

import com.example.ledgerdriver.core.exceptions.DigestMismatchException;
import com.example.ledgerdriver.core.exceptions.LambdaAbortedException;
import com.example.ledgerdriver.core.exceptions.SessionClosedException;
import com.fasterxml.jackson.databind.node.IntNode;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.*;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.qldbsession.model.BadRequestException;
import software.amazon.awssdk.services.qldbsession.model.InvalidSessionException;
import software.amazon.awssdk.services.qldbsession.model.OccConflictException;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class SessionTest {

  private FakeLedger ledger;
  private Session session;
  private List<String> backoffs;
  private RetryConfig config;

  @BeforeEach
  void setUp() {
    ledger = new FakeLedger();
    session = new Session(SessionClient.start("ledger", ledger.client), 0, null, ledger.codec);
    backoffs = new ArrayList<>();
    config =
        RetryConfig.custom(
            4,
            (attempt, error, txnId) -> {
              backoffs.add(attempt + ":" + txnId);
              return 0L;
            });
  }

  @AfterEach
  void clearInterruptFlag() {
    if (Thread.currentThread().isInterrupted()) Thread.interrupted();
  }

  private <T> T run(final ExecutorFunction<T> function) {
    return session.executeWithRetry(function, config, new AttemptCounter());
  }

  @Nested
  @DisplayName("Retried failures")
  class Retried {

    @Test
    @DisplayName("Should rerun the function after an OCC conflict")
    void shouldRetryOcc() {
      ledger.fail(FakeLedger.COMMIT, FakeLedger.occ());
      final var invocations = new AtomicInteger();

      final var result =
          run(
              txn -> {
                txn.execute("UPDATE Person SET age = 31");
                return invocations.incrementAndGet();
              });

      assertEquals(2, result);
      assertEquals(List.of("1:txn-1"), backoffs);
      assertEquals(0, ledger.calls(FakeLedger.ABORT));
      assertTrue(session.isAlive());
    }

    @Test
    @DisplayName("Should give up once the retry limit is reached")
    void shouldStopAtRetryLimit() {
      config = RetryConfig.custom(2, (attempt, error, txnId) -> 0L);
      ledger.fail(
          FakeLedger.COMMIT, FakeLedger.occ(), FakeLedger.occ(), FakeLedger.occ(), FakeLedger.occ());
      final var invocations = new AtomicInteger();

      assertThrows(OccConflictException.class, () -> run(txn -> invocations.incrementAndGet()));

      assertEquals(3, invocations.get());
    }

    @Test
    @DisplayName("Should retry expired transactions on the same session")
    void shouldRetryExpiredTransaction() {
      ledger.fail(FakeLedger.EXECUTE, FakeLedger.invalidSession("Transaction txn-1 has expired"));

      final var result = run(txn -> txn.execute("SELECT 1") != null);

      assertTrue(result);
      assertTrue(session.isAlive());
      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertEquals(1, backoffs.size());
    }

    @Test
    @DisplayName("Should retry transport failures after aborting")
    void shouldRetryTransportFailures() {
      ledger.fail(FakeLedger.EXECUTE, FakeLedger.transport());

      run(txn -> txn.execute("SELECT 1"));

      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertEquals(List.of("1:txn-1"), backoffs);
      assertEquals(2, ledger.calls(FakeLedger.START_TRANSACTION));
    }

    @Test
    @DisplayName("Should abort and retry when the transaction expires at commit")
    void shouldRetryExpiryAtCommit() {
      ledger.fail(FakeLedger.COMMIT, FakeLedger.invalidSession("Transaction txn-1 has expired"));

      assertEquals("done", run(txn -> "done"));

      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertEquals(2, ledger.calls(FakeLedger.COMMIT));
      assertTrue(session.isAlive());
    }

    @Test
    @DisplayName("Should notify the retry listener before each retry")
    void shouldNotifyRetryListener() {
      final var retries = new ArrayList<String>();
      config =
          config.withRetryListener(
              (attempt, error, txnId) -> {
                assertEquals(retries.size(), backoffs.size());
                retries.add(attempt + ":" + txnId + ":" + error.getClass().getSimpleName());
              });
      ledger.fail(FakeLedger.COMMIT, FakeLedger.occ(), FakeLedger.occ());

      run(txn -> null);

      assertEquals(
          List.of("1:txn-1:OccConflictException", "2:txn-2:OccConflictException"), retries);
      assertEquals(2, backoffs.size());
    }

    @Test
    @DisplayName("Should end the call with the retry listener's error")
    void shouldPropagateRetryListenerError() {
      final var listenerError = new IllegalStateException("stop");
      config =
          config.withRetryListener(
              (attempt, error, txnId) -> {
                throw listenerError;
              });
      ledger.fail(FakeLedger.COMMIT, FakeLedger.occ());

      assertSame(listenerError, assertThrows(IllegalStateException.class, () -> run(txn -> 1)));
      assertTrue(backoffs.isEmpty());
    }

    @Test
    @DisplayName("Should hand the retry back when a failed abort kills the session")
    void shouldRequestNewSessionAfterFailedAbort() {
      final var error = FakeLedger.transport();
      ledger.fail(FakeLedger.EXECUTE, error);
      ledger.fail(FakeLedger.ABORT, FakeLedger.transport());
      final var attempts = new AttemptCounter();

      final var ex =
          assertThrows(
              Session.RetryOnNewSessionException.class,
              () -> session.executeWithRetry(txn -> txn.execute("SELECT 1"), config, attempts));

      assertSame(error, ex.error());
      assertFalse(session.isAlive());
      assertEquals(1, attempts.get());
      assertEquals(List.of("1:txn-1"), backoffs);
      assertEquals(1, ledger.calls(FakeLedger.START_TRANSACTION));
    }

    @Test
    @DisplayName("Should surface the original error when no retry is left after a failed abort")
    void shouldSurfaceErrorWhenRetriesRunOut() {
      config = RetryConfig.custom(0, (attempt, error, txnId) -> 0L);
      final var error = FakeLedger.transport();
      ledger.fail(FakeLedger.EXECUTE, error);
      ledger.fail(FakeLedger.ABORT, FakeLedger.transport());

      assertSame(
          error, assertThrows(SdkClientException.class, () -> run(txn -> txn.execute("SELECT 1"))));
      assertFalse(session.isAlive());
    }

    @Test
    @DisplayName("Should retry when the ledger rejects the start of a transaction")
    void shouldRetryStartTransaction() {
      ledger.fail(FakeLedger.START_TRANSACTION, FakeLedger.badRequest());

      assertEquals("done", run(txn -> "done"));

      assertEquals(List.of("1:null"), backoffs);
      assertEquals(1, ledger.calls(FakeLedger.ABORT));
    }
  }

  @Nested
  @DisplayName("Failures that are not retried")
  class NotRetried {

    @Test
    @DisplayName("Should mark the session dead when the ledger rejects it")
    void shouldKillInvalidSession() {
      ledger.fail(FakeLedger.EXECUTE, FakeLedger.invalidSession("Invalid session token"));

      assertThrows(InvalidSessionException.class, () -> run(txn -> txn.execute("SELECT 1")));

      assertFalse(session.isAlive());
      assertTrue(backoffs.isEmpty());
      assertThrows(SessionClosedException.class, session::startTransaction);
    }

    @Test
    @DisplayName("Should abort and stop when the function aborts")
    void shouldNotRetryLambdaAbort() {
      final var invocations = new AtomicInteger();

      assertThrows(
          LambdaAbortedException.class,
          () ->
              run(
                  txn -> {
                    invocations.incrementAndGet();
                    txn.abort();
                    return null;
                  }));

      assertEquals(1, invocations.get());
      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertEquals(0, ledger.calls(FakeLedger.COMMIT));
      assertTrue(session.isAlive());
    }

    @Test
    @DisplayName("Should abort and rethrow application errors")
    void shouldRethrowApplicationErrors() {
      final var error = new IllegalStateException("bad row");

      assertSame(
          error,
          assertThrows(
              IllegalStateException.class,
              () ->
                  run(
                      txn -> {
                        throw error;
                      })));

      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertTrue(backoffs.isEmpty());
    }

    @Test
    @DisplayName("Should not retry a digest mismatch")
    void shouldNotRetryDigestMismatch() {
      ledger.corruptDigest(true);

      assertThrows(DigestMismatchException.class, () -> run(txn -> txn.execute("SELECT 1")));

      assertEquals(1, ledger.calls(FakeLedger.COMMIT));
      assertTrue(backoffs.isEmpty());
    }

    @Test
    @DisplayName("Should abort after a failed commit and mark the session dead if that fails")
    void shouldKillSessionWhenAbortAfterCommitFails() {
      final var commitFailure = FakeLedger.badRequest();
      ledger.fail(FakeLedger.COMMIT, commitFailure);
      ledger.fail(FakeLedger.ABORT, FakeLedger.transport());

      assertSame(
          commitFailure, assertThrows(BadRequestException.class, () -> run(txn -> "done")));

      assertEquals(1, ledger.calls(FakeLedger.ABORT));
      assertFalse(session.isAlive());
      assertTrue(backoffs.isEmpty());
    }

    @Test
    @DisplayName("Should mark the session dead when an abort fails")
    void shouldKillSessionOnFailedAbort() {
      ledger.fail(FakeLedger.ABORT, FakeLedger.transport());

      assertThrows(
          IllegalStateException.class,
          () ->
              run(
                  txn -> {
                    throw new IllegalStateException("bad row");
                  }));

      assertFalse(session.isAlive());
    }
  }

  @Nested
  @DisplayName("Results")
  class Results {

    @Test
    @DisplayName("Should buffer a streamed result returned by the function")
    void shouldBufferLiveResult() {
      ledger.results("SELECT * FROM Person", List.of(1, 2), List.of(3));

      final Result result = run(txn -> txn.execute("SELECT * FROM Person"));

      final var buffered = assertInstanceOf(BufferedResult.class, result);
      assertEquals(3, buffered.size());
      assertEquals(3, buffered.values().get(2).asInt());
    }

    @Test
    @DisplayName("Should buffer the unread rows of a partly consumed result")
    void shouldBufferPartlyReadResult() {
      ledger.results("SELECT * FROM Person", List.of(1, 2), List.of(3));

      final Result result =
          run(
              txn -> {
                final var cursor = txn.execute("SELECT * FROM Person");
                assertEquals(1, cursor.iterator().next().asInt());
                return cursor;
              });

      final var buffered = assertInstanceOf(BufferedResult.class, result);
      assertEquals(List.of(IntNode.valueOf(2), IntNode.valueOf(3)), buffered.values());
      assertEquals(1, ledger.calls(FakeLedger.COMMIT));
    }

    @Test
    @DisplayName("Should end the remote session once")
    void shouldEndOnce() {
      session.end();
      session.end();

      assertFalse(session.isAlive());
      assertEquals(1, ledger.calls(FakeLedger.END_SESSION));
    }
  }
}
