package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ledgerdriver.core.codec.ValueCodec;
import com.example.ledgerdriver.core.exceptions.ResultClosedException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.qldbsession.model.FetchPageResult;
import software.amazon.awssdk.services.qldbsession.model.Page;

/**
 * Stream cursor that fetches pages on a background worker while the caller consumes the current
 * one.
 *
 * <p>Fetched pages go through a queue holding at most {@code readAhead - 1} pages. When the queue
 * is full the worker retries every {@value #OFFER_TIMEOUT_MILLIS} ms and stops once the cursor has
 * been closed. A fetch error is handed to the consumer through the queue and ends the worker.
 */
final class ReadAheadCursor extends StreamCursor {

  private static final System.Logger LOGGER = System.getLogger(ReadAheadCursor.class.getName());

  static final long OFFER_TIMEOUT_MILLIS = 50L;

  // holds FetchPageResult items, or a RuntimeException as the final item
  private final BlockingQueue<Object> queue;
  private RuntimeException failure;

  /**
   * Creates the cursor and starts its worker.
   *
   * @param readAhead window size, at least 2
   * @param executor executor for the worker, or null to start a dedicated daemon thread
   */
  ReadAheadCursor(
      final SessionClient session,
      final String transactionId,
      final Page firstPage,
      final QueryStats firstPageStats,
      final ValueCodec codec,
      final int readAhead,
      final Executor executor) {
    super(session, transactionId, firstPage, firstPageStats, codec);
    if (readAhead < 2) throw new IllegalArgumentException("readAhead must be >= 2");
    this.queue = new ArrayBlockingQueue<>(readAhead - 1);

    final var firstToken = firstPage.nextPageToken();
    final Runnable worker = () -> populateQueue(firstToken);
    if (executor == null) {
      final var thread = new Thread(worker, "ReadAheadCursor-" + transactionId);
      thread.setDaemon(true);
      thread.start();
    } else {
      executor.execute(worker);
    }
  }

  @Override
  protected boolean hasMorePages() {
    return failure != null || currentPage().nextPageToken() != null || !queue.isEmpty();
  }

  @Override
  protected void nextPage() {
    if (failure != null) throw failure;

    final Object item;
    try {
      item = queue.take();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ResultClosedException(session.token());
    }

    if (item instanceof RuntimeException error) {
      failure = error;
      throw error;
    }
    final var result = (FetchPageResult) item;
    accept(result.page(), QueryStats.from(result.consumedIOs(), result.timingInformation()));
  }

  /** Number of fetched pages waiting to be consumed. */
  int bufferedPages() {
    return queue.size();
  }

  private void populateQueue(final String firstToken) {
    try {
      var nextToken = firstToken;
      while (nextToken != null) {
        final var result = session.fetchPage(transactionId, nextToken);
        while (!queue.offer(result, OFFER_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
          if (!isOpen()) {
            LOGGER.log(DEBUG, "Cursor was closed; read-ahead retriever thread stopping.");
            throw new ResultClosedException(session.token());
          }
        }
        nextToken = result.page() == null ? null : result.page().nextPageToken();
      }
    } catch (final SdkException | ResultClosedException e) {
      enqueueFailure(e);
    } catch (final RuntimeException e) {
      LOGGER.log(DEBUG, "Unexpected error in read-ahead retriever thread", e);
      enqueueFailure(e);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      enqueueFailure(new ResultClosedException(session.token()));
    }
  }

  private void enqueueFailure(final RuntimeException error) {
    // the consumer may be blocked on take(), so make room for the failure
    queue.clear();
    LOGGER.log(DEBUG, "Queued an exception: {0}", error.toString());
    queue.offer(error);
  }
}
