package com.example.ledgerdriver.core;

import com.example.ledgerdriver.core.codec.ValueCodec;
import com.example.ledgerdriver.core.exceptions.ResultClosedException;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.NoSuchElementException;
import software.amazon.awssdk.services.qldbsession.model.Page;

/**
 * Streams the rows of one statement, fetching the next page on the caller's thread once the current
 * page is exhausted. Empty intermediate pages are skipped.
 *
 * <p>Only the owning transaction closes the cursor; the open flag is volatile because the
 * read-ahead worker of {@link ReadAheadCursor} reads it from another thread.
 */
class StreamCursor implements LiveCursor, Iterator<JsonNode> {

  private static final Page EMPTY_PAGE = Page.builder().build();

  protected final SessionClient session;
  protected final String transactionId;
  private final ValueCodec codec;

  private volatile boolean open = true;
  private boolean iteratorReturned;
  private Page page;
  private int index;
  private QueryStats stats;

  StreamCursor(
      final SessionClient session,
      final String transactionId,
      final Page firstPage,
      final QueryStats firstPageStats,
      final ValueCodec codec) {
    this.session = session;
    this.transactionId = transactionId;
    this.page = firstPage;
    this.stats = firstPageStats;
    this.codec = codec;
  }

  @Override
  public Iterator<JsonNode> iterator() {
    if (iteratorReturned)
      throw new IllegalStateException("A streamed result can only be iterated once");
    iteratorReturned = true;
    return this;
  }

  @Override
  public boolean hasNext() {
    if (!open) throw new ResultClosedException(session.token());

    while (index >= page.values().size()) {
      if (!hasMorePages()) return false;
      nextPage();
    }
    return true;
  }

  @Override
  public JsonNode next() {
    if (!hasNext()) throw new NoSuchElementException();
    final var holder = page.values().get(index++);
    return codec.decode(holder.ionBinary().asByteArray());
  }

  @Override
  public BufferedResult buffer() {
    final var rows = new ArrayList<JsonNode>();
    while (hasNext()) rows.add(next());
    return new BufferedResult(rows, stats);
  }

  @Override
  public QueryStats getQueryStats() {
    return stats;
  }

  @Override
  public boolean isOpen() {
    return open;
  }

  @Override
  public void close() {
    open = false;
  }

  /** True if pages beyond the current one remain. */
  protected boolean hasMorePages() {
    return page.nextPageToken() != null;
  }

  /** Replaces the current page with the next one. */
  protected void nextPage() {
    final var result = session.fetchPage(transactionId, page.nextPageToken());
    accept(result.page(), QueryStats.from(result.consumedIOs(), result.timingInformation()));
  }

  protected final void accept(final Page next, final QueryStats pageStats) {
    stats = stats.plus(pageStats);
    page = next == null ? EMPTY_PAGE : next;
    index = 0;
  }

  protected final Page currentPage() {
    return page;
  }
}
