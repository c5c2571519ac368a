package com.example.ledgerdriver.core;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Result held entirely in memory. It is independent of the transaction that produced it and can be
 * iterated any number of times.
 *
 * <p>The driver buffers a streamed result automatically when a transaction function returns one,
 * since committing would otherwise invalidate it.
 */
public final class BufferedResult implements Result {

  private final List<JsonNode> values;
  private final QueryStats stats;

  BufferedResult(final List<? extends JsonNode> values, final QueryStats stats) {
    this.values = Collections.unmodifiableList(new ArrayList<JsonNode>(values));
    this.stats = stats;
  }

  @Override
  public Iterator<JsonNode> iterator() {
    return values.iterator();
  }

  @Override
  public QueryStats getQueryStats() {
    return stats;
  }

  public List<JsonNode> values() {
    return values;
  }

  public int size() {
    return values.size();
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }
}
