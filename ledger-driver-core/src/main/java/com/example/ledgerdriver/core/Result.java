package com.example.ledgerdriver.core;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Rows returned by one statement.
 *
 * <p>Results returned from {@link TransactionExecutor#execute(String, Object...)} are streamed: they
 * fetch pages lazily, can be iterated only once and become unusable when the transaction commits or
 * aborts. Results returned from the driver itself are buffered in memory and may be iterated any
 * number of times.
 */
public interface Result extends Iterable<JsonNode> {

  /** Metrics accumulated over the pages read so far. */
  QueryStats getQueryStats();
}
