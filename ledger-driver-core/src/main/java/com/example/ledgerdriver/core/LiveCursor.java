package com.example.ledgerdriver.core;

/** A result still bound to an open transaction. Implemented by the streaming cursors only. */
interface LiveCursor extends Result {

  boolean isOpen();

  /** Invalidates the cursor; later reads fail with {@code ResultClosedException}. */
  void close();

  /**
   * Reads the remaining rows into memory so they survive the transaction. Rows already consumed are
   * not included.
   */
  BufferedResult buffer();
}
