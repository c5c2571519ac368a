package com.example.ledgerdriver.core.exceptions;

/**
 * Wraps a failure to start a transaction, which happens before any statement has run and is
 * therefore always safe to retry.
 */
public class StartTransactionException extends LedgerDriverException {

  public StartTransactionException(final RuntimeException cause) {
    super("Failed to start transaction", cause);
  }

  @Override
  public synchronized RuntimeException getCause() {
    return (RuntimeException) super.getCause();
  }
}
