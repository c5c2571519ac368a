package com.example.ledgerdriver.core.exceptions;

/**
 * Raised when a streamed result is read after its parent transaction was committed or aborted.
 * Results that must outlive their transaction have to be buffered first.
 */
public class ResultClosedException extends LedgerDriverException {

  public ResultClosedException(final String sessionToken) {
    super(
        ("A streamed result is only valid when the parent transaction is open. Please start a new"
                + " transaction and retry.%nSessionToken: %s")
            .formatted(sessionToken));
  }
}
