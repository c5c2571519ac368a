package com.example.ledgerdriver.core.exceptions;

/**
 * Raised when the commit digest returned by the ledger differs from the digest the driver computed
 * over the statements it sent. The outcome of the transaction cannot be trusted and it is never
 * retried.
 */
public class DigestMismatchException extends LedgerDriverException {

  private final String transactionId;

  public DigestMismatchException(final String transactionId) {
    super(
        ("Transaction's commit digest did not match returned value from the ledger. Please retry"
                + " with a new transaction. Transaction ID: %s")
            .formatted(transactionId));
    this.transactionId = transactionId;
  }

  public String getTransactionId() {
    return transactionId;
  }
}
