package com.example.ledgerdriver.core.exceptions;

/**
 * Base type for failures raised by the driver itself, as opposed to errors returned by the ledger
 * service. Remote errors are surfaced as the AWS SDK exceptions they arrive as.
 */
public class LedgerDriverException extends RuntimeException {

  public LedgerDriverException(final String message) {
    super(message);
  }

  public LedgerDriverException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
