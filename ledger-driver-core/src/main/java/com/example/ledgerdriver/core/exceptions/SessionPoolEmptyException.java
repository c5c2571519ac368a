package com.example.ledgerdriver.core.exceptions;

import java.time.Duration;

/** Raised when no session permit could be acquired before the configured timeout elapsed. */
public class SessionPoolEmptyException extends LedgerDriverException {

  public SessionPoolEmptyException(final Duration timeout) {
    super(
        "Session pool is empty after waiting for %d ms. Please close existing sessions first before retrying."
            .formatted(timeout.toMillis()));
  }
}
