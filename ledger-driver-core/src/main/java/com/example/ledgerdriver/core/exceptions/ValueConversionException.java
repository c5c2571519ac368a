package com.example.ledgerdriver.core.exceptions;

/** Raised when a statement parameter or a result value cannot be converted to or from Ion. */
public class ValueConversionException extends LedgerDriverException {

  public ValueConversionException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
