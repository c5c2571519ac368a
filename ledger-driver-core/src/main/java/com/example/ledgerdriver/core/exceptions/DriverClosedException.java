package com.example.ledgerdriver.core.exceptions;

/** Raised when a closed driver is asked for a session or a transaction. */
public class DriverClosedException extends LedgerDriverException {

  public DriverClosedException() {
    super("Cannot invoke methods on a closed driver. Please create a new driver and retry.");
  }
}
