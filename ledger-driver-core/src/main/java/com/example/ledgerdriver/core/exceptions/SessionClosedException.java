package com.example.ledgerdriver.core.exceptions;

public class SessionClosedException extends LedgerDriverException {

  public SessionClosedException() {
    super("Cannot invoke methods on a closed session. Please start a new session and retry.");
  }
}
