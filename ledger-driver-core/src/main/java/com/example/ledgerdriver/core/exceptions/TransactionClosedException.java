package com.example.ledgerdriver.core.exceptions;

public class TransactionClosedException extends LedgerDriverException {

  public TransactionClosedException() {
    super(
        "Cannot invoke methods on a closed transaction. Please start a new transaction and retry.");
  }
}
