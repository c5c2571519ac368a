package com.example.ledgerdriver.core.exceptions;

/**
 * Raised by {@code TransactionExecutor#abort()} to halt the transaction function. The transaction is
 * rolled back and the exception reaches the caller without any retry.
 */
public class LambdaAbortedException extends LedgerDriverException {

  public LambdaAbortedException() {
    super("Abort invoked; halting execution of the transaction function.");
  }
}
