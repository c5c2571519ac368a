package com.example.ledgerdriver.core;

import com.example.ledgerdriver.core.exceptions.LambdaAbortedException;

/**
 * Handle passed to an {@link ExecutorFunction} for running statements inside the current
 * transaction.
 *
 * <pre>{@code
 * driver.execute(txn -> {
 *   var existing = txn.execute("SELECT * FROM Person WHERE id = ?", id);
 *   if (existing.iterator().hasNext()) txn.abort();
 *   txn.execute("INSERT INTO Person ?", person);
 *   return null;
 * });
 * }</pre>
 */
public final class TransactionExecutor {

  private final Transaction transaction;

  TransactionExecutor(final Transaction transaction) {
    this.transaction = transaction;
  }

  /**
   * Executes a statement in the current transaction.
   *
   * @param statement statement text with {@code ?} placeholders
   * @param parameters values for the placeholders, converted by the driver's value codec
   * @return streaming result, valid until the transaction commits or aborts
   * @throws com.example.ledgerdriver.core.exceptions.TransactionClosedException if the transaction
   *     is no longer open
   * @throws com.example.ledgerdriver.core.exceptions.ValueConversionException if a parameter cannot
   *     be converted
   */
  public Result execute(final String statement, final Object... parameters) {
    return transaction.execute(statement, parameters);
  }

  /**
   * Rolls back the transaction and stops the function. Never retried.
   *
   * @throws LambdaAbortedException always
   */
  public void abort() {
    throw new LambdaAbortedException();
  }

  public String getTransactionId() {
    return transaction.id();
  }
}
