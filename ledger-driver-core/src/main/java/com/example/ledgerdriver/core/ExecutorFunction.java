package com.example.ledgerdriver.core;

/**
 * Unit of work run inside a transaction. It may be invoked several times when the transaction is
 * retried, so it must not have side effects outside the ledger, and its result cannot be trusted
 * until the transaction has committed.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface ExecutorFunction<T> {

  T execute(TransactionExecutor txn);
}
