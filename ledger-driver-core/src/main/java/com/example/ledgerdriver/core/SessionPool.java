package com.example.ledgerdriver.core;

import static java.lang.System.Logger.Level.DEBUG;

import com.example.ledgerdriver.core.exceptions.DriverClosedException;
import com.example.ledgerdriver.core.exceptions.LedgerDriverException;
import com.example.ledgerdriver.core.exceptions.SessionPoolEmptyException;
import java.time.Duration;
import java.util.concurrent.BlockingDeque;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded pool of idle sessions.
 *
 * <p>Admission is gated by a semaphore holding one permit per session that may be checked out at
 * the same time; the permit count is the only capacity authority. Idle sessions hold no permit.
 * Dead sessions are dropped on release.
 */
final class SessionPool {

  private static final System.Logger LOGGER = System.getLogger(SessionPool.class.getName());

  private final int capacity;
  private final Duration acquireTimeout;
  private final Semaphore permits;
  private final AtomicInteger availablePermits;
  private final BlockingDeque<Session> idle = new LinkedBlockingDeque<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  SessionPool(final int capacity, final Duration acquireTimeout) {
    if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
    if (acquireTimeout == null || acquireTimeout.isNegative())
      throw new IllegalArgumentException("acquireTimeout must be non-negative");
    this.capacity = capacity;
    this.acquireTimeout = acquireTimeout;
    this.permits = new Semaphore(capacity, true);
    this.availablePermits = new AtomicInteger(capacity);
  }

  /**
   * Checks out a session, reusing an idle one unless {@code forceNew} is set.
   *
   * @param forceNew skip idle sessions and start a new one
   * @param factory starts a new session
   * @return a session owned by the caller until {@link #release(Session)}
   * @throws DriverClosedException if the pool was closed
   * @throws SessionPoolEmptyException if no permit became available within the timeout
   * @throws LedgerDriverException if the thread was interrupted while waiting; the interrupt flag
   *     is restored
   */
  Session acquire(final boolean forceNew, final Supplier<Session> factory) {
    if (closed.get()) throw new DriverClosedException();

    LOGGER.log(
        DEBUG,
        "Getting session. Current free session count: {0}. Current available permit count: {1}.",
        idle.size(),
        availablePermits.get());

    try {
      if (!permits.tryAcquire(acquireTimeout.toMillis(), TimeUnit.MILLISECONDS))
        throw new SessionPoolEmptyException(acquireTimeout);
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new LedgerDriverException("Interrupted while waiting for a session", e);
    }
    availablePermits.decrementAndGet();

    try {
      if (!forceNew) {
        final var session = idle.pollFirst();
        if (session != null) {
          LOGGER.log(DEBUG, "Reusing session from pool. Session ID: {0}.", session.id());
          return session;
        }
      }
      LOGGER.log(DEBUG, "Creating new pooled session.");
      return factory.get();
    } catch (final RuntimeException e) {
      // the permit was never consumed by a live session
      permits.release();
      availablePermits.incrementAndGet();
      throw e;
    }
  }

  /** Returns a session to the pool, or ends it if it is dead or the pool is closed. */
  void release(final Session session) {
    if (session.isAlive()) {
      if (closed.get()) session.end();
      else idle.offerFirst(session);
    }
    permits.release();
    availablePermits.incrementAndGet();
    LOGGER.log(DEBUG, "Session returned to pool; size is now: {0}", idle.size());
  }

  /**
   * Closes the pool, ending every idle session.
   *
   * @return false if the pool was already closed
   */
  boolean close() {
    if (!closed.compareAndSet(false, true)) return false;
    Session session;
    while ((session = idle.pollFirst()) != null) session.end();
    return true;
  }

  boolean isClosed() {
    return closed.get();
  }

  int capacity() {
    return capacity;
  }

  int idleCount() {
    return idle.size();
  }

  int availablePermits() {
    return availablePermits.get();
  }
}
