package com.example.ledgerdriver.core;

import software.amazon.awssdk.services.qldbsession.model.IOUsage;
import software.amazon.awssdk.services.qldbsession.model.TimingInformation;

/**
 * IO and timing metrics reported by the ledger for one statement result. Each metric is null until
 * the ledger reports it at least once.
 *
 * @param readIOs number of read IOs, may be null
 * @param writeIOs number of write IOs, may be null
 * @param processingTimeMillis server-side processing time in milliseconds, may be null
 */
public record QueryStats(Long readIOs, Long writeIOs, Long processingTimeMillis) {

  public static final QueryStats NONE = new QueryStats(null, null, null);

  static QueryStats from(final IOUsage consumedIOs, final TimingInformation timing) {
    return new QueryStats(
        consumedIOs == null ? null : consumedIOs.readIOs(),
        consumedIOs == null ? null : consumedIOs.writeIOs(),
        timing == null ? null : timing.processingTimeMilliseconds());
  }

  /**
   * Adds another page's metrics onto these totals. A metric present on either side is kept; a
   * metric present on both is summed.
   */
  public QueryStats plus(final QueryStats other) {
    return new QueryStats(
        sum(readIOs, other.readIOs),
        sum(writeIOs, other.writeIOs),
        sum(processingTimeMillis, other.processingTimeMillis));
  }

  private static Long sum(final Long a, final Long b) {
    if (a == null) return b;
    if (b == null) return a;
    return a + b;
  }
}
