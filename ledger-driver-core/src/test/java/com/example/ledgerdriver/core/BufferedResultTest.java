package com.example.ledgerdriver.core;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class BufferedResultTest {

  private static Transaction transaction(final FakeLedger ledger) {
    final var session = SessionClient.start("ledger", ledger.client);
    return new Transaction(
        session, session.startTransaction().transactionId(), 0, null, ledger.codec);
  }

  @Test
  @DisplayName("Should keep every row and the given stats")
  void shouldKeepRows() {
    final var stats = new QueryStats(3L, 1L, 12L);
    final var rows = new ArrayList<JsonNode>(List.of(IntNode.valueOf(1), IntNode.valueOf(2)));
    final var buffered = new BufferedResult(rows, stats);
    rows.clear();

    assertEquals(2, buffered.size());
    assertFalse(buffered.isEmpty());
    assertEquals(stats, buffered.getQueryStats());
  }

  @Test
  @DisplayName("Should be iterable more than once")
  void shouldIterateRepeatedly() {
    final var buffered = new BufferedResult(List.of(IntNode.valueOf(5)), QueryStats.NONE);

    for (int i = 0; i < 2; i++) {
      final var iterator = buffered.iterator();
      assertEquals(5, iterator.next().asInt());
      assertFalse(iterator.hasNext());
    }
  }

  @Test
  @DisplayName("Should not allow modification")
  void shouldBeUnmodifiable() {
    final var buffered = new BufferedResult(List.of(), QueryStats.NONE);
    assertTrue(buffered.isEmpty());
    assertThrows(
        UnsupportedOperationException.class, () -> buffered.values().add(IntNode.valueOf(1)));
  }

  @Test
  @DisplayName("Should survive the transaction of a buffered cursor")
  void shouldOutliveTransaction() {
    final var ledger = new FakeLedger().results("SELECT 1", List.of(1), List.of(2));
    final var transaction = transaction(ledger);

    final var buffered = ((LiveCursor) transaction.execute("SELECT 1")).buffer();
    transaction.commit();

    assertEquals(List.of(IntNode.valueOf(1), IntNode.valueOf(2)), buffered.values());
    assertEquals(2 * FakeLedger.READ_IOS_PER_PAGE, buffered.getQueryStats().readIOs());
  }

  @Test
  @DisplayName("Should keep only the rows not yet read from a partly consumed cursor")
  void shouldBufferRemainingRows() {
    final var ledger = new FakeLedger().results("SELECT 1", List.of(1, 2), List.of(3));
    final var cursor = transaction(ledger).execute("SELECT 1");

    assertEquals(1, cursor.iterator().next().asInt());
    final var buffered = ((LiveCursor) cursor).buffer();

    assertEquals(List.of(IntNode.valueOf(2), IntNode.valueOf(3)), buffered.values());
  }

  @Test
  @DisplayName("Should sum stats, keeping metrics reported on one side only")
  void shouldSumStats() {
    final var total = new QueryStats(1L, null, 4L).plus(new QueryStats(2L, 3L, null));
    assertEquals(new QueryStats(3L, 3L, 4L), total);
    assertEquals(QueryStats.NONE, QueryStats.NONE.plus(QueryStats.NONE));
  }
}
