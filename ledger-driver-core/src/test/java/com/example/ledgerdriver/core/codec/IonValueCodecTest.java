package com.example.ledgerdriver.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import com.example.ledgerdriver.core.exceptions.ValueConversionException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public class IonValueCodecTest {

  record Person(String name, int age) {}

  private final IonValueCodec codec = new IonValueCodec();

  @Test
  @DisplayName("Should write binary Ion")
  void shouldWriteBinaryIon() {
    final var bytes = codec.encode("txn-1");
    // Ion 1.0 binary version marker
    assertEquals((byte) 0xE0, bytes[0]);
    assertEquals((byte) 0x01, bytes[1]);
    assertEquals((byte) 0x00, bytes[2]);
    assertEquals((byte) 0xEA, bytes[3]);
  }

  @Test
  @DisplayName("Should decode what it encodes")
  void shouldDecodeEncodedValues() {
    final var row = codec.decode(codec.encode(new Person("Alice", 31)));
    assertEquals("Alice", row.get("name").asText());
    assertEquals(31, row.get("age").asInt());

    final var list = codec.decode(codec.encode(List.of(1, 2, 3)));
    assertEquals(3, list.size());
  }

  @Test
  @DisplayName("Should produce identical bytes for identical values")
  void shouldBeDeterministic() {
    final var value = Map.of("id", 7);
    assertArrayEquals(codec.encode(value), codec.encode(value));
  }

  @Test
  @DisplayName("Should convert decoded rows with the mapper")
  void shouldConvertWithMapper() throws Exception {
    final var row = codec.decode(codec.encode(new Person("Bob", 40)));
    assertEquals(new Person("Bob", 40), codec.mapper().treeToValue(row, Person.class));
  }

  @Test
  @DisplayName("Should reject unsupported parameter types")
  void shouldRejectUnsupportedTypes() {
    final var ex = assertThrows(ValueConversionException.class, () -> codec.encode(new Object()));
    assertTrue(ex.getMessage().contains("java.lang.Object"));
    assertNotNull(ex.getCause());
  }

  @Test
  @DisplayName("Should reject a null mapper")
  void shouldRejectNullMapper() {
    assertThrows(IllegalArgumentException.class, () -> new IonValueCodec(null));
  }
}
