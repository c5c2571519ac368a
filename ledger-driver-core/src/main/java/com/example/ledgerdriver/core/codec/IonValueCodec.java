package com.example.ledgerdriver.core.codec;

import com.example.ledgerdriver.core.exceptions.ValueConversionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.ion.IonFactory;
import com.fasterxml.jackson.dataformat.ion.IonObjectMapper;
import java.io.IOException;

/**
 * {@link ValueCodec} backed by Jackson's Ion data format. Parameters are written as Ion binary, so
 * anything Jackson can serialize (records, maps, lists, scalars, {@link JsonNode} trees) can be
 * bound to a statement.
 *
 * <pre>{@code
 * var codec = new IonValueCodec();
 * byte[] ion = codec.encode(Map.of("name", "Alice"));
 * JsonNode row = codec.decode(ion);
 * }</pre>
 */
public final class IonValueCodec implements ValueCodec {

  private final IonObjectMapper mapper;

  public IonValueCodec() {
    this(createBinaryMapper());
  }

  /**
   * Uses a caller-configured mapper, e.g. one with additional modules registered. The mapper must
   * produce binary Ion.
   *
   * @param mapper the mapper to use
   */
  public IonValueCodec(final IonObjectMapper mapper) {
    if (mapper == null) throw new IllegalArgumentException("mapper cannot be null");
    this.mapper = mapper;
  }

  @Override
  public byte[] encode(final Object value) {
    try {
      return mapper.writeValueAsBytes(value);
    } catch (final JsonProcessingException e) {
      throw new ValueConversionException(
          "Failed to convert parameter to Ion; unsupported data type: "
              + (value == null ? "null" : value.getClass().getName()),
          e);
    }
  }

  @Override
  public JsonNode decode(final byte[] bytes) {
    try {
      return mapper.readTree(bytes);
    } catch (final IOException e) {
      throw new ValueConversionException("Failed to decode Ion value", e);
    }
  }

  /** Returns the mapper, e.g. to convert decoded rows with {@code treeToValue}. */
  public IonObjectMapper mapper() {
    return mapper;
  }

  private static IonObjectMapper createBinaryMapper() {
    final var factory = new IonFactory();
    factory.setCreateBinaryWriters(true);
    return new IonObjectMapper(factory);
  }
}
