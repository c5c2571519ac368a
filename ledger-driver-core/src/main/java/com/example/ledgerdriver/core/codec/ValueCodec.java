package com.example.ledgerdriver.core.codec;

import com.example.ledgerdriver.core.exceptions.ValueConversionException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Converts statement parameters to the binary form sent to the ledger and result values back to a
 * tree. The bytes produced by {@link #encode(Object)} are also what the commit digest is computed
 * over, so encoding the same value twice must yield the same bytes.
 */
public interface ValueCodec {

  /**
   * Encodes a parameter.
   *
   * @param value the value to encode, may be null
   * @return the binary encoding
   * @throws ValueConversionException if the value's type is not supported
   */
  byte[] encode(Object value);

  /**
   * Decodes one result value.
   *
   * @param bytes the binary encoding received from the ledger
   * @return the decoded tree
   * @throws ValueConversionException if the bytes cannot be decoded
   */
  JsonNode decode(byte[] bytes);
}
