package com.example.ledgerdriver.core.hash;

import com.amazon.ion.IonSystem;
import com.amazon.ion.system.IonSystemBuilder;
import com.amazon.ionhash.IonHashReaderBuilder;
import com.amazon.ionhash.IonHasherProvider;
import com.amazon.ionhash.MessageDigestIonHasherProvider;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * A ledger hash is either a 256-bit SHA-256 digest or the special empty hash.
 *
 * <p>Values are hashed with the Ion Hash algorithm over SHA-256, which depends only on the Ion data
 * model, so a value hashes the same however it was encoded.
 *
 * <p>The empty hash is the identity of {@link #dot(LedgerHash)}, and {@code dot} is commutative:
 * the two operands are ordered before being concatenated and hashed, so {@code a.dot(b)} and {@code
 * b.dot(a)} yield the same value.
 *
 * <h2>Transaction digest</h2>
 *
 * <pre>{@code
 * var digest = LedgerHash.of(codec.encode(transactionId));
 * var statementHash = LedgerHash.of(codec.encode(statement));
 * for (var parameter : encodedParameters) {
 *   statementHash = statementHash.dot(LedgerHash.of(parameter));
 * }
 * digest = digest.dot(statementHash);
 * }</pre>
 */
public final class LedgerHash {

  public static final int HASH_SIZE = 32;

  public static final LedgerHash EMPTY = new LedgerHash(new byte[0]);

  private static final String ALGORITHM = "SHA-256";

  private static final IonSystem ION = IonSystemBuilder.standard().build();
  private static final IonHasherProvider HASHER_PROVIDER =
      new MessageDigestIonHasherProvider(ALGORITHM);

  private final byte[] hash;

  private LedgerHash(final byte[] hash) {
    this.hash = hash;
  }

  /**
   * Wraps an existing hash value.
   *
   * @param hash either empty or exactly {@value #HASH_SIZE} bytes
   * @return the hash
   * @throws IllegalArgumentException if the array is null or has any other length
   */
  public static LedgerHash wrap(final byte[] hash) {
    if (hash == null || (hash.length != HASH_SIZE && hash.length != 0))
      throw new IllegalArgumentException(
          "Hash must either be empty or " + HASH_SIZE + " bytes long");
    return hash.length == 0 ? EMPTY : new LedgerHash(hash.clone());
  }

  /**
   * Computes the Ion Hash of an already encoded value.
   *
   * @param encodedValue a single Ion value, binary or text
   * @return the value's Ion Hash
   * @throws IllegalArgumentException if the input holds no value
   */
  public static LedgerHash of(final byte[] encodedValue) {
    try (final var reader =
        IonHashReaderBuilder.standard()
            .withHasherProvider(HASHER_PROVIDER)
            .withReader(ION.newReader(encodedValue))
            .build()) {
      if (reader.next() == null) throw new IllegalArgumentException("No Ion value to hash");
      // the digest is available once the reader has moved past the value
      reader.next();
      return new LedgerHash(reader.digest());
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to read Ion value", e);
    }
  }

  /**
   * Combines this hash with another one. The result does not depend on the order of the operands.
   *
   * @param that the other hash
   * @return the combined hash, or the non-empty operand if one of them is empty
   */
  public LedgerHash dot(final LedgerHash that) {
    if (this.isEmpty()) return that;
    if (that.isEmpty()) return this;

    final var concatenated = new byte[HASH_SIZE * 2];
    final boolean thisFirst = compare(this.hash, that.hash) < 0;
    System.arraycopy(thisFirst ? this.hash : that.hash, 0, concatenated, 0, HASH_SIZE);
    System.arraycopy(thisFirst ? that.hash : this.hash, 0, concatenated, HASH_SIZE, HASH_SIZE);
    return new LedgerHash(sha256(concatenated));
  }

  public boolean isEmpty() {
    return hash.length == 0;
  }

  /** Returns a copy of the raw hash bytes. */
  public byte[] toByteArray() {
    return hash.clone();
  }

  /**
   * Constant-time comparison against raw hash bytes, as returned by the ledger on commit.
   *
   * @param other raw bytes to compare against, may be null
   * @return true if the bytes are identical
   */
  public boolean matches(final byte[] other) {
    return other != null && MessageDigest.isEqual(hash, other);
  }

  /**
   * Compares two hashes by their signed byte values, starting from the last byte.
   *
   * @throws IllegalArgumentException if either array is not {@value #HASH_SIZE} bytes long
   */
  static int compare(final byte[] h1, final byte[] h2) {
    if (h1.length != HASH_SIZE || h2.length != HASH_SIZE)
      throw new IllegalArgumentException("Invalid hash");
    for (int i = HASH_SIZE - 1; i >= 0; i--) {
      final int difference = h1[i] - h2[i];
      if (difference != 0) return difference;
    }
    return 0;
  }

  private static byte[] sha256(final byte[] data) {
    try {
      return MessageDigest.getInstance(ALGORITHM).digest(data);
    } catch (final NoSuchAlgorithmException e) {
      // every JRE is required to ship SHA-256
      throw new IllegalStateException(ALGORITHM + " is not available", e);
    }
  }

  @Override
  public boolean equals(final Object o) {
    return o instanceof LedgerHash other && Arrays.equals(hash, other.hash);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(hash);
  }

  @Override
  public String toString() {
    return HexFormat.of().formatHex(hash);
  }
}
