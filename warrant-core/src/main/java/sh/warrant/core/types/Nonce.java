// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.types;

import java.security.SecureRandom;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.warrant.primitives.Hex;

/**
 * Hex-encoded 32-byte authorization nonce ({@code bytes32}).
 * <p>
 * Nonces are chosen by the signer and are NOT sequential: any unused value may be
 * consumed at any time, in any order. Uniqueness is only required per signer, so two
 * signers may use the same nonce value independently.
 * <p>
 * Unlike a raw {@code byte[]}, a {@code Nonce} is immutable and value-equal, which makes
 * it usable as part of a registry key.
 *
 * @since 0.1.0
 */
public record Nonce(@JsonValue String value) {
    /** Length in bytes of an authorization nonce. */
    public static final int BYTE_LENGTH = 32;

    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);
    private static final SecureRandom RANDOM = new SecureRandom();

    public Nonce {
        Objects.requireNonNull(value, "nonce");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid nonce: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the 32 raw nonce bytes.
     *
     * @return a fresh 32-byte array
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Creates a nonce from 32 raw bytes.
     *
     * @param bytes exactly 32 bytes
     * @return the nonce
     * @throws IllegalArgumentException if {@code bytes} is null or not 32 bytes long
     */
    public static Nonce fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException(
                "nonce must be " + BYTE_LENGTH + " bytes, got " + (bytes == null ? "null" : bytes.length));
        }
        return new Nonce("0x" + Hex.encodeNoPrefix(bytes));
    }

    /**
     * Generates a cryptographically random nonce.
     *
     * @return 32 random bytes as a nonce
     */
    public static Nonce random() {
        final byte[] bytes = new byte[BYTE_LENGTH];
        RANDOM.nextBytes(bytes);
        return fromBytes(bytes);
    }
}
