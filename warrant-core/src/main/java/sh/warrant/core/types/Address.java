// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.types;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

import com.fasterxml.jackson.annotation.JsonValue;

import sh.warrant.primitives.Hex;

/**
 * Hex-encoded 20-byte account identity.
 * <p>
 * Identifies token holders, payees, relayers and the verifying token instance.
 * <p>
 * <strong>Validation:</strong>
 * <ul>
 * <li>Must start with "0x"</li>
 * <li>Must be exactly 40 hex characters long (20 bytes)</li>
 * </ul>
 * <p>
 * The value is stored in lowercase, so mixed-case (checksummed) input compares
 * equal to its lowercase form.
 *
 * @since 0.1.0
 */
public record Address(@JsonValue String value) {
    private static final int BYTE_LENGTH = 20;
    private static final Pattern HEX = HexValidator.fixedLength(BYTE_LENGTH);

    /**
     * The zero address ({@code 0x0000000000000000000000000000000000000000}).
     * <p>
     * Never a valid signer: signature recovery cannot produce it.
     */
    public static final Address ZERO = new Address("0x0000000000000000000000000000000000000000");

    public Address {
        Objects.requireNonNull(value, "address");
        if (!HEX.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid address: " + value);
        }
        value = value.toLowerCase(Locale.ROOT);
    }

    /**
     * Decodes this address to its 20 raw bytes.
     *
     * @return a fresh 20-byte array
     */
    public byte[] toBytes() {
        return Hex.decode(value);
    }

    /**
     * Creates an address from 20 raw bytes.
     *
     * @param bytes exactly 20 bytes
     * @return the address
     * @throws IllegalArgumentException if {@code bytes} is null or not 20 bytes long
     */
    public static Address fromBytes(final byte[] bytes) {
        if (bytes == null || bytes.length != BYTE_LENGTH) {
            throw new IllegalArgumentException("Address must be exactly " + BYTE_LENGTH + " bytes");
        }
        return new Address("0x" + Hex.encodeNoPrefix(bytes));
    }

    /**
     * Returns {@code true} for {@link #ZERO}.
     *
     * @return whether this is the zero address
     */
    public boolean isZero() {
        return ZERO.equals(this);
    }
}
