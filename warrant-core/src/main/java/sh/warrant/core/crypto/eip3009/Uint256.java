// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip3009;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Range checks for {@code uint256} message fields.
 */
final class Uint256 {

    static final BigInteger LIMIT = BigInteger.ONE.shiftLeft(256);

    /** Largest uint256, used as the "never expires" bound. */
    static final BigInteger MAX = LIMIT.subtract(BigInteger.ONE);

    private Uint256() {}

    static BigInteger require(final String field, final BigInteger value) {
        Objects.requireNonNull(value, field);
        if (value.signum() < 0) {
            throw new IllegalArgumentException(field + " must be non-negative, got " + value);
        }
        if (value.compareTo(LIMIT) >= 0) {
            throw new IllegalArgumentException(field + " must fit in 256 bits, got " + value);
        }
        return value;
    }
}
