// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import java.util.Arrays;
import java.util.Objects;

import sh.warrant.primitives.Hex;

/**
 * secp256k1 ECDSA signature over a 32-byte digest.
 *
 * <p>
 * A signature consists of three components:
 * <ul>
 * <li><b>r</b>: first 32 bytes, the x coordinate of the nonce point</li>
 * <li><b>s</b>: second 32 bytes</li>
 * <li><b>v</b>: recovery id; 27 or 28 for typed-data signatures, 0 or 1 for raw hash signing</li>
 * </ul>
 *
 * <p>
 * The compact 65-byte form produced by wallets is {@code r || s || v}; see
 * {@link #toBytes()} and {@link #fromBytes(byte[])}.
 *
 * @param r first 32 bytes of signature
 * @param s second 32 bytes of signature
 * @param v recovery id
 * @since 0.1.0
 */
public record Signature(byte[] r, byte[] s, int v) {

    /** Length of the compact {@code r || s || v} encoding. */
    public static final int COMPACT_LENGTH = 65;

    /**
     * Maximum bytes to display in full hex in toString().
     * Beyond this, just show the byte count to keep logs readable.
     */
    private static final int MAX_BYTES_TO_DISPLAY = 8;

    public Signature {
        Objects.requireNonNull(r, "r cannot be null");
        Objects.requireNonNull(s, "s cannot be null");

        if (r.length != 32) {
            throw new IllegalArgumentException("r must be 32 bytes, got " + r.length);
        }
        if (s.length != 32) {
            throw new IllegalArgumentException("s must be 32 bytes, got " + s.length);
        }

        r = Arrays.copyOf(r, 32);
        s = Arrays.copyOf(s, 32);
    }

    /**
     * Returns the r component of the signature.
     * <p>
     * Returns a copy.
     *
     * @return a copy of the r bytes (32 bytes)
     */
    @Override
    public byte[] r() {
        return Arrays.copyOf(r, r.length);
    }

    /**
     * Returns the s component of the signature.
     * <p>
     * Returns a copy.
     *
     * @return a copy of the s bytes (32 bytes)
     */
    @Override
    public byte[] s() {
        return Arrays.copyOf(s, s.length);
    }

    /**
     * Encodes this signature in the compact {@code r || s || v} form.
     *
     * @return 65 bytes
     * @throws IllegalStateException if {@code v} does not fit in one byte
     */
    public byte[] toBytes() {
        if (v < 0 || v > 0xFF) {
            throw new IllegalStateException("v does not fit in a single byte: " + v);
        }
        final byte[] out = new byte[COMPACT_LENGTH];
        System.arraycopy(r, 0, out, 0, 32);
        System.arraycopy(s, 0, out, 32, 32);
        out[64] = (byte) v;
        return out;
    }

    /**
     * Decodes a compact {@code r || s || v} signature.
     *
     * @param bytes 65 bytes
     * @return the signature
     * @throws IllegalArgumentException if {@code bytes} is not 65 bytes long
     */
    public static Signature fromBytes(final byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        if (bytes.length != COMPACT_LENGTH) {
            throw new IllegalArgumentException(
                    "compact signature must be " + COMPACT_LENGTH + " bytes, got " + bytes.length);
        }
        return new Signature(
                Arrays.copyOfRange(bytes, 0, 32),
                Arrays.copyOfRange(bytes, 32, 64),
                bytes[64] & 0xFF);
    }

    /**
     * Decodes a hex-encoded compact signature.
     *
     * @param hex 130 hex digits, with or without {@code 0x}
     * @return the signature
     */
    public static Signature fromHex(final String hex) {
        return fromBytes(Hex.decode(hex));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Signature other))
            return false;
        return Arrays.equals(r, other.r) && Arrays.equals(s, other.s) && v == other.v;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(r), Arrays.hashCode(s), v);
    }

    @Override
    public String toString() {
        return "Signature[r=" + bytesToHex(r) + ", s=" + bytesToHex(s) + ", v=" + v + "]";
    }

    private static String bytesToHex(byte[] bytes) {
        if (bytes.length > MAX_BYTES_TO_DISPLAY) {
            return bytes.length + " bytes";
        }
        return Hex.encodeNoPrefix(bytes);
    }
}
