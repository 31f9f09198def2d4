// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import sh.warrant.core.crypto.Keccak256;
import sh.warrant.core.error.Eip712Exception;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;

/**
 * Raw EIP-712 hashing functions.
 * <p>
 * These take only bytes, integers and value types, so the three hashing steps can
 * be golden-tested on their own and reused by code that already holds the fields
 * of a message:
 * <ul>
 * <li>{@link #domainSeparator} binds signatures to one token instance</li>
 * <li>{@link #hashStruct} hashes a type hash followed by 32-byte field words</li>
 * <li>{@link #digest} produces {@code keccak256(0x19 0x01 || domainSeparator || structHash)}</li>
 * </ul>
 *
 * <pre>{@code
 * Hash structHash = Eip712.hashStruct(CANCEL_TYPEHASH, Eip712.word(authorizer), Eip712.word(nonce));
 * Hash digest = Eip712.digest(domainSeparator, structHash);
 * }</pre>
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 * @since 0.1.0
 */
public final class Eip712 {

    /** Canonical domain type used by token domains. */
    public static final String DOMAIN_TYPE =
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)";

    /** {@code keccak256(DOMAIN_TYPE)}. */
    public static final Hash DOMAIN_TYPEHASH = typeHash(DOMAIN_TYPE);

    /** Width of one encoded field. */
    public static final int WORD_SIZE = 32;

    private static final byte[] DIGEST_PREFIX = new byte[] { 0x19, 0x01 };
    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

    private Eip712() {
    }

    // ═══════════════════════════════════════════════════════════════
    // HASHING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Hashes a canonical type string, e.g.
     * {@code "CancelAuthorization(address authorizer,bytes32 nonce)"}.
     *
     * @param encodedType the type string
     * @return its Keccak-256 hash
     */
    public static Hash typeHash(final String encodedType) {
        Objects.requireNonNull(encodedType, "encodedType");
        return Hash.fromBytes(Keccak256.hash(encodedType.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Computes the domain separator for the four-field token domain.
     *
     * @param name              the token name
     * @param version           the signing domain version
     * @param chainId           the chain identifier
     * @param verifyingContract the token instance address
     * @return the domain separator
     */
    public static Hash domainSeparator(
            final String name, final String version, final BigInteger chainId, final Address verifyingContract) {
        return hashStruct(DOMAIN_TYPEHASH,
                word(name),
                word(version),
                word(chainId),
                word(verifyingContract));
    }

    /**
     * hashStruct = keccak256(typeHash || word1 || word2 || ...)
     *
     * @param typeHash the struct's type hash
     * @param words    encoded fields in declaration order, 32 bytes each
     * @return the struct hash
     * @throws IllegalArgumentException if any word is not 32 bytes
     */
    public static Hash hashStruct(final Hash typeHash, final byte[]... words) {
        Objects.requireNonNull(typeHash, "typeHash");
        Objects.requireNonNull(words, "words");
        final ByteArrayOutputStream encoded = new ByteArrayOutputStream(WORD_SIZE * (words.length + 1));
        encoded.writeBytes(typeHash.toBytes());
        for (byte[] word : words) {
            Objects.requireNonNull(word, "word");
            if (word.length != WORD_SIZE) {
                throw new IllegalArgumentException("encoded field must be 32 bytes, got " + word.length);
            }
            encoded.writeBytes(word);
        }
        return Hash.fromBytes(Keccak256.hash(encoded.toByteArray()));
    }

    /**
     * digest = keccak256(0x19 0x01 || domainSeparator || structHash)
     *
     * @param domainSeparator the domain separator
     * @param structHash      the message struct hash
     * @return the signing digest
     */
    public static Hash digest(final Hash domainSeparator, final Hash structHash) {
        Objects.requireNonNull(domainSeparator, "domainSeparator");
        Objects.requireNonNull(structHash, "structHash");
        return Hash.fromBytes(Keccak256.hash(DIGEST_PREFIX, domainSeparator.toBytes(), structHash.toBytes()));
    }

    // ═══════════════════════════════════════════════════════════════
    // FIELD WORDS
    // ═══════════════════════════════════════════════════════════════

    /**
     * address: 20 bytes left-padded to 32.
     */
    public static byte[] word(final Address address) {
        Objects.requireNonNull(address, "address");
        return padLeft(address.toBytes());
    }

    /**
     * uint256: big-endian, left-padded to 32 bytes.
     *
     * @throws Eip712Exception if the value is negative or does not fit in 256 bits
     */
    public static byte[] word(final BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.signum() < 0) {
            throw Eip712Exception.invalidValue("uint256", "cannot be negative: " + value);
        }
        if (value.compareTo(UINT256_LIMIT) >= 0) {
            throw Eip712Exception.valueOutOfRange("uint256", value, "exceeds 256 bits");
        }
        return padLeft(unsigned(value));
    }

    /**
     * bytes32 nonce: used verbatim.
     */
    public static byte[] word(final Nonce nonce) {
        Objects.requireNonNull(nonce, "nonce");
        return nonce.toBytes();
    }

    /**
     * bytes32 hash: used verbatim.
     */
    public static byte[] word(final Hash hash) {
        Objects.requireNonNull(hash, "hash");
        return hash.toBytes();
    }

    /**
     * string: keccak256 of the UTF-8 bytes.
     */
    public static byte[] word(final String value) {
        Objects.requireNonNull(value, "value");
        return Keccak256.hash(value.getBytes(StandardCharsets.UTF_8));
    }

    static byte[] padLeft(final byte[] bytes) {
        if (bytes.length >= WORD_SIZE) {
            return bytes;
        }
        final byte[] result = new byte[WORD_SIZE];
        System.arraycopy(bytes, 0, result, WORD_SIZE - bytes.length, bytes.length);
        return result;
    }

    static byte[] padRight(final byte[] bytes) {
        if (bytes.length >= WORD_SIZE) {
            return bytes;
        }
        final byte[] result = new byte[WORD_SIZE];
        System.arraycopy(bytes, 0, result, 0, bytes.length);
        return result;
    }

    /**
     * Drops BigInteger's leading sign byte.
     */
    static byte[] unsigned(final BigInteger value) {
        final byte[] bytes = value.toByteArray();
        if (bytes.length > 1 && bytes[0] == 0) {
            final byte[] trimmed = new byte[bytes.length - 1];
            System.arraycopy(bytes, 1, trimmed, 0, trimmed.length);
            return trimmed;
        }
        return bytes;
    }
}
