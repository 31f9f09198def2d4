// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import java.math.BigInteger;
import java.util.Objects;

import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;

/**
 * Strict signer recovery for typed-data signatures.
 * <p>
 * Unlike {@link PrivateKey#recoverAddress(byte[], Signature)}, which accepts any
 * recoverable signature, this verifier only accepts the canonical form:
 * <ul>
 * <li>{@code v} is 27 or 28</li>
 * <li>{@code 0 < r < n} and {@code 0 < s <= n/2} (low-s, EIP-2)</li>
 * </ul>
 * Every failure surfaces as {@link AuthorizationException} with reason
 * {@link AuthorizationException.Reason#INVALID_SIGNATURE}.
 * <p>
 * Stateless and thread-safe.
 *
 * @since 0.1.0
 */
public final class SignatureVerifier {

    private SignatureVerifier() {
    }

    /**
     * Recovers the address that signed {@code digest}.
     *
     * @param digest    the typed-data digest
     * @param signature the signature to check
     * @return the recovered signer, never {@link Address#ZERO}
     * @throws AuthorizationException if the signature is malformed or not recoverable
     */
    public static Address recover(final Hash digest, final Signature signature) {
        Objects.requireNonNull(digest, "digest");
        Objects.requireNonNull(signature, "signature");

        if (signature.v() != 27 && signature.v() != 28) {
            throw AuthorizationException.invalidSignature("v must be 27 or 28, got " + signature.v());
        }
        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());
        if (r.signum() == 0 || r.compareTo(Secp256k1.N) >= 0) {
            throw AuthorizationException.invalidSignature("r out of range");
        }
        if (s.signum() == 0 || s.compareTo(Secp256k1.N) >= 0) {
            throw AuthorizationException.invalidSignature("s out of range");
        }
        if (s.compareTo(Secp256k1.HALF_N) > 0) {
            throw AuthorizationException.invalidSignature("s is not canonical (high-s)");
        }

        try {
            return PrivateKey.recoverAddress(digest.toBytes(), signature);
        } catch (IllegalArgumentException e) {
            throw AuthorizationException.invalidSignature("public key recovery failed", e);
        }
    }

    /**
     * Checks that {@code signature} over {@code digest} was produced by {@code expected}.
     *
     * @param digest    the typed-data digest
     * @param signature the signature to check
     * @param expected  the claimed signer
     * @throws AuthorizationException if the signature is malformed or recovers to another address
     */
    public static void verify(final Hash digest, final Signature signature, final Address expected) {
        Objects.requireNonNull(expected, "expected");
        final Address recovered = recover(digest, signature);
        if (!recovered.equals(expected)) {
            throw AuthorizationException.invalidSignature();
        }
    }
}
