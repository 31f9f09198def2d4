// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import java.math.BigInteger;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

/**
 * Deterministic ECDSA signer for secp256k1.
 * <p>
 * Implements <a href="https://tools.ietf.org/html/rfc6979">RFC 6979</a> nonce
 * derivation and computes the recovery id directly from the nonce point R,
 * so no public key recovery is needed after signing.
 * <p>
 * Signatures are always normalized to low-s (EIP-2). {@link SignatureVerifier}
 * rejects high-s signatures, so every signature produced here verifies.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Thread-safe. BouncyCastle stores the comb multiplier's precomputed tables in
 * a concurrent map on the curve, and each call creates its own
 * {@link HMacDSAKCalculator}.
 */
public final class FastSigner {

    private static final FixedPointCombMultiplier MULTIPLIER = new FixedPointCombMultiplier();

    private FastSigner() {
    }

    /**
     * Signs a 32-byte hash.
     *
     * @param messageHash 32-byte hash
     * @param privateKey  private scalar in {@code [1, n)}
     * @return signature with v = 0 or 1 (y parity of R after low-s normalization)
     */
    public static Signature sign(final byte[] messageHash, final BigInteger privateKey) {
        final HMacDSAKCalculator kCalculator = new HMacDSAKCalculator(new SHA256Digest());
        kCalculator.init(Secp256k1.N, privateKey, messageHash);

        final BigInteger z = new BigInteger(1, messageHash);

        while (true) {
            final BigInteger k = kCalculator.nextK();
            final ECPoint p = MULTIPLIER.multiply(Secp256k1.CURVE.getG(), k).normalize();

            // r = x1 mod n
            final BigInteger r = p.getAffineXCoord().toBigInteger().mod(Secp256k1.N);
            if (r.signum() == 0) {
                continue;
            }

            // s = k^-1 * (z + r * d) mod n
            BigInteger s = k.modInverse(Secp256k1.N).multiply(z.add(r.multiply(privateKey))).mod(Secp256k1.N);
            if (s.signum() == 0) {
                continue;
            }

            int v = p.getAffineYCoord().toBigInteger().testBit(0) ? 1 : 0;

            // Low-s: (r, n - s) corresponds to -R, whose y has the opposite parity.
            if (s.compareTo(Secp256k1.HALF_N) > 0) {
                s = Secp256k1.N.subtract(s);
                v ^= 1;
            }

            return new Signature(Secp256k1.toBytes32(r), Secp256k1.toBytes32(s), v);
        }
    }
}
