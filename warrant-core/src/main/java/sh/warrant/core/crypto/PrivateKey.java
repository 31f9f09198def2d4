// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

import javax.security.auth.Destroyable;

import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;

import sh.warrant.core.types.Address;
import sh.warrant.primitives.Hex;

/**
 * secp256k1 private key with signing and public key recovery.
 *
 * <p>
 * This class provides:
 * <ul>
 * <li>Private key loading from hex strings or raw bytes</li>
 * <li>Address derivation from the public key</li>
 * <li>Deterministic ECDSA signing (RFC 6979), low-s normalized</li>
 * <li>Address recovery from a digest and signature</li>
 * </ul>
 *
 * <pre>{@code
 * PrivateKey key = PrivateKey.fromHex("0x...");
 * Signature signature = key.sign(digest);
 * Address recovered = PrivateKey.recoverAddress(digest, signature);
 * assert recovered.equals(key.toAddress());
 * }</pre>
 *
 * <p>
 * Implements {@link Destroyable}: after {@link #destroy()} every operation fails
 * with {@link IllegalStateException}. {@code BigInteger} is immutable, so this
 * drops references rather than zeroing memory.
 *
 * @since 0.1.0
 */
public final class PrivateKey implements Destroyable {

    private static final int PRIVATE_KEY_SIZE = 32;

    private volatile BigInteger privateKeyValue;
    private volatile ECPoint publicKey;
    private volatile boolean destroyed = false;

    private PrivateKey(final byte[] keyBytes) {
        if (keyBytes.length != PRIVATE_KEY_SIZE) {
            throw new IllegalArgumentException("Private key must be " + PRIVATE_KEY_SIZE + " bytes, got " + keyBytes.length);
        }

        try {
            this.privateKeyValue = new BigInteger(1, keyBytes);
            if (privateKeyValue.signum() == 0) {
                throw new IllegalArgumentException("Private key cannot be zero");
            }
            if (privateKeyValue.compareTo(Secp256k1.N) >= 0) {
                throw new IllegalArgumentException("Private key must be less than curve order");
            }
            this.publicKey = new FixedPointCombMultiplier().multiply(Secp256k1.CURVE.getG(), privateKeyValue);
        } finally {
            Arrays.fill(keyBytes, (byte) 0);
        }
    }

    /**
     * Creates a private key from a hex string.
     *
     * @param hexString hex-encoded private key (with or without 0x prefix)
     * @return private key instance
     * @throws IllegalArgumentException if the hex string is invalid or the key is out of range
     */
    public static PrivateKey fromHex(final String hexString) {
        Objects.requireNonNull(hexString, "hex string cannot be null");
        return new PrivateKey(Hex.decode(hexString));
    }

    /**
     * Creates a private key from raw bytes.
     *
     * @apiNote The array is zeroed after the key is read. Pass a copy to keep the original.
     *
     * @param keyBytes 32-byte private key (will be zeroed)
     * @return private key instance
     * @throws IllegalArgumentException if the key bytes are invalid
     */
    public static PrivateKey fromBytes(final byte[] keyBytes) {
        Objects.requireNonNull(keyBytes, "key bytes cannot be null");
        return new PrivateKey(keyBytes);
    }

    /**
     * Derives the account address: the last 20 bytes of
     * {@code keccak256(x || y)} of the uncompressed public key.
     *
     * @return the address
     * @throws IllegalStateException if the key has been destroyed
     */
    public Address toAddress() {
        final ECPoint pubKey;
        synchronized (this) {
            checkNotDestroyed();
            pubKey = publicKey;
        }
        return addressOf(pubKey);
    }

    /**
     * Signs a 32-byte hash using deterministic ECDSA (RFC 6979).
     *
     * @param messageHash 32-byte hash
     * @return signature with v = 0 or 1
     * @throws IllegalArgumentException if the hash is not 32 bytes
     * @throws IllegalStateException if the key has been destroyed
     */
    public Signature sign(final byte[] messageHash) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes, got " + messageHash.length);
        }
        final BigInteger key;
        synchronized (this) {
            checkNotDestroyed();
            key = privateKeyValue;
        }
        return FastSigner.sign(messageHash, key);
    }

    /**
     * Recovers the signer address from a hash and signature.
     * <p>
     * Accepts {@code v} of 0/1 or 27/28. This method does not enforce low-s;
     * use {@link SignatureVerifier} for the strict checks applied to authorizations.
     *
     * @param messageHash 32-byte hash that was signed
     * @param signature   the signature
     * @return recovered address
     * @throws IllegalArgumentException if recovery fails
     */
    public static Address recoverAddress(final byte[] messageHash, final Signature signature) {
        Objects.requireNonNull(messageHash, "message hash cannot be null");
        Objects.requireNonNull(signature, "signature cannot be null");
        if (messageHash.length != 32) {
            throw new IllegalArgumentException("Message hash must be 32 bytes");
        }

        final int recoveryId = switch (signature.v()) {
            case 0, 27 -> 0;
            case 1, 28 -> 1;
            default -> throw new IllegalArgumentException("Invalid recovery id: v=" + signature.v());
        };

        final BigInteger r = new BigInteger(1, signature.r());
        final BigInteger s = new BigInteger(1, signature.s());

        final ECPoint q;
        try {
            q = recoverPublicKey(r, s, messageHash, recoveryId);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Failed to recover public key from signature", e);
        }
        if (q == null) {
            throw new IllegalArgumentException("Failed to recover public key from signature");
        }
        return addressOf(q);
    }

    private static Address addressOf(final ECPoint pubKey) {
        final byte[] encoded = pubKey.getEncoded(false); // 0x04 || x || y
        final byte[] hash = Keccak256.hash(Arrays.copyOfRange(encoded, 1, encoded.length));
        return Address.fromBytes(Arrays.copyOfRange(hash, 12, 32));
    }

    /**
     * Q = r^-1 * (s*R - e*G), where R is the curve point with x = r and the given y parity.
     */
    private static ECPoint recoverPublicKey(
            final BigInteger r,
            final BigInteger s,
            final byte[] messageHash,
            final int recoveryId) {

        if (r.signum() <= 0 || s.signum() <= 0) {
            return null;
        }
        if (r.compareTo(Secp256k1.N) >= 0 || s.compareTo(Secp256k1.N) >= 0) {
            return null;
        }

        final ECPoint bigR = Secp256k1.CURVE.getCurve().decodePoint(encodeCompressed(r, (recoveryId & 1) == 1));
        if (!bigR.isValid() || !bigR.multiply(Secp256k1.N).isInfinity()) {
            return null;
        }

        final BigInteger e = new BigInteger(1, messageHash);
        final BigInteger rInv = r.modInverse(Secp256k1.N);
        final BigInteger srInv = rInv.multiply(s).mod(Secp256k1.N);
        final BigInteger eInv = rInv.multiply(e).mod(Secp256k1.N);

        final ECPoint q = bigR.multiply(srInv).subtract(Secp256k1.CURVE.getG().multiply(eInv)).normalize();
        return q.isInfinity() ? null : q;
    }

    private static byte[] encodeCompressed(final BigInteger x, final boolean yOdd) {
        final byte[] encoded = new byte[33];
        encoded[0] = (byte) (yOdd ? 0x03 : 0x02);
        System.arraycopy(Secp256k1.toBytes32(x), 0, encoded, 1, 32);
        return encoded;
    }

    /**
     * Destroys this key. Subsequent use throws {@link IllegalStateException}.
     */
    @Override
    public void destroy() {
        synchronized (this) {
            destroyed = true;
            privateKeyValue = null;
            publicKey = null;
        }
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    private void checkNotDestroyed() {
        if (destroyed) {
            throw new IllegalStateException("PrivateKey has been destroyed");
        }
    }

    /**
     * Shows the derived address, never the key material.
     */
    @Override
    public String toString() {
        try {
            return "PrivateKey[address=" + toAddress() + "]";
        } catch (IllegalStateException e) {
            return "PrivateKey[destroyed]";
        }
    }
}
