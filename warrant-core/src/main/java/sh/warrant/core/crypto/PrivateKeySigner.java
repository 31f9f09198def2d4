// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import java.util.Objects;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;

/**
 * Digest signer backed by a raw private key.
 */
public final class PrivateKeySigner implements Signer {

    /** Offset added to the y parity to form a typed-data {@code v} (27 or 28). */
    private static final int TYPED_DATA_V_OFFSET = 27;

    private final PrivateKey privateKey;
    private final Address address;

    /**
     * Creates a signer from a hex-encoded private key.
     *
     * @param privateKeyHex the private key (with or without 0x prefix)
     * @throws IllegalArgumentException if the private key is invalid
     */
    public PrivateKeySigner(final String privateKeyHex) {
        this(PrivateKey.fromHex(privateKeyHex));
    }

    /**
     * Creates a signer around an existing key.
     *
     * @param privateKey the key to sign with
     */
    public PrivateKeySigner(final PrivateKey privateKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.address = privateKey.toAddress();
    }

    @Override
    public Address address() {
        return address;
    }

    @Override
    public Signature signDigest(final Hash digest) {
        Objects.requireNonNull(digest, "digest");
        final Signature raw = privateKey.sign(digest.toBytes());
        return new Signature(raw.r(), raw.s(), raw.v() + TYPED_DATA_V_OFFSET);
    }

    @Override
    public String toString() {
        return "PrivateKeySigner[address=" + address.value() + "]";
    }
}
