// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;

/**
 * Defines a signer capable of signing typed-data digests and providing its address.
 * <p>
 * This interface lets authorization helpers work with local private keys as well
 * as external key stores or hardware wallets.
 */
public interface Signer {

    /**
     * Returns the address associated with this signer.
     *
     * @return the account address
     */
    Address address();

    /**
     * Signs a 32-byte EIP-712 digest.
     * <p>
     * The digest is signed directly, without any EIP-191 message prefix. The
     * returned signature must carry a {@code v} value of 27 or 28.
     *
     * @param digest the typed-data digest to sign
     * @return the signature
     */
    Signature signDigest(Hash digest);
}
