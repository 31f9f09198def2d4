// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.registry;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;

/**
 * Per-signer set of consumed authorization nonces.
 * <p>
 * Keys are {@code (authorizer, nonce)} pairs; the same nonce value under two
 * different authorizers are unrelated entries. Entries are monotonic: once a
 * pair is marked used it is never reported unused again, and nothing is ever removed.
 * <p>
 * Implementations must be thread-safe.
 *
 * @since 0.1.0
 */
public interface NonceRegistry {

    /**
     * Returns whether {@code (authorizer, nonce)} has been used or canceled.
     *
     * @param authorizer the signer
     * @param nonce      the nonce
     * @return {@code true} if consumed
     */
    boolean isUsed(Address authorizer, Nonce nonce);

    /**
     * Marks {@code (authorizer, nonce)} as used, if it is not already.
     * <p>
     * This is a compare-and-commit: of any number of concurrent calls for the same
     * pair, exactly one returns {@code true}.
     *
     * @param authorizer the signer
     * @param nonce      the nonce
     * @return {@code true} if this call consumed the pair, {@code false} if it was already used
     */
    boolean markUsed(Address authorizer, Nonce nonce);
}
