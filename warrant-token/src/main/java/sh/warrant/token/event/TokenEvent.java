// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.event;

import java.math.BigInteger;
import java.util.Objects;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;

/**
 * Notification published after a token operation commits.
 * <p>
 * An authorized transfer publishes {@link AuthorizationUsed} followed by
 * {@link Transfer}; a cancellation publishes a single {@link AuthorizationCanceled}.
 * Rolled-back operations publish nothing.
 *
 * @since 0.1.0
 */
public sealed interface TokenEvent permits
        TokenEvent.AuthorizationUsed,
        TokenEvent.AuthorizationCanceled,
        TokenEvent.Transfer {

    /**
     * An authorization nonce was consumed by a transfer or receive.
     *
     * @param authorizer the signer
     * @param nonce      the consumed nonce
     */
    record AuthorizationUsed(Address authorizer, Nonce nonce) implements TokenEvent {
        public AuthorizationUsed {
            Objects.requireNonNull(authorizer, "authorizer");
            Objects.requireNonNull(nonce, "nonce");
        }
    }

    /**
     * An authorization nonce was consumed by a cancellation.
     *
     * @param authorizer the signer
     * @param nonce      the canceled nonce
     */
    record AuthorizationCanceled(Address authorizer, Nonce nonce) implements TokenEvent {
        public AuthorizationCanceled {
            Objects.requireNonNull(authorizer, "authorizer");
            Objects.requireNonNull(nonce, "nonce");
        }
    }

    /**
     * Balance moved between two accounts.
     *
     * @param from  the debited account
     * @param to    the credited account
     * @param value the amount moved
     */
    record Transfer(Address from, Address to, BigInteger value) implements TokenEvent {
        public Transfer {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(to, "to");
            Objects.requireNonNull(value, "value");
        }
    }
}
