// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.registry;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;

/**
 * {@link NonceRegistry} backed by a concurrent hash set.
 *
 * @since 0.1.0
 */
public final class InMemoryNonceRegistry implements NonceRegistry {

    private record Key(Address authorizer, Nonce nonce) {}

    private final Set<Key> used = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isUsed(final Address authorizer, final Nonce nonce) {
        return used.contains(key(authorizer, nonce));
    }

    @Override
    public boolean markUsed(final Address authorizer, final Nonce nonce) {
        return used.add(key(authorizer, nonce));
    }

    /**
     * Returns the number of consumed pairs.
     *
     * @return the entry count
     */
    public int size() {
        return used.size();
    }

    private static Key key(final Address authorizer, final Nonce nonce) {
        return new Key(
                Objects.requireNonNull(authorizer, "authorizer"),
                Objects.requireNonNull(nonce, "nonce"));
    }
}
