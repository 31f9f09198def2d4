// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.error;

/**
 * Thrown by a balance ledger when it refuses a transfer.
 * <p>
 * A ledger that throws must leave its balances untouched. When the transfer was
 * gated by an authorization, the surrounding operation rolls back and the
 * authorization nonce stays unused.
 * <p>
 * This class is {@code non-sealed} so ledger implementations can
 * report their own failure kinds.
 *
 * @since 0.1.0
 */
public non-sealed class LedgerException extends WarrantException {

    public LedgerException(final String message) {
        super(message);
    }

    public LedgerException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
