// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.ledger;

import java.math.BigInteger;

import sh.warrant.core.error.LedgerException;
import sh.warrant.core.types.Address;

/**
 * Thrown when a transfer exceeds the sender's balance.
 *
 * @since 0.1.0
 */
public final class InsufficientBalanceException extends LedgerException {

    private final Address account;
    private final BigInteger balance;
    private final BigInteger requested;

    public InsufficientBalanceException(final Address account, final BigInteger balance, final BigInteger requested) {
        super("transfer amount exceeds balance (account=%s, balance=%s, requested=%s)"
                .formatted(account.value(), balance, requested));
        this.account = account;
        this.balance = balance;
        this.requested = requested;
    }

    public Address account() {
        return account;
    }

    public BigInteger balance() {
        return balance;
    }

    public BigInteger requested() {
        return requested;
    }
}
