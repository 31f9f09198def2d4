// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.ledger;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.warrant.core.LogFormatter;
import sh.warrant.core.error.LedgerException;
import sh.warrant.core.types.Address;
import sh.warrant.token.event.TokenEvent;

/**
 * Reference {@link Ledger} holding balances in memory.
 * <p>
 * The whole supply is minted to a treasury account at construction; afterwards
 * balances only move, so the sum of all balances always equals {@link #totalSupply()}.
 *
 * <h2>Thread Safety</h2>
 * <p>
 * {@link #transfer} is synchronized so that a debit and its credit are applied
 * together. Reads are lock-free; callers that need a view consistent with
 * authorization state read through {@code AuthorizationEngine}, which serializes
 * reads against operations.
 *
 * @since 0.1.0
 */
public final class InMemoryLedger implements Ledger {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLedger.class);

    private final Map<Address, BigInteger> balances = new ConcurrentHashMap<>();
    private final BigInteger totalSupply;

    /**
     * Creates a ledger whose whole supply belongs to {@code treasury}.
     *
     * @param treasury    the account receiving the initial supply
     * @param totalSupply the supply, non-negative
     * @throws IllegalArgumentException if the supply is negative or the treasury is the zero address
     */
    public InMemoryLedger(final Address treasury, final BigInteger totalSupply) {
        Objects.requireNonNull(treasury, "treasury");
        Objects.requireNonNull(totalSupply, "totalSupply");
        if (treasury.isZero()) {
            throw new IllegalArgumentException("mint to the zero address");
        }
        if (totalSupply.signum() < 0) {
            throw new IllegalArgumentException("totalSupply must be non-negative, got " + totalSupply);
        }
        this.totalSupply = totalSupply;
        if (totalSupply.signum() > 0) {
            balances.put(treasury, totalSupply);
        }
    }

    /**
     * Returns the fixed total supply.
     *
     * @return the supply
     */
    public BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public BigInteger balanceOf(final Address account) {
        Objects.requireNonNull(account, "account");
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized TokenEvent.Transfer transfer(final Address from, final Address to, final BigInteger amount) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(amount, "amount");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must be non-negative, got " + amount);
        }
        if (from.isZero()) {
            throw new LedgerException("transfer from the zero address");
        }
        if (to.isZero()) {
            throw new LedgerException("transfer to the zero address");
        }

        final BigInteger fromBalance = balanceOf(from);
        if (fromBalance.compareTo(amount) < 0) {
            throw new InsufficientBalanceException(from, fromBalance, amount);
        }

        balances.put(from, fromBalance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);

        log.debug(LogFormatter.formatTransfer(from.value(), to.value(), amount));
        return new TokenEvent.Transfer(from, to, amount);
    }
}
