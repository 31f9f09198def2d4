// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token.ledger;

import java.math.BigInteger;

import sh.warrant.core.error.LedgerException;
import sh.warrant.core.types.Address;
import sh.warrant.token.event.TokenEvent;

/**
 * Balance bookkeeping collaborator of the authorization engine.
 * <p>
 * The engine calls {@link #transfer} only after an authorization has been fully
 * validated, and treats any exception as a reason to roll the whole operation back.
 *
 * @since 0.1.0
 */
public interface Ledger {

    /**
     * Returns the balance of an account; unknown accounts hold zero.
     *
     * @param account the account
     * @return the balance in smallest units
     */
    BigInteger balanceOf(Address account);

    /**
     * Moves {@code amount} from {@code from} to {@code to}.
     * <p>
     * All-or-nothing: if this method throws, no balance may have changed.
     *
     * @param from   the debited account
     * @param to     the credited account
     * @param amount the amount, non-negative
     * @return the transfer that was applied
     * @throws LedgerException if the ledger refuses the transfer
     */
    TokenEvent.Transfer transfer(Address from, Address to, BigInteger amount);
}
