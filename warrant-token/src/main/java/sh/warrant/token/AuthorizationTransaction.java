// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;
import sh.warrant.token.event.TokenEvent;
import sh.warrant.token.registry.NonceRegistry;

/**
 * Unit of work pairing one nonce consumption with the effects it gates.
 * <p>
 * The nonce write is staged, never applied, until {@link #commit()}. Effects that
 * already happened (a ledger transfer) register an undo action; buffered events are
 * only handed out by a successful commit.
 * <ul>
 * <li>{@link #rollback()} runs the undo log in reverse and discards staged state.
 * The registry is never touched, so the nonce stays unused.</li>
 * <li>{@link #commit()} consumes the nonce with a compare-and-commit. If another
 * writer consumed it first, the transaction rolls back and reports the nonce as used.</li>
 * </ul>
 * Not thread-safe; one transaction belongs to one operation.
 *
 * @since 0.1.0
 */
final class AuthorizationTransaction {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationTransaction.class);

    private enum State { OPEN, COMMITTED, ROLLED_BACK }

    private final NonceRegistry registry;
    private final Address authorizer;
    private final Nonce nonce;
    private final List<TokenEvent> events = new ArrayList<>();
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private State state = State.OPEN;

    AuthorizationTransaction(final NonceRegistry registry, final Address authorizer, final Nonce nonce) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.authorizer = Objects.requireNonNull(authorizer, "authorizer");
        this.nonce = Objects.requireNonNull(nonce, "nonce");
    }

    /**
     * Buffers an event for publication after commit.
     */
    void emit(final TokenEvent event) {
        requireOpen();
        events.add(Objects.requireNonNull(event, "event"));
    }

    /**
     * Registers the inverse of an effect that has already been applied.
     */
    void onRollback(final Runnable undo) {
        requireOpen();
        undoLog.push(Objects.requireNonNull(undo, "undo"));
    }

    /**
     * Applies the staged nonce write.
     *
     * @return the buffered events, in emission order
     * @throws AuthorizationException if the nonce was consumed by another writer in the meantime
     */
    List<TokenEvent> commit() {
        requireOpen();
        if (!registry.markUsed(authorizer, nonce)) {
            rollback();
            throw AuthorizationException.alreadyUsed(authorizer, nonce);
        }
        state = State.COMMITTED;
        undoLog.clear();
        return List.copyOf(events);
    }

    /**
     * Undoes applied effects and discards the staged nonce write and events.
     * Does nothing if the transaction already finished.
     */
    void rollback() {
        if (state != State.OPEN) {
            return;
        }
        state = State.ROLLED_BACK;
        events.clear();
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        log.trace("rolled back staged consumption of nonce {} for {}", nonce.value(), authorizer.value());
    }

    boolean isCommitted() {
        return state == State.COMMITTED;
    }

    boolean isRolledBack() {
        return state == State.ROLLED_BACK;
    }

    private void requireOpen() {
        if (state != State.OPEN) {
            throw new IllegalStateException("transaction already " + state.name().toLowerCase(Locale.ROOT));
        }
    }
}
