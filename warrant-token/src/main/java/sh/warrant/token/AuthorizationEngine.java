// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.warrant.core.LogFormatter;
import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.SignatureVerifier;
import sh.warrant.core.crypto.eip3009.CancelAuthorization;
import sh.warrant.core.crypto.eip3009.ReceiveAuthorization;
import sh.warrant.core.crypto.eip3009.TransferAuthorization;
import sh.warrant.core.crypto.eip712.Eip712;
import sh.warrant.core.crypto.eip712.Eip712Domain;
import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.error.LedgerException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;
import sh.warrant.token.event.TokenEvent;
import sh.warrant.token.event.TokenEventListener;
import sh.warrant.token.ledger.Ledger;
import sh.warrant.token.registry.InMemoryNonceRegistry;
import sh.warrant.token.registry.NonceRegistry;

/**
 * Verifies EIP-3009 authorizations and applies them to a {@link Ledger}.
 *
 * <p>
 * Each operation runs in this order and stops at the first failure:
 * <ol>
 * <li>the {@code (authorizer, nonce)} pair must be unused</li>
 * <li>current time must be at or after {@code validAfter}</li>
 * <li>current time must be before {@code validBefore}</li>
 * <li>for receive, the caller must be the payee</li>
 * <li>the signature over the recomputed digest must recover to the authorizer</li>
 * </ol>
 * Cancellation performs only steps 1 and 5.
 *
 * <p>
 * Each operation type hashes its fields under its own type hash, so a signature made
 * for one type never verifies as another and fails step 5 as an invalid signature.
 *
 * <h2>Atomicity</h2>
 * <p>
 * Operations hold a write lock from the first check to the last notification, so no
 * other operation or query interleaves. The nonce write is staged in an
 * {@link AuthorizationTransaction} while the ledger transfer runs. If the ledger
 * throws, the transaction rolls back: the nonce stays unused and no notification is
 * published. Queries hold the read lock.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * AuthorizationEngine engine = AuthorizationEngine.builder()
 *     .domain(domain)
 *     .ledger(ledger)
 *     .listener(event -> log.info("{}", event))
 *     .build();
 *
 * engine.transferWithAuthorization(auth, signature);
 * }</pre>
 *
 * @since 0.1.0
 */
public final class AuthorizationEngine {

    private static final Logger log = LoggerFactory.getLogger(AuthorizationEngine.class);

    /** Type hash of {@code TransferWithAuthorization}. */
    public static final Hash TRANSFER_WITH_AUTHORIZATION_TYPEHASH = TransferAuthorization.TYPEHASH;

    /** Type hash of {@code ReceiveWithAuthorization}. */
    public static final Hash RECEIVE_WITH_AUTHORIZATION_TYPEHASH = ReceiveAuthorization.TYPEHASH;

    /** Type hash of {@code CancelAuthorization}. */
    public static final Hash CANCEL_AUTHORIZATION_TYPEHASH = CancelAuthorization.TYPEHASH;

    private static final String TRANSFER_OP = "TRANSFER-AUTH";
    private static final String RECEIVE_OP = "RECEIVE-AUTH";
    private static final String CANCEL_OP = "CANCEL-AUTH";

    private final Eip712Domain domain;
    private final Hash domainSeparator;
    private final Ledger ledger;
    private final NonceRegistry registry;
    private final Clock clock;
    private final List<TokenEventListener> listeners;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private AuthorizationEngine(final Builder builder) {
        this.domain = Objects.requireNonNull(builder.domain, "domain");
        this.ledger = Objects.requireNonNull(builder.ledger, "ledger");
        this.registry = builder.registry != null ? builder.registry : new InMemoryNonceRegistry();
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.listeners = List.copyOf(builder.listeners);
        this.domainSeparator = domain.separator();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ═══════════════════════════════════════════════════════════════
    // Operations
    // ═══════════════════════════════════════════════════════════════

    /**
     * Executes a transfer authorized by {@code auth.from()}. Callable by anyone.
     *
     * @param auth      the signed message fields
     * @param signature the payer's signature over them
     * @throws AuthorizationException if the authorization is rejected
     * @throws LedgerException if the ledger refuses the transfer; the nonce stays unused
     */
    public void transferWithAuthorization(final TransferAuthorization auth, final Signature signature) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(signature, "signature");
        lock.writeLock().lock();
        try {
            requireUnused(TRANSFER_OP, auth.from(), auth.nonce());
            requireWithinWindow(TRANSFER_OP, auth.from(), auth.nonce(), auth.validAfter(), auth.validBefore());
            requireSigner(TRANSFER_OP, auth.structHash(), signature, auth.from(), auth.nonce());
            applyTransfer(TRANSFER_OP, auth.from(), auth.to(), auth.value(), auth.nonce());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Executes a receive authorized by {@code auth.from()}. Only the payee may call this.
     *
     * @param caller    the identity submitting the authorization
     * @param auth      the signed message fields
     * @param signature the payer's signature over them
     * @throws AuthorizationException if the authorization is rejected or {@code caller} is not {@code auth.to()}
     * @throws LedgerException if the ledger refuses the transfer; the nonce stays unused
     */
    public void receiveWithAuthorization(
            final Address caller, final ReceiveAuthorization auth, final Signature signature) {
        Objects.requireNonNull(caller, "caller");
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(signature, "signature");
        lock.writeLock().lock();
        try {
            requireUnused(RECEIVE_OP, auth.from(), auth.nonce());
            requireWithinWindow(RECEIVE_OP, auth.from(), auth.nonce(), auth.validAfter(), auth.validBefore());
            if (!caller.equals(auth.to())) {
                throw reject(RECEIVE_OP, auth.from(), auth.nonce(),
                        AuthorizationException.callerNotPayee(caller, auth.to()));
            }
            requireSigner(RECEIVE_OP, auth.structHash(), signature, auth.from(), auth.nonce());
            applyTransfer(RECEIVE_OP, auth.from(), auth.to(), auth.value(), auth.nonce());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Cancels an unused authorization. Callable by anyone holding the authorizer's cancel signature.
     *
     * @param auth      the signed cancel fields
     * @param signature the authorizer's signature over them
     * @throws AuthorizationException if the nonce is already used or the signature is invalid
     */
    public void cancelAuthorization(final CancelAuthorization auth, final Signature signature) {
        Objects.requireNonNull(auth, "auth");
        Objects.requireNonNull(signature, "signature");
        lock.writeLock().lock();
        try {
            requireUnused(CANCEL_OP, auth.authorizer(), auth.nonce());
            requireSigner(CANCEL_OP, auth.structHash(), signature, auth.authorizer(), auth.nonce());

            final AuthorizationTransaction tx = new AuthorizationTransaction(registry, auth.authorizer(), auth.nonce());
            tx.emit(new TokenEvent.AuthorizationCanceled(auth.authorizer(), auth.nonce()));
            final List<TokenEvent> events = tx.commit();
            log.debug(LogFormatter.formatAccepted(CANCEL_OP, auth.authorizer().value(), auth.nonce().value(), null));
            publish(events);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves the caller's own balance, without any authorization.
     *
     * @param caller the account being debited
     * @param to     the account being credited
     * @param amount the amount
     * @return the applied transfer
     * @throws LedgerException if the ledger refuses the transfer
     */
    public TokenEvent.Transfer transfer(final Address caller, final Address to, final BigInteger amount) {
        lock.writeLock().lock();
        try {
            final TokenEvent.Transfer transfer = ledger.transfer(caller, to, amount);
            publish(List.of(transfer));
            return transfer;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Queries
    // ═══════════════════════════════════════════════════════════════

    /**
     * Returns whether {@code (authorizer, nonce)} has been used or canceled.
     *
     * @param authorizer the signer
     * @param nonce      the nonce
     * @return {@code true} once consumed, forever after
     */
    public boolean authorizationState(final Address authorizer, final Nonce nonce) {
        lock.readLock().lock();
        try {
            return registry.isUsed(authorizer, nonce);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns a balance, consistent with every committed operation.
     *
     * @param account the account
     * @return the balance
     */
    public BigInteger balanceOf(final Address account) {
        lock.readLock().lock();
        try {
            return ledger.balanceOf(account);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Returns the domain separator fixed when this engine was built.
     *
     * @return the domain separator
     */
    public Hash domainSeparator() {
        return domainSeparator;
    }

    public Eip712Domain domain() {
        return domain;
    }

    // ═══════════════════════════════════════════════════════════════
    // Internals
    // ═══════════════════════════════════════════════════════════════

    private void requireUnused(final String op, final Address authorizer, final Nonce nonce) {
        if (registry.isUsed(authorizer, nonce)) {
            throw reject(op, authorizer, nonce, AuthorizationException.alreadyUsed(authorizer, nonce));
        }
    }

    private void requireWithinWindow(
            final String op, final Address authorizer, final Nonce nonce,
            final BigInteger validAfter, final BigInteger validBefore) {
        final BigInteger now = BigInteger.valueOf(clock.instant().getEpochSecond());
        if (now.compareTo(validAfter) < 0) {
            throw reject(op, authorizer, nonce, AuthorizationException.notYetValid());
        }
        if (now.compareTo(validBefore) >= 0) {
            throw reject(op, authorizer, nonce, AuthorizationException.expired());
        }
    }

    private void requireSigner(
            final String op, final Hash structHash, final Signature signature,
            final Address authorizer, final Nonce nonce) {
        try {
            SignatureVerifier.verify(Eip712.digest(domainSeparator, structHash), signature, authorizer);
        } catch (AuthorizationException e) {
            throw reject(op, authorizer, nonce, e);
        }
    }

    private void applyTransfer(
            final String op, final Address from, final Address to, final BigInteger value, final Nonce nonce) {
        final AuthorizationTransaction tx = new AuthorizationTransaction(registry, from, nonce);
        tx.emit(new TokenEvent.AuthorizationUsed(from, nonce));
        try {
            tx.emit(ledger.transfer(from, to, value));
            tx.onRollback(() -> ledger.transfer(to, from, value));
        } catch (RuntimeException e) {
            tx.rollback();
            log.info(LogFormatter.formatRollback(op, from.value(), nonce.value(), e.getMessage()));
            throw e;
        }
        final List<TokenEvent> events;
        try {
            events = tx.commit();
        } catch (AuthorizationException e) {
            log.info(LogFormatter.formatRollback(op, from.value(), nonce.value(), e.getMessage()));
            throw e;
        }
        log.debug(LogFormatter.formatAccepted(op, from.value(), nonce.value(), value));
        publish(events);
    }

    private static AuthorizationException reject(
            final String op, final Address authorizer, final Nonce nonce, final AuthorizationException e) {
        log.debug(LogFormatter.formatRejected(op, authorizer.value(), nonce.value(), e.reason().description()));
        return e;
    }

    private void publish(final List<TokenEvent> events) {
        for (TokenEvent event : events) {
            for (TokenEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (RuntimeException e) {
                    log.warn("Token event listener {} failed on {}", listener, event, e);
                }
            }
        }
    }

    /**
     * Builder for {@link AuthorizationEngine}.
     */
    public static final class Builder {
        private @Nullable Eip712Domain domain;
        private @Nullable Ledger ledger;
        private @Nullable NonceRegistry registry;
        private @Nullable Clock clock;
        private final List<TokenEventListener> listeners = new ArrayList<>();

        Builder() {}

        /**
         * Sets the signing domain. Required.
         *
         * @param domain the token's EIP-712 domain
         * @return this builder
         */
        public Builder domain(Eip712Domain domain) {
            this.domain = domain;
            return this;
        }

        /**
         * Sets the ledger that authorized transfers are applied to. Required.
         *
         * @param ledger the ledger
         * @return this builder
         */
        public Builder ledger(Ledger ledger) {
            this.ledger = ledger;
            return this;
        }

        /**
         * Sets the nonce registry. Defaults to a new {@link InMemoryNonceRegistry}.
         * <p>
         * The registry should be written only by this engine.
         *
         * @param registry the registry
         * @return this builder
         */
        public Builder registry(NonceRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the time source for validity windows. Defaults to {@link Clock#systemUTC()}.
         *
         * @param clock the clock
         * @return this builder
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Adds a listener for committed events.
         *
         * @param listener the listener
         * @return this builder
         */
        public Builder listener(TokenEventListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * Builds the engine and fixes its domain separator.
         *
         * @return the engine
         * @throws NullPointerException if the domain or ledger is missing
         */
        public AuthorizationEngine build() {
            return new AuthorizationEngine(this);
        }
    }
}
