// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.LoggerFactory;

import sh.warrant.core.crypto.PrivateKeySigner;
import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.eip3009.Eip3009;
import sh.warrant.core.crypto.eip3009.TransferAuthorization;
import sh.warrant.core.crypto.eip712.Eip712Domain;
import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.error.LedgerException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;
import sh.warrant.token.event.TokenEvent;
import sh.warrant.token.event.TokenEventListener;
import sh.warrant.token.ledger.Ledger;
import sh.warrant.token.registry.NonceRegistry;

/**
 * Exercises the engine against failing collaborators.
 */
@ExtendWith(MockitoExtension.class)
class AuthorizationRollbackTest {

    private static final PrivateKeySigner ALICE =
        new PrivateKeySigner("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
    private static final Address BOB = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");
    private static final Address CONTRACT = new Address("0x5fbdb2315678afecb367f032d93f642f64180aa3");
    private static final BigInteger VALUE = BigInteger.valueOf(7_000_000);

    @Mock
    private Ledger ledger;

    @Mock
    private NonceRegistry registry;

    @Mock
    private TokenEventListener listener;

    private final Eip712Domain domain = Eip3009.tokenDomain("Token", "1", 1L, CONTRACT);
    private final Logger engineLogger = (Logger) LoggerFactory.getLogger(AuthorizationEngine.class);
    private final ListAppender<ILoggingEvent> appender = new ListAppender<>();
    private AuthorizationEngine engine;

    @BeforeEach
    void setUp() {
        appender.start();
        engineLogger.addAppender(appender);
        engine = AuthorizationEngine.builder()
            .domain(domain)
            .ledger(ledger)
            .registry(registry)
            .clock(Clock.fixed(Instant.ofEpochSecond(1_700_000_000L), ZoneOffset.UTC))
            .listener(listener)
            .build();
    }

    @AfterEach
    void tearDown() {
        engineLogger.detachAppender(appender);
    }

    private TransferAuthorization authorization(Nonce nonce) {
        return Eip3009.transferAuthorization(ALICE.address(), BOB, VALUE, BigInteger.ZERO, Eip3009.NEVER_EXPIRES, nonce);
    }

    @Test
    void ledgerFailureLeavesNonceUnusedAndPublishesNothing() {
        Nonce nonce = Nonce.random();
        var auth = authorization(nonce);
        Signature sig = Eip3009.sign(auth, domain, ALICE);
        when(registry.isUsed(ALICE.address(), nonce)).thenReturn(false);
        when(ledger.transfer(ALICE.address(), BOB, VALUE)).thenThrow(new LedgerException("ledger offline"));

        var ex = assertThrows(LedgerException.class, () -> engine.transferWithAuthorization(auth, sig));

        assertEquals("ledger offline", ex.getMessage());
        verify(registry, never()).markUsed(any(), any());
        verifyNoInteractions(listener);
        assertTrue(appender.list.stream().anyMatch(e ->
            e.getLevel() == Level.INFO && e.getFormattedMessage().contains("[ROLLBACK]")));
    }

    @Test
    void lostCommitRaceUndoesTransfer() {
        Nonce nonce = Nonce.random();
        var auth = authorization(nonce);
        Signature sig = Eip3009.sign(auth, domain, ALICE);
        when(registry.isUsed(ALICE.address(), nonce)).thenReturn(false);
        when(registry.markUsed(ALICE.address(), nonce)).thenReturn(false);
        when(ledger.transfer(any(), any(), any())).thenAnswer(inv ->
            new TokenEvent.Transfer(inv.getArgument(0), inv.getArgument(1), inv.getArgument(2)));

        var ex = assertThrows(AuthorizationException.class, () -> engine.transferWithAuthorization(auth, sig));

        assertEquals(AuthorizationException.Reason.AUTHORIZATION_ALREADY_USED, ex.reason());
        InOrder order = inOrder(ledger, registry);
        order.verify(ledger).transfer(ALICE.address(), BOB, VALUE);
        order.verify(registry).markUsed(ALICE.address(), nonce);
        order.verify(ledger).transfer(BOB, ALICE.address(), VALUE);
        verifyNoInteractions(listener);
    }

    @Test
    void usedNonceNeverReachesLedger() {
        Nonce nonce = Nonce.random();
        var auth = authorization(nonce);
        when(registry.isUsed(ALICE.address(), nonce)).thenReturn(true);

        assertThrows(AuthorizationException.class,
            () -> engine.transferWithAuthorization(auth, Eip3009.sign(auth, domain, ALICE)));

        verifyNoInteractions(ledger);
        assertTrue(appender.list.stream().anyMatch(e ->
            e.getLevel() == Level.DEBUG && e.getFormattedMessage().contains("reason=authorization is used or canceled")));
    }

    @Test
    void committedTransferPublishesUsedThenTransfer() {
        Nonce nonce = Nonce.random();
        var auth = authorization(nonce);
        var applied = new TokenEvent.Transfer(ALICE.address(), BOB, VALUE);
        when(registry.isUsed(ALICE.address(), nonce)).thenReturn(false);
        when(registry.markUsed(ALICE.address(), nonce)).thenReturn(true);
        when(ledger.transfer(ALICE.address(), BOB, VALUE)).thenReturn(applied);

        engine.transferWithAuthorization(auth, Eip3009.sign(auth, domain, ALICE));

        InOrder order = inOrder(listener);
        order.verify(listener).onEvent(new TokenEvent.AuthorizationUsed(ALICE.address(), nonce));
        order.verify(listener).onEvent(applied);
        order.verifyNoMoreInteractions();
    }

    @Test
    void listenerFailureIsLoggedAtWarn() {
        Nonce nonce = Nonce.random();
        var auth = authorization(nonce);
        when(registry.isUsed(ALICE.address(), nonce)).thenReturn(false);
        when(registry.markUsed(ALICE.address(), nonce)).thenReturn(true);
        when(ledger.transfer(ALICE.address(), BOB, VALUE)).thenReturn(new TokenEvent.Transfer(ALICE.address(), BOB, VALUE));
        doThrow(new IllegalStateException("boom")).when(listener).onEvent(any());

        assertDoesNotThrow(() -> engine.transferWithAuthorization(auth, Eip3009.sign(auth, domain, ALICE)));

        assertEquals(2, appender.list.stream().filter(e -> e.getLevel() == Level.WARN).count());
    }
}
