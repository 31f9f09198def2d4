// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.token;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Nonce;
import sh.warrant.token.event.TokenEvent;
import sh.warrant.token.registry.InMemoryNonceRegistry;
import sh.warrant.token.registry.NonceRegistry;

@ExtendWith(MockitoExtension.class)
class AuthorizationTransactionTest {

    private static final Address ALICE = new Address("0xaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa");
    private static final Address BOB = new Address("0xbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbbb");

    @Mock
    private NonceRegistry registry;

    @Test
    void commitMarksNonceAndReturnsEventsInOrder() {
        var nonces = new InMemoryNonceRegistry();
        Nonce nonce = Nonce.random();
        var tx = new AuthorizationTransaction(nonces, ALICE, nonce);
        var used = new TokenEvent.AuthorizationUsed(ALICE, nonce);
        var transfer = new TokenEvent.Transfer(ALICE, BOB, BigInteger.TEN);
        tx.emit(used);
        tx.emit(transfer);

        assertFalse(nonces.isUsed(ALICE, nonce));
        assertEquals(List.of(used, transfer), tx.commit());
        assertTrue(nonces.isUsed(ALICE, nonce));
        assertTrue(tx.isCommitted());
    }

    @Test
    void rollbackRunsUndoLogInReverseWithoutTouchingRegistry() {
        var tx = new AuthorizationTransaction(registry, ALICE, Nonce.random());
        List<String> undone = new ArrayList<>();
        tx.onRollback(() -> undone.add("first"));
        tx.onRollback(() -> undone.add("second"));

        tx.rollback();
        tx.rollback();

        assertEquals(List.of("second", "first"), undone);
        assertTrue(tx.isRolledBack());
        verifyNoInteractions(registry);
    }

    @Test
    void failedCompareAndCommitRollsBack() {
        Nonce nonce = Nonce.random();
        when(registry.markUsed(ALICE, nonce)).thenReturn(false);
        var tx = new AuthorizationTransaction(registry, ALICE, nonce);
        Runnable undo = mock(Runnable.class);
        tx.emit(new TokenEvent.AuthorizationUsed(ALICE, nonce));
        tx.onRollback(undo);

        var ex = assertThrows(AuthorizationException.class, tx::commit);

        assertEquals(AuthorizationException.Reason.AUTHORIZATION_ALREADY_USED, ex.reason());
        verify(undo).run();
        assertTrue(tx.isRolledBack());
    }

    @Test
    void finishedTransactionRejectsFurtherWork() {
        var tx = new AuthorizationTransaction(new InMemoryNonceRegistry(), ALICE, Nonce.random());
        tx.commit();

        assertThrows(IllegalStateException.class, () -> tx.emit(new TokenEvent.Transfer(ALICE, BOB, BigInteger.ONE)));
        assertThrows(IllegalStateException.class, () -> tx.onRollback(() -> { }));
        assertThrows(IllegalStateException.class, tx::commit);
    }
}
