// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.types;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.Set;

import org.junit.jupiter.api.Test;

class NonceTest {

    @Test
    void fromBytesRequiresThirtyTwoBytes() {
        var ex = assertThrows(IllegalArgumentException.class, () -> Nonce.fromBytes(new byte[31]));
        assertEquals("nonce must be 32 bytes, got 31", ex.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Nonce.fromBytes(null));
    }

    @Test
    void valueEqualityMakesNoncesUsableAsKeys() {
        byte[] bytes = new byte[32];
        bytes[31] = 7;
        Set<Nonce> set = new HashSet<>();
        set.add(Nonce.fromBytes(bytes));
        assertTrue(set.contains(new Nonce("0x0000000000000000000000000000000000000000000000000000000000000007")));
    }

    @Test
    void randomNoncesDiffer() {
        assertNotEquals(Nonce.random(), Nonce.random());
        assertEquals(32, Nonce.random().toBytes().length);
    }

    @Test
    void toBytesReturnsFreshCopy() {
        Nonce nonce = Nonce.random();
        byte[] bytes = nonce.toBytes();
        bytes[0] ^= 0x01;
        assertNotEquals(Nonce.fromBytes(bytes), nonce);
    }
}
