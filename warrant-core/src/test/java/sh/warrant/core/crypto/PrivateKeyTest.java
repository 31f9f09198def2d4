// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.warrant.core.types.Address;

class PrivateKeyTest {

    // Anvil's first two default keys
    private static final String KEY_0 = "0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80";
    private static final Address ADDRESS_0 = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
    private static final String KEY_1 = "0x59c6995e998f97a5a0044966f0945389dc9e86dae88c7a8412f4603b6b78690d";
    private static final Address ADDRESS_1 = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");

    private static final byte[] DIGEST = Keccak256.hash("warrant".getBytes(StandardCharsets.UTF_8));

    @Test
    void derivesKnownAddresses() {
        assertEquals(ADDRESS_0, PrivateKey.fromHex(KEY_0).toAddress());
        assertEquals(ADDRESS_1, PrivateKey.fromHex(KEY_1).toAddress());
    }

    @Test
    void signThenRecoverYieldsSigner() {
        var key = PrivateKey.fromHex(KEY_0);
        Signature sig = key.sign(DIGEST);

        assertTrue(sig.v() == 0 || sig.v() == 1);
        assertEquals(ADDRESS_0, PrivateKey.recoverAddress(DIGEST, sig));
    }

    @Test
    void signingIsDeterministicAndLowS() {
        var key = PrivateKey.fromHex(KEY_1);
        Signature first = key.sign(DIGEST);
        Signature second = key.sign(DIGEST);

        assertEquals(first, second);
        assertTrue(new BigInteger(1, first.s()).compareTo(Secp256k1.HALF_N) <= 0);
    }

    @Test
    void recoverAcceptsTypedDataV() {
        var key = PrivateKey.fromHex(KEY_0);
        Signature raw = key.sign(DIGEST);
        Signature typed = new Signature(raw.r(), raw.s(), raw.v() + 27);
        assertEquals(ADDRESS_0, PrivateKey.recoverAddress(DIGEST, typed));
    }

    @Test
    void recoverRejectsUnknownV() {
        Signature raw = PrivateKey.fromHex(KEY_0).sign(DIGEST);
        assertThrows(IllegalArgumentException.class,
            () -> PrivateKey.recoverAddress(DIGEST, new Signature(raw.r(), raw.s(), 35)));
    }

    @Test
    void rejectsOutOfRangeKeys() {
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromBytes(new byte[32]));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromBytes(Secp256k1.toBytes32(Secp256k1.N)));
        assertThrows(IllegalArgumentException.class, () -> PrivateKey.fromHex("0x1234"));
    }

    @Test
    void fromBytesZeroesInput() {
        byte[] bytes = sh.warrant.primitives.Hex.decode(KEY_0);
        PrivateKey.fromBytes(bytes);
        assertArrayEquals(new byte[32], bytes);
    }

    @Test
    void destroyedKeyRefusesToSign() {
        var key = PrivateKey.fromHex(KEY_0);
        key.destroy();

        assertTrue(key.isDestroyed());
        assertThrows(IllegalStateException.class, () -> key.sign(DIGEST));
        assertThrows(IllegalStateException.class, key::toAddress);
        assertEquals("PrivateKey[destroyed]", key.toString());
    }

    @Test
    void toStringShowsAddressOnly() {
        String text = PrivateKey.fromHex(KEY_0).toString();
        assertTrue(text.contains(ADDRESS_0.value()));
        assertFalse(text.contains("ac0974bec39a17e3"));
    }
}
