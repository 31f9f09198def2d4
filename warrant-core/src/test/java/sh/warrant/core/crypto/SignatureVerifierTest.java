// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import sh.warrant.core.error.AuthorizationException;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;

class SignatureVerifierTest {

    private static final PrivateKeySigner SIGNER =
        new PrivateKeySigner("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
    private static final Address OTHER = new Address("0x70997970c51812dc3a010c7d01b50e0d17dc79c8");

    private static final Hash DIGEST = Hash.fromBytes(Keccak256.hash("payload".getBytes(StandardCharsets.UTF_8)));

    @Test
    void recoversSignerOfTypedDataSignature() {
        Signature sig = SIGNER.signDigest(DIGEST);
        assertTrue(sig.v() == 27 || sig.v() == 28);
        assertEquals(SIGNER.address(), SignatureVerifier.recover(DIGEST, sig));
        assertDoesNotThrow(() -> SignatureVerifier.verify(DIGEST, sig, SIGNER.address()));
    }

    @Test
    void wrongExpectedSignerIsInvalidSignature() {
        Signature sig = SIGNER.signDigest(DIGEST);
        var ex = assertThrows(AuthorizationException.class, () -> SignatureVerifier.verify(DIGEST, sig, OTHER));
        assertEquals(AuthorizationException.Reason.INVALID_SIGNATURE, ex.reason());
        assertEquals("invalid signature", ex.getMessage());
    }

    @Test
    void differentDigestRecoversSomeoneElse() {
        Signature sig = SIGNER.signDigest(DIGEST);
        Hash other = Hash.fromBytes(Keccak256.hash("other".getBytes(StandardCharsets.UTF_8)));
        assertThrows(AuthorizationException.class, () -> SignatureVerifier.verify(other, sig, SIGNER.address()));
    }

    @Test
    void rawRecoveryIdIsRejected() {
        Signature sig = SIGNER.signDigest(DIGEST);
        Signature raw = new Signature(sig.r(), sig.s(), sig.v() - 27);
        var ex = assertThrows(AuthorizationException.class, () -> SignatureVerifier.recover(DIGEST, raw));
        assertEquals(AuthorizationException.Reason.INVALID_SIGNATURE, ex.reason());
    }

    @Test
    void highSIsRejectedEvenThoughItRecovers() {
        Signature sig = SIGNER.signDigest(DIGEST);
        BigInteger s = new BigInteger(1, sig.s());
        Signature malleated = new Signature(
            sig.r(), Secp256k1.toBytes32(Secp256k1.N.subtract(s)), sig.v() == 27 ? 28 : 27);

        assertEquals(SIGNER.address(), PrivateKey.recoverAddress(DIGEST.toBytes(), malleated));
        var ex = assertThrows(AuthorizationException.class, () -> SignatureVerifier.recover(DIGEST, malleated));
        assertTrue(ex.getMessage().contains("high-s"));
    }

    @Test
    void zeroOrOutOfRangeScalarsAreRejected() {
        Signature sig = SIGNER.signDigest(DIGEST);
        assertThrows(AuthorizationException.class,
            () -> SignatureVerifier.recover(DIGEST, new Signature(new byte[32], sig.s(), sig.v())));
        assertThrows(AuthorizationException.class,
            () -> SignatureVerifier.recover(DIGEST, new Signature(sig.r(), new byte[32], sig.v())));
        assertThrows(AuthorizationException.class,
            () -> SignatureVerifier.recover(DIGEST, new Signature(Secp256k1.toBytes32(Secp256k1.N), sig.s(), sig.v())));
    }

    @Test
    void unrecoverablePointIsInvalidSignature() {
        // x = 5 is not the x coordinate of any secp256k1 point
        byte[] r = Secp256k1.toBytes32(BigInteger.valueOf(5));
        byte[] s = Secp256k1.toBytes32(BigInteger.ONE);
        var ex = assertThrows(AuthorizationException.class,
            () -> SignatureVerifier.recover(DIGEST, new Signature(r, s, 27)));
        assertEquals(AuthorizationException.Reason.INVALID_SIGNATURE, ex.reason());
    }
}
