// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip3009;

import java.math.BigInteger;
import java.time.Clock;
import java.util.Objects;

import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.Signer;
import sh.warrant.core.crypto.eip712.Eip712;
import sh.warrant.core.crypto.eip712.Eip712Domain;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;

/**
 * Client-side helpers for EIP-3009 authorizations.
 *
 * <p>Everything a payer needs to produce what a relayer submits: domains, nonces,
 * messages with a validity window, digests and signatures.
 *
 * <pre>{@code
 * var domain = Eip3009.tokenDomain("Token", "1", 1L, tokenAddress);
 *
 * var auth = Eip3009.transferAuthorization(
 *     signer.address(),
 *     recipient,
 *     BigInteger.valueOf(7_000_000),
 *     3600);                          // valid for 1 hour
 *
 * Signature sig = Eip3009.sign(auth, domain, signer);
 * }</pre>
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-3009">EIP-3009</a>
 */
public final class Eip3009 {

    /** Seconds subtracted from "now" for {@code validAfter}, to tolerate clock skew. */
    private static final long CLOCK_SKEW_SECONDS = 5;

    /** {@code 2^256 - 1}: a {@code validBefore} that never expires. */
    public static final BigInteger NEVER_EXPIRES = Uint256.MAX;

    private Eip3009() {}

    // ═══════════════════════════════════════════════════════════════════
    // Domain helpers
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Creates the EIP-712 domain for any EIP-3009 token.
     *
     * @param tokenName       the token's EIP-712 domain name
     * @param version         the token's EIP-712 domain version
     * @param chainId         the chain ID
     * @param contractAddress the token instance address
     * @return the EIP-712 domain
     * @throws NullPointerException if any argument is null
     */
    public static Eip712Domain tokenDomain(
            String tokenName, String version, long chainId, Address contractAddress) {
        Objects.requireNonNull(tokenName, "tokenName");
        Objects.requireNonNull(version, "version");
        Objects.requireNonNull(contractAddress, "contractAddress");
        return Eip712Domain.builder()
            .name(tokenName)
            .version(version)
            .chainId(chainId)
            .verifyingContract(contractAddress)
            .build();
    }

    /**
     * Creates the EIP-712 domain USDC uses: name {@code "USD Coin"}, version {@code "2"}.
     *
     * @param chainId         the chain ID
     * @param contractAddress the USDC address on this chain
     * @return the EIP-712 domain
     */
    public static Eip712Domain usdcDomain(long chainId, Address contractAddress) {
        return tokenDomain("USD Coin", "2", chainId, contractAddress);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Nonce generation
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Generates a random nonce.
     *
     * <p>Nonces are random {@code bytes32} values, so a payer can have many
     * outstanding authorizations without ordering constraints.
     *
     * @return 32 cryptographically random bytes
     */
    public static Nonce randomNonce() {
        return Nonce.random();
    }

    // ═══════════════════════════════════════════════════════════════════
    // Factory methods
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Creates a TransferAuthorization with explicit timestamps and nonce.
     *
     * @param from        payer address
     * @param to          payee address
     * @param value       token amount in smallest units
     * @param validAfter  earliest valid timestamp (unix seconds)
     * @param validBefore expiry timestamp (unix seconds, exclusive)
     * @param nonce       32-byte nonce
     * @return the authorization message
     */
    public static TransferAuthorization transferAuthorization(
            Address from, Address to, BigInteger value,
            BigInteger validAfter, BigInteger validBefore, Nonce nonce) {
        return new TransferAuthorization(from, to, value, validAfter, validBefore, nonce);
    }

    /**
     * Creates a TransferAuthorization valid from now for {@code validForSeconds}, with a random nonce.
     *
     * @param from            payer address
     * @param to              payee address
     * @param value           token amount in smallest units
     * @param validForSeconds how many seconds from now the authorization is valid
     * @return the authorization message
     */
    public static TransferAuthorization transferAuthorization(
            Address from, Address to, BigInteger value, long validForSeconds) {
        return transferAuthorization(from, to, value, validForSeconds, Clock.systemUTC());
    }

    /**
     * Creates a TransferAuthorization valid for {@code validForSeconds} from the clock's current time.
     * <p>
     * Sets {@code validAfter = now - 5s} to tolerate clock skew.
     *
     * @param from            payer address
     * @param to              payee address
     * @param value           token amount in smallest units
     * @param validForSeconds how many seconds from now the authorization is valid
     * @param clock           source of the current time
     * @return the authorization message
     */
    public static TransferAuthorization transferAuthorization(
            Address from, Address to, BigInteger value, long validForSeconds, Clock clock) {
        long now = clock.instant().getEpochSecond();
        return new TransferAuthorization(
            from, to, value,
            BigInteger.valueOf(Math.max(0, now - CLOCK_SKEW_SECONDS)),
            BigInteger.valueOf(now + validForSeconds),
            randomNonce());
    }

    /**
     * Creates a ReceiveAuthorization with explicit timestamps and nonce.
     *
     * @param from        payer address
     * @param to          payee address (the only permitted caller)
     * @param value       token amount in smallest units
     * @param validAfter  earliest valid timestamp (unix seconds)
     * @param validBefore expiry timestamp (unix seconds, exclusive)
     * @param nonce       32-byte nonce
     * @return the authorization message
     */
    public static ReceiveAuthorization receiveAuthorization(
            Address from, Address to, BigInteger value,
            BigInteger validAfter, BigInteger validBefore, Nonce nonce) {
        return new ReceiveAuthorization(from, to, value, validAfter, validBefore, nonce);
    }

    /**
     * Creates a ReceiveAuthorization valid from now for {@code validForSeconds}, with a random nonce.
     *
     * @param from            payer address
     * @param to              payee address (the only permitted caller)
     * @param value           token amount in smallest units
     * @param validForSeconds how many seconds from now the authorization is valid
     * @return the authorization message
     */
    public static ReceiveAuthorization receiveAuthorization(
            Address from, Address to, BigInteger value, long validForSeconds) {
        return receiveAuthorization(from, to, value, validForSeconds, Clock.systemUTC());
    }

    /**
     * Creates a ReceiveAuthorization valid for {@code validForSeconds} from the clock's current time.
     *
     * @param from            payer address
     * @param to              payee address (the only permitted caller)
     * @param value           token amount in smallest units
     * @param validForSeconds how many seconds from now the authorization is valid
     * @param clock           source of the current time
     * @return the authorization message
     */
    public static ReceiveAuthorization receiveAuthorization(
            Address from, Address to, BigInteger value, long validForSeconds, Clock clock) {
        long now = clock.instant().getEpochSecond();
        return new ReceiveAuthorization(
            from, to, value,
            BigInteger.valueOf(Math.max(0, now - CLOCK_SKEW_SECONDS)),
            BigInteger.valueOf(now + validForSeconds),
            randomNonce());
    }

    /**
     * Creates a CancelAuthorization.
     *
     * @param authorizer the address that signed the authorization to cancel
     * @param nonce      the nonce of the authorization to cancel
     * @return the cancel message
     */
    public static CancelAuthorization cancelAuthorization(Address authorizer, Nonce nonce) {
        return new CancelAuthorization(authorizer, nonce);
    }

    // ═══════════════════════════════════════════════════════════════════
    // Hashing
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Computes the signing digest of a TransferWithAuthorization.
     *
     * @param auth   the authorization message
     * @param domain the token's EIP-712 domain
     * @return the 32-byte digest
     */
    public static Hash hash(TransferAuthorization auth, Eip712Domain domain) {
        return Eip712.digest(domain.separator(), auth.structHash());
    }

    /**
     * Computes the signing digest of a ReceiveWithAuthorization.
     *
     * @param auth   the authorization message
     * @param domain the token's EIP-712 domain
     * @return the 32-byte digest
     */
    public static Hash hash(ReceiveAuthorization auth, Eip712Domain domain) {
        return Eip712.digest(domain.separator(), auth.structHash());
    }

    /**
     * Computes the signing digest of a CancelAuthorization.
     *
     * @param auth   the cancel message
     * @param domain the token's EIP-712 domain
     * @return the 32-byte digest
     */
    public static Hash hash(CancelAuthorization auth, Eip712Domain domain) {
        return Eip712.digest(domain.separator(), auth.structHash());
    }

    // ═══════════════════════════════════════════════════════════════════
    // Signing
    // ═══════════════════════════════════════════════════════════════════

    /**
     * Signs a TransferWithAuthorization message.
     *
     * @param auth   the authorization message
     * @param domain the token's EIP-712 domain
     * @param signer the signer (must be the {@code from} address for the signature to verify)
     * @return signature with v=27 or v=28
     */
    public static Signature sign(TransferAuthorization auth, Eip712Domain domain, Signer signer) {
        return signer.signDigest(hash(auth, domain));
    }

    /**
     * Signs a ReceiveWithAuthorization message.
     *
     * @param auth   the authorization message
     * @param domain the token's EIP-712 domain
     * @param signer the signer (must be the {@code from} address for the signature to verify)
     * @return signature with v=27 or v=28
     */
    public static Signature sign(ReceiveAuthorization auth, Eip712Domain domain, Signer signer) {
        return signer.signDigest(hash(auth, domain));
    }

    /**
     * Signs a CancelAuthorization message.
     *
     * @param auth   the cancel message
     * @param domain the token's EIP-712 domain
     * @param signer the signer (must be the {@code authorizer} for the signature to verify)
     * @return signature with v=27 or v=28
     */
    public static Signature sign(CancelAuthorization auth, Eip712Domain domain, Signer signer) {
        return signer.signDigest(hash(auth, domain));
    }
}
