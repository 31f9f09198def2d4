// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip3009;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.warrant.core.crypto.eip712.Eip712;
import sh.warrant.core.crypto.eip712.TypeDefinition;
import sh.warrant.core.crypto.eip712.TypedDataField;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;

/**
 * EIP-3009 ReceiveWithAuthorization message.
 *
 * <p>Like {@link TransferAuthorization}, but payee-gated: only {@code to} may submit it.
 * A third party who sees the signature in transit cannot front-run the payee's
 * own call, and a transfer-style submission cannot replay it because the type
 * hash differs.
 *
 * <p>The record does not require {@code validBefore > validAfter}. An empty window is
 * representable and is rejected at execution time as not yet valid or expired.
 *
 * @param from        the payer address
 * @param to          the payee address, and the only permitted caller
 * @param value       the transfer amount in token smallest units
 * @param validAfter  the authorization is valid once current time reaches this (unix seconds)
 * @param validBefore the authorization expires at this time (unix seconds, exclusive)
 * @param nonce       random 32-byte nonce (NOT sequential)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-3009">EIP-3009</a>
 */
public record ReceiveAuthorization(
    Address from,
    Address to,
    BigInteger value,
    BigInteger validAfter,
    BigInteger validBefore,
    Nonce nonce
) {
    /** Canonical EIP-712 type string. */
    public static final String TYPE =
        "ReceiveWithAuthorization(address from,address to,uint256 value,uint256 validAfter,uint256 validBefore,bytes32 nonce)";

    /**
     * EIP-712 typehash for ReceiveWithAuthorization: {@code keccak256(TYPE)}.
     */
    public static final Hash TYPEHASH = new Hash(
        "0xd099cc98ef71107a616c4f0f941f04c322d8e254fe26b3c6668db87aae413de8");

    /** EIP-712 type definition for ReceiveWithAuthorization. */
    public static final TypeDefinition<ReceiveAuthorization> DEFINITION =
        TypeDefinition.forRecord(
            ReceiveAuthorization.class,
            "ReceiveWithAuthorization",
            Map.of("ReceiveWithAuthorization", List.of(
                TypedDataField.of("from", "address"),
                TypedDataField.of("to", "address"),
                TypedDataField.of("value", "uint256"),
                TypedDataField.of("validAfter", "uint256"),
                TypedDataField.of("validBefore", "uint256"),
                TypedDataField.of("nonce", "bytes32")
            ))
        );

    public ReceiveAuthorization {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(nonce, "nonce");
        Uint256.require("value", value);
        Uint256.require("validAfter", validAfter);
        Uint256.require("validBefore", validBefore);
    }

    /**
     * Hashes this message's fields under {@link #TYPEHASH}.
     *
     * @return the struct hash
     */
    public Hash structHash() {
        return Eip712.hashStruct(TYPEHASH,
            Eip712.word(from),
            Eip712.word(to),
            Eip712.word(value),
            Eip712.word(validAfter),
            Eip712.word(validBefore),
            Eip712.word(nonce));
    }
}
