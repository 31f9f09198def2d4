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
 * EIP-3009 TransferWithAuthorization message.
 *
 * <p>A signed authorization to move {@code value} from {@code from} to {@code to}.
 * The payer signs off-chain and any party may submit it.
 *
 * <p>The record does not require {@code validBefore > validAfter}. An empty window is
 * representable and is rejected at execution time as not yet valid or expired.
 *
 * @param from        the payer address
 * @param to          the payee address
 * @param value       the transfer amount in token smallest units
 * @param validAfter  the authorization is valid once current time reaches this (unix seconds)
 * @param validBefore the authorization expires at this time (unix seconds, exclusive)
 * @param nonce       random 32-byte nonce (NOT sequential)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-3009">EIP-3009</a>
 */
public record TransferAuthorization(
    Address from,
    Address to,
    BigInteger value,
    BigInteger validAfter,
    BigInteger validBefore,
    Nonce nonce
) {
    /** Canonical EIP-712 type string. */
    public static final String TYPE =
        "TransferWithAuthorization(address from,address to,uint256 value,uint256 validAfter,uint256 validBefore,bytes32 nonce)";

    /**
     * EIP-712 typehash for TransferWithAuthorization: {@code keccak256(TYPE)}.
     */
    public static final Hash TYPEHASH = new Hash(
        "0x7c7c6cdb67a18743f49ec6fa9b35f50d52ed05cbed4cc592e13b44501c1a2267");

    /** EIP-712 type definition for TransferWithAuthorization. */
    public static final TypeDefinition<TransferAuthorization> DEFINITION =
        TypeDefinition.forRecord(
            TransferAuthorization.class,
            "TransferWithAuthorization",
            Map.of("TransferWithAuthorization", List.of(
                TypedDataField.of("from", "address"),
                TypedDataField.of("to", "address"),
                TypedDataField.of("value", "uint256"),
                TypedDataField.of("validAfter", "uint256"),
                TypedDataField.of("validBefore", "uint256"),
                TypedDataField.of("nonce", "bytes32")
            ))
        );

    public TransferAuthorization {
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
