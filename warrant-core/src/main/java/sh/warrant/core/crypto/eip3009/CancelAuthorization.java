// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip3009;

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
 * EIP-3009 CancelAuthorization message.
 *
 * <p>Lets an authorizer disable an outstanding authorization before it is used.
 * Once canceled, the nonce is permanently consumed. Carries no value or time bounds.
 *
 * @param authorizer the address that originally signed the authorization
 * @param nonce      the 32-byte nonce of the authorization to cancel
 * @see <a href="https://eips.ethereum.org/EIPS/eip-3009">EIP-3009</a>
 */
public record CancelAuthorization(
    Address authorizer,
    Nonce nonce
) {
    /** Canonical EIP-712 type string. */
    public static final String TYPE = "CancelAuthorization(address authorizer,bytes32 nonce)";

    /**
     * EIP-712 typehash for CancelAuthorization: {@code keccak256(TYPE)}.
     */
    public static final Hash TYPEHASH = new Hash(
        "0x158b0a9edf7a828aad02f63cd515c68ef2f50ba807396f6d12842833a1597429");

    /** EIP-712 type definition for CancelAuthorization. */
    public static final TypeDefinition<CancelAuthorization> DEFINITION =
        TypeDefinition.forRecord(
            CancelAuthorization.class,
            "CancelAuthorization",
            Map.of("CancelAuthorization", List.of(
                TypedDataField.of("authorizer", "address"),
                TypedDataField.of("nonce", "bytes32")
            ))
        );

    public CancelAuthorization {
        Objects.requireNonNull(authorizer, "authorizer");
        Objects.requireNonNull(nonce, "nonce");
    }

    /**
     * Hashes this message's fields under {@link #TYPEHASH}.
     *
     * @return the struct hash
     */
    public Hash structHash() {
        return Eip712.hashStruct(TYPEHASH, Eip712.word(authorizer), Eip712.word(nonce));
    }
}
