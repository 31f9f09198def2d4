// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import java.util.Objects;

import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.Signer;
import sh.warrant.core.types.Hash;

/**
 * Type-safe EIP-712 typed data container.
 *
 * <p>Binds a domain, a type definition and a message for hashing or signing.
 *
 * <pre>{@code
 * var domain = Eip712Domain.builder()
 *     .name("Token")
 *     .version("1")
 *     .chainId(1L)
 *     .verifyingContract(tokenAddress)
 *     .build();
 *
 * var typedData = TypedData.create(domain, TransferAuthorization.DEFINITION, auth);
 * Hash digest = typedData.hash();
 * Signature sig = typedData.sign(signer);
 * }</pre>
 *
 * @param <T> the message type (typically a record)
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
public final class TypedData<T> {

    private final Eip712Domain domain;
    private final TypeDefinition<T> definition;
    private final T message;

    private TypedData(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        this.domain = Objects.requireNonNull(domain, "domain");
        this.definition = Objects.requireNonNull(definition, "definition");
        this.message = Objects.requireNonNull(message, "message");
    }

    /**
     * Creates typed data from a domain, type definition, and message.
     *
     * @param <T> the message type
     * @param domain     the EIP-712 domain
     * @param definition the type definition with field mappings
     * @param message    the message instance
     * @return typed data ready for signing or hashing
     */
    public static <T> TypedData<T> create(Eip712Domain domain, TypeDefinition<T> definition, T message) {
        return new TypedData<>(domain, definition, message);
    }

    /**
     * Hashes the message struct without the domain.
     *
     * @return the struct hash
     */
    public Hash structHash() {
        return TypedDataEncoder.hashStruct(
            definition.primaryType(),
            definition.types(),
            definition.extractor().apply(message));
    }

    /**
     * Computes the signing digest:
     * {@code keccak256(0x19 0x01 || domainSeparator || hashStruct(message))}.
     *
     * @return the 32-byte digest
     */
    public Hash hash() {
        return Eip712.digest(domain.separator(), structHash());
    }

    /**
     * Signs the digest of this typed data.
     *
     * @param signer the signer to use
     * @return signature with v=27 or v=28
     */
    public Signature sign(Signer signer) {
        Objects.requireNonNull(signer, "signer");
        return signer.signDigest(hash());
    }

    public Eip712Domain domain() {
        return domain;
    }

    public String primaryType() {
        return definition.primaryType();
    }

    public T message() {
        return message;
    }

    public TypeDefinition<T> definition() {
        return definition;
    }
}
