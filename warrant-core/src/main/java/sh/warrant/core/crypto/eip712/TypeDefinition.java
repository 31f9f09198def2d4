// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import java.lang.reflect.RecordComponent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

import sh.warrant.core.error.Eip712Exception;

/**
 * Maps a Java type onto its EIP-712 struct definition.
 *
 * <p>Holds the primary type name, the field lists of every struct type involved,
 * and a function that reads field values out of a message object.
 *
 * <pre>{@code
 * record CancelAuthorization(Address authorizer, Nonce nonce) {
 *     static final TypeDefinition<CancelAuthorization> DEFINITION = TypeDefinition.forRecord(
 *         CancelAuthorization.class,
 *         "CancelAuthorization",
 *         Map.of("CancelAuthorization", List.of(
 *             TypedDataField.of("authorizer", "address"),
 *             TypedDataField.of("nonce", "bytes32"))));
 * }
 * }</pre>
 *
 * @param <T> the Java type this definition maps
 * @param primaryType the primary type name (e.g., "TransferWithAuthorization")
 * @param types map of type names to their field definitions
 * @param extractor function to extract field values from a message object
 */
public record TypeDefinition<T>(
    String primaryType,
    Map<String, List<TypedDataField>> types,
    Function<T, Map<String, Object>> extractor
) {
    public TypeDefinition {
        Objects.requireNonNull(primaryType, "primaryType");
        Objects.requireNonNull(types, "types");
        Objects.requireNonNull(extractor, "extractor");
        if (primaryType.isBlank()) {
            throw new IllegalArgumentException("primaryType cannot be blank");
        }
        if (!types.containsKey(primaryType)) {
            throw new IllegalArgumentException("types must contain primaryType: " + primaryType);
        }
        types = Map.copyOf(types);
    }

    /**
     * Returns the canonical type string, e.g.
     * {@code "CancelAuthorization(address authorizer,bytes32 nonce)"}.
     *
     * @return the encoded type
     */
    public String encodeType() {
        return TypedDataEncoder.encodeType(primaryType, types);
    }

    /**
     * Creates a definition for a record type.
     *
     * <p>Component values are read through the record accessors, so component
     * names must match the field names of the primary type.
     *
     * @param <T> the record type
     * @param recordClass the record class
     * @param primaryType the primary type name
     * @param types map of type names to their field definitions
     * @return a new definition with accessor-based extraction
     * @throws IllegalArgumentException if recordClass is not a record
     */
    public static <T extends Record> TypeDefinition<T> forRecord(
            Class<T> recordClass,
            String primaryType,
            Map<String, List<TypedDataField>> types) {
        Objects.requireNonNull(recordClass, "recordClass");
        if (!recordClass.isRecord()) {
            throw new IllegalArgumentException("Class must be a record: " + recordClass.getName());
        }
        final RecordComponent[] components = recordClass.getRecordComponents();

        Function<T, Map<String, Object>> extractor = record -> {
            var result = new LinkedHashMap<String, Object>();
            for (RecordComponent component : components) {
                try {
                    result.put(component.getName(), component.getAccessor().invoke(record));
                } catch (ReflectiveOperationException e) {
                    throw new Eip712Exception(
                        "Failed to read field '" + component.getName() + "' of " + recordClass.getName(), e);
                }
            }
            return result;
        };

        return new TypeDefinition<>(primaryType, types, extractor);
    }
}
