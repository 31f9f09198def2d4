// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import sh.warrant.core.error.Eip712Exception;
import sh.warrant.core.types.Address;
import sh.warrant.core.types.Hash;
import sh.warrant.core.types.Nonce;
import sh.warrant.primitives.Hex;

/**
 * Definition-driven EIP-712 struct encoder.
 * <p>
 * Encodes messages described by a {@link TypeDefinition}: atomic types
 * ({@code uintN}, {@code address}, {@code bool}, {@code bytesN}, {@code string})
 * and nested structs. Field words are produced with the same functions as
 * {@link Eip712}, so both paths hash identically.
 *
 * @see <a href="https://eips.ethereum.org/EIPS/eip-712">EIP-712</a>
 */
final class TypedDataEncoder {

    private static final Pattern UINT = Pattern.compile("^uint(\\d*)$");
    private static final Pattern FIXED_BYTES = Pattern.compile("^bytes(\\d+)$");

    private TypedDataEncoder() {}

    // ═══════════════════════════════════════════════════════════════
    // TYPE ENCODING
    // ═══════════════════════════════════════════════════════════════

    /**
     * Encodes a type to its canonical string: the primary type first, then every
     * referenced struct type in alphabetical order.
     * <p>
     * Example: {@code "Mail(Person from,Person to,string contents)Person(string name,address wallet)"}
     */
    static String encodeType(String typeName, Map<String, List<TypedDataField>> types) {
        Set<String> deps = new LinkedHashSet<>();
        collectDependencies(typeName, types, deps, new HashSet<>());

        List<String> ordered = new ArrayList<>();
        ordered.add(typeName);
        deps.remove(typeName);
        deps.stream().sorted().forEach(ordered::add);

        var result = new StringBuilder();
        for (String t : ordered) {
            result.append(t).append('(');
            List<TypedDataField> fields = types.get(t);
            for (int i = 0; i < fields.size(); i++) {
                if (i > 0) result.append(',');
                result.append(fields.get(i).type()).append(' ').append(fields.get(i).name());
            }
            result.append(')');
        }
        return result.toString();
    }

    private static void collectDependencies(
            String typeName,
            Map<String, List<TypedDataField>> types,
            Set<String> deps,
            Set<String> visiting) {
        if (!visiting.add(typeName)) {
            throw Eip712Exception.cyclicDependency(typeName);
        }
        List<TypedDataField> fields = types.get(typeName);
        if (fields != null) {
            deps.add(typeName);
            for (TypedDataField field : fields) {
                if (types.containsKey(field.type())) {
                    collectDependencies(field.type(), types, deps, visiting);
                }
            }
        }
        visiting.remove(typeName);
    }

    // ═══════════════════════════════════════════════════════════════
    // STRUCT HASHING
    // ═══════════════════════════════════════════════════════════════

    /**
     * hashStruct(s) = keccak256(typeHash || encodeData(s))
     */
    static Hash hashStruct(String typeName, Map<String, List<TypedDataField>> types, Map<String, Object> data) {
        List<TypedDataField> fields = types.get(typeName);
        if (fields == null) {
            throw Eip712Exception.unknownType(typeName);
        }
        byte[][] words = new byte[fields.size()][];
        for (int i = 0; i < fields.size(); i++) {
            TypedDataField field = fields.get(i);
            if (!data.containsKey(field.name())) {
                throw Eip712Exception.missingField(typeName, field.name());
            }
            words[i] = encodeField(field.type(), data.get(field.name()), types);
        }
        return Eip712.hashStruct(Eip712.typeHash(encodeType(typeName, types)), words);
    }

    static byte[] encodeField(String type, Object value, Map<String, List<TypedDataField>> types) {
        if (value == null) {
            throw Eip712Exception.invalidValue(type, null);
        }
        if (types.containsKey(type)) {
            return hashStruct(type, types, asMap(type, value)).toBytes();
        }

        Matcher uint = UINT.matcher(type);
        if (uint.matches()) {
            int bits = uint.group(1).isEmpty() ? 256 : Integer.parseInt(uint.group(1));
            if (bits % 8 != 0 || bits < 8 || bits > 256) {
                throw Eip712Exception.unknownType(type);
            }
            BigInteger number = toBigInteger(type, value);
            if (number.signum() >= 0 && number.bitLength() > bits) {
                throw Eip712Exception.valueOutOfRange(type, number, "exceeds " + bits + " bits");
            }
            return Eip712.word(number);
        }
        Matcher fixed = FIXED_BYTES.matcher(type);
        if (fixed.matches()) {
            int length = Integer.parseInt(fixed.group(1));
            if (length < 1 || length > 32) {
                throw Eip712Exception.unknownType(type);
            }
            byte[] bytes = toBytes(type, value);
            if (bytes.length != length) {
                throw Eip712Exception.invalidValue(type, "expected " + length + " bytes, got " + bytes.length);
            }
            return Eip712.padRight(bytes);
        }

        if ("address".equals(type)) {
            if (value instanceof Address address) {
                return Eip712.word(address);
            }
            if (value instanceof String s) {
                return Eip712.word(new Address(s));
            }
            throw Eip712Exception.invalidValue(type, value);
        }
        if ("bool".equals(type)) {
            if (value instanceof Boolean b) {
                return Eip712.word(b ? BigInteger.ONE : BigInteger.ZERO);
            }
            throw Eip712Exception.invalidValue(type, value);
        }
        if ("string".equals(type)) {
            if (value instanceof String s) {
                return Eip712.word(s);
            }
            throw Eip712Exception.invalidValue(type, value);
        }
        throw Eip712Exception.unknownType(type);
    }

    private static BigInteger toBigInteger(String type, Object value) {
        if (value instanceof BigInteger bi) {
            return bi;
        }
        if (value instanceof Long || value instanceof Integer) {
            return BigInteger.valueOf(((Number) value).longValue());
        }
        if (value instanceof String s) {
            try {
                return Hex.hasPrefix(s) ? new BigInteger(Hex.cleanPrefix(s), 16) : new BigInteger(s);
            } catch (NumberFormatException e) {
                throw new Eip712Exception("Invalid value for type '" + type + "': " + s, e);
            }
        }
        throw Eip712Exception.invalidValue(type, value);
    }

    private static byte[] toBytes(String type, Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof Nonce nonce) {
            return nonce.toBytes();
        }
        if (value instanceof Hash hash) {
            return hash.toBytes();
        }
        if (value instanceof String s) {
            try {
                return Hex.decode(s);
            } catch (IllegalArgumentException e) {
                throw new Eip712Exception("Invalid value for type '" + type + "': " + s, e);
            }
        }
        throw Eip712Exception.invalidValue(type, value);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(String type, Object value) {
        if (value instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        throw Eip712Exception.invalidValue(type, value);
    }
}
