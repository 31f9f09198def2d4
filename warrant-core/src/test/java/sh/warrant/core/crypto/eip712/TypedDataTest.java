// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.crypto.eip712;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.warrant.core.crypto.PrivateKeySigner;
import sh.warrant.core.crypto.Signature;
import sh.warrant.core.crypto.SignatureVerifier;
import sh.warrant.core.error.Eip712Exception;
import sh.warrant.core.types.Address;

class TypedDataTest {

    record Person(String name, Address wallet) {}

    record Mail(Person from, Person to, String contents) {}

    private static final Map<String, List<TypedDataField>> MAIL_TYPES = Map.of(
        "Person", List.of(
            TypedDataField.of("name", "string"),
            TypedDataField.of("wallet", "address")),
        "Mail", List.of(
            TypedDataField.of("from", "Person"),
            TypedDataField.of("to", "Person"),
            TypedDataField.of("contents", "string")));

    private static final TypeDefinition<Mail> MAIL = new TypeDefinition<>("Mail", MAIL_TYPES, mail -> {
        var data = new LinkedHashMap<String, Object>();
        data.put("from", person(mail.from()));
        data.put("to", person(mail.to()));
        data.put("contents", mail.contents());
        return data;
    });

    private static final Eip712Domain DOMAIN = Eip712Domain.builder()
        .name("Ether Mail")
        .version("1")
        .chainId(1)
        .verifyingContract(new Address("0xCcCCccccCCCCcCCCCCCcCcCccCcCCCcCcccccccC"))
        .build();

    private static final Mail MESSAGE = new Mail(
        new Person("Cow", new Address("0xCD2a3d9F938E13CD947Ec05AbC7FE734Df8DD826")),
        new Person("Bob", new Address("0xbBbBBBBbbBBBbbbBbbBbbbbBBbBbbbbBbBbbBBbB")),
        "Hello, Bob!");

    private static Map<String, Object> person(Person p) {
        var data = new LinkedHashMap<String, Object>();
        data.put("name", p.name());
        data.put("wallet", p.wallet());
        return data;
    }

    @Test
    void encodeType_listsReferencedStructsAfterPrimary() {
        assertEquals("Mail(Person from,Person to,string contents)Person(string name,address wallet)",
            MAIL.encodeType());
    }

    @Test
    void structHash_mailExample() {
        assertEquals("0xc52c0ee5d84264471806290a3f2c4cecfc5490626bf912d01f240d7a274b371e",
            TypedData.create(DOMAIN, MAIL, MESSAGE).structHash().value());
    }

    @Test
    void hash_mailExample() {
        assertEquals("0xbe609aee343fb3c4b28e1df9e632fca64fcfaede20f02e86244efddf30957bd2",
            TypedData.create(DOMAIN, MAIL, MESSAGE).hash().value());
    }

    @Test
    void sign_producesRecoverableTypedDataSignature() {
        var signer = new PrivateKeySigner("0xac0974bec39a17e36ba4a6b4d238ff944bacb478cbed5efcae784d7bf4f2ff80");
        var typedData = TypedData.create(DOMAIN, MAIL, MESSAGE);

        Signature sig = typedData.sign(signer);

        assertTrue(sig.v() == 27 || sig.v() == 28);
        assertEquals(signer.address(), SignatureVerifier.recover(typedData.hash(), sig));
    }

    @Test
    void forRecord_readsComponentsByName() {
        record Simple(BigInteger value, boolean flag) {}
        var def = TypeDefinition.forRecord(Simple.class, "Simple", Map.of("Simple", List.of(
            TypedDataField.of("value", "uint256"),
            TypedDataField.of("flag", "bool"))));

        assertEquals(Map.of("value", BigInteger.TEN, "flag", true), def.extractor().apply(new Simple(BigInteger.TEN, true)));
        assertEquals("Simple(uint256 value,bool flag)", def.encodeType());
    }

    @Test
    void missingFieldIsReported() {
        var types = Map.of("Simple", List.of(TypedDataField.of("value", "uint256")));
        var ex = assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.hashStruct("Simple", types, Map.of()));
        assertTrue(ex.getMessage().contains("Missing field 'value'"));
    }

    @Test
    void valueTooWideForTypeIsRejected() {
        var types = Map.of("Small", List.of(TypedDataField.of("value", "uint8")));
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.hashStruct("Small", types, Map.of("value", BigInteger.valueOf(256))));
    }

    @Test
    void unknownTypeIsRejected() {
        var types = Map.of("Odd", List.of(TypedDataField.of("value", "fixed128x18")));
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.hashStruct("Odd", types, Map.of("value", BigInteger.ONE)));
    }

    @Test
    void dynamicBytesAndArraysAreNotEncoded() {
        var bytes = Map.of("Blob", List.of(TypedDataField.of("data", "bytes")));
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.hashStruct("Blob", bytes, Map.of("data", new byte[] {1, 2})));

        var array = Map.of("Batch", List.of(TypedDataField.of("values", "uint256[]")));
        assertThrows(Eip712Exception.class,
            () -> TypedDataEncoder.hashStruct("Batch", array, Map.of("values", List.of(BigInteger.ONE))));
    }

    @Test
    void cyclicTypesAreRejected() {
        var types = Map.of(
            "A", List.of(TypedDataField.of("b", "B")),
            "B", List.of(TypedDataField.of("a", "A")));
        assertThrows(Eip712Exception.class, () -> TypedDataEncoder.encodeType("A", types));
    }

    @Test
    void definitionRequiresPrimaryType() {
        assertThrows(IllegalArgumentException.class,
            () -> new TypeDefinition<Object>("Missing", MAIL_TYPES, o -> Map.of()));
    }
}
