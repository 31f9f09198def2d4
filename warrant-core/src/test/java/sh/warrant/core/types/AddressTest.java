// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.warrant.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AddressTest {

    @Test
    void normalizesToLowercase() {
        var checksummed = new Address("0xCD2a3d9F938E13CD947Ec05AbC7FE734Df8DD826");
        assertEquals("0xcd2a3d9f938e13cd947ec05abc7fe734df8dd826", checksummed.value());
        assertEquals(new Address("0xcd2a3d9f938e13cd947ec05abc7fe734df8dd826"), checksummed);
    }

    @Test
    void rejectsMalformedInput() {
        assertThrows(IllegalArgumentException.class, () -> new Address("cd2a3d9f938e13cd947ec05abc7fe734df8dd826"));
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1234"));
        assertThrows(IllegalArgumentException.class, () -> new Address("0xzz2a3d9f938e13cd947ec05abc7fe734df8dd826"));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void bytesRoundTripThroughTwentyBytes() {
        var address = new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266");
        byte[] bytes = address.toBytes();
        assertEquals(20, bytes.length);
        assertEquals(address, Address.fromBytes(bytes));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[19]));
    }

    @Test
    void zeroAddress() {
        assertTrue(Address.ZERO.isZero());
        assertTrue(Address.fromBytes(new byte[20]).isZero());
        assertFalse(new Address("0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266").isZero());
    }
}
