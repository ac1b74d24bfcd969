// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.types;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class AddressTest {

    private static final String FULL_ONE = "0x" + "0".repeat(63) + "1";

    @Test
    void acceptsFullFormAndLowercases() {
        Address address = new Address("0x" + "AB".repeat(32));
        assertEquals("0x" + "ab".repeat(32), address.value());
    }

    @Test
    void rejectsShortFormInConstructor() {
        assertThrows(IllegalArgumentException.class, () -> new Address("0x1"));
        assertThrows(NullPointerException.class, () -> new Address(null));
    }

    @Test
    void parsePadsShortForm() {
        assertEquals(new Address(FULL_ONE), Address.parse("0x1"));
        assertEquals(Address.parse("0xCAFE"), Address.parse("0x000cafe"));
    }

    @Test
    void parseRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> Address.parse("1"));
        assertThrows(IllegalArgumentException.class, () -> Address.parse("0x"));
        assertThrows(IllegalArgumentException.class, () -> Address.parse("0xg1"));
        assertThrows(IllegalArgumentException.class, () -> Address.parse("0x" + "1".repeat(65)));
        assertThrows(NullPointerException.class, () -> Address.parse(null));
    }

    @Test
    void shortString() {
        assertEquals("0x1", Address.parse("0x1").toShortString());
        assertEquals("0x0", Address.ZERO.toShortString());
        assertEquals("0xcafe", Address.parse("0xcafe").toShortString());
    }

    @Test
    void bytesRoundTrip() {
        Address address = Address.parse("0xdeadbeef");
        byte[] bytes = address.toBytes();
        assertEquals(32, bytes.length);
        assertEquals(address, Address.fromBytes(bytes));
        assertThrows(IllegalArgumentException.class, () -> Address.fromBytes(new byte[20]));
    }

    @Test
    void toStringIsValue() {
        assertEquals(FULL_ONE, Address.parse("0x1").toString());
    }
}
