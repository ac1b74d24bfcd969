// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import sh.mintage.core.error.AbortCode;
import sh.mintage.core.error.LedgerAbortException;

class HashTableTest {

    @Test
    void addRejectsExistingKey() {
        Table<String, Long> table = new HashTable<>();
        table.add("Sets", 1L, AbortCode.COLLECTION_ALREADY_EXISTS);

        LedgerAbortException e = assertThrows(
                LedgerAbortException.class, () -> table.add("Sets", 2L, AbortCode.COLLECTION_ALREADY_EXISTS));

        assertEquals(AbortCode.COLLECTION_ALREADY_EXISTS, e.code());
        assertEquals("Sets", e.detail());
        assertEquals(Optional.of(1L), table.get("Sets"));
    }

    @Test
    void borrowAbortsWithGivenCodeWhenMissing() {
        Table<String, Long> table = new HashTable<>();

        LedgerAbortException e = assertThrows(
                LedgerAbortException.class, () -> table.borrow("Missing", AbortCode.COLLECTION_NOT_PUBLISHED));

        assertEquals(AbortCode.COLLECTION_NOT_PUBLISHED, e.code());
        assertTrue(e.isNotFound());
    }

    @Test
    void keysKeepInsertionOrderAndAreReadOnly() {
        Table<String, Long> table = new HashTable<>();
        table.put("b", 1L);
        table.put("a", 2L);
        table.put("c", 3L);

        assertEquals(List.of("b", "a", "c"), List.copyOf(table.keys()));
        assertThrows(UnsupportedOperationException.class, () -> table.keys().remove("a"));
    }

    @Test
    void copyIsIndependent() {
        Table<String, StringBuilder> table = new HashTable<>();
        table.put("k", new StringBuilder("x"));

        Table<String, StringBuilder> copy = table.copy(sb -> new StringBuilder(sb));
        copy.borrow("k", AbortCode.TOKEN_NOT_PUBLISHED).append("y");
        copy.put("other", new StringBuilder());

        assertEquals("x", table.borrow("k", AbortCode.TOKEN_NOT_PUBLISHED).toString());
        assertEquals(1, table.size());
        assertEquals(2, copy.size());
    }

    @Test
    void putReplacesAndRejectsNulls() {
        Table<String, Long> table = new HashTable<>();
        table.put("k", 7L);
        table.put("k", 8L);

        assertEquals(Optional.of(8L), table.get("k"));
        assertEquals(1, table.size());
        assertThrows(NullPointerException.class, () -> table.put(null, 1L));
        assertThrows(NullPointerException.class, () -> table.put("k", null));
    }
}
