// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core.error;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class LedgerAbortExceptionTest {

    @Test
    void messageCarriesCategoryCodeAndDetail() {
        LedgerAbortException e = AbortCode.MINT_LIMIT_EXCEEDED.abort("supply 1 of 1");

        assertEquals(AbortCode.MINT_LIMIT_EXCEEDED, e.code());
        assertEquals(AbortCategory.LIMIT_EXCEEDED, e.category());
        assertEquals("supply 1 of 1", e.detail());
        assertTrue(e.getMessage().contains("[LIMIT_EXCEEDED] MINT_LIMIT_EXCEEDED"));
        assertTrue(e.getMessage().endsWith(": supply 1 of 1"));
    }

    @Test
    void messageWithoutDetail() {
        LedgerAbortException e = new LedgerAbortException(AbortCode.INVALID_MERGE, null);
        assertFalse(e.getMessage().contains(": "));
        assertNull(e.detail());
    }

    @Test
    void rejectsNullCode() {
        assertThrows(NullPointerException.class, () -> new LedgerAbortException(null, "x"));
    }

    @Test
    void categoryPredicates() {
        assertTrue(AbortCode.BALANCE_NOT_PUBLISHED.abort(null).isNotFound());
        assertTrue(AbortCode.NO_BURN_CAPABILITY.abort(null).isPermissionDenied());
        assertFalse(AbortCode.TOKEN_ALREADY_EXISTS.abort(null).isNotFound());
    }

    @Test
    void canonicalPacksCategoryAndReason() {
        assertEquals(0x6_0004, AbortCode.COLLECTION_NOT_PUBLISHED.canonical());
        assertEquals(0x9_0005, AbortCode.COLLECTION_LIMIT_EXCEEDED.canonical());
    }

    @Test
    void canonicalCodesAreUniqueAndResolvable() {
        for (AbortCode code : AbortCode.values()) {
            assertEquals(code, AbortCode.fromCanonical(code.canonical()).orElseThrow());
        }
        assertTrue(AbortCode.fromCanonical(0).isEmpty());
    }

    @Test
    void everyAbortIsAMintageException() {
        MintageException e = AbortCode.STORE_NOT_PUBLISHED.abort("0x1");
        assertInstanceOf(LedgerAbortException.class, e);
        assertInstanceOf(RuntimeException.class, e);
    }

    @Test
    void unconsumedValueReportsCount() {
        UnconsumedValueException e = new UnconsumedValueException("withdrawOnly", 2);
        assertEquals(2, e.outstanding());
        assertTrue(e.getMessage().contains("withdrawOnly"));
    }
}
