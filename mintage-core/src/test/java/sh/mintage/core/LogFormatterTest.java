// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.mintage.core.types.Address;

class LogFormatterTest {

    private static final Address CREATOR = Address.parse("0xc");
    private static final Address HOLDER = Address.parse("0x" + "ab".repeat(32));

    @BeforeEach
    void plainOutput() {
        assumeFalse(AnsiColors.IS_TTY, "colors change the exact text");
    }

    @Test
    void shortensOnlyLongAddresses() {
        assertEquals("0xc", LogFormatter.shorten(CREATOR));
        assertEquals("0xabab...abab", LogFormatter.shorten(HOLDER));
        assertEquals("null", LogFormatter.shorten(null));
    }

    @Test
    void collectionLine() {
        assertEquals("[COLLECTION] creator=0xc name=Sets maximum=2",
                LogFormatter.formatCollection(CREATOR, "Sets", 2L));
        assertTrue(LogFormatter.formatCollection(CREATOR, "Sets", null).endsWith("maximum=unlimited"));
    }

    @Test
    void mintLine() {
        assertEquals("[MINT] by=0xc to=0xabab...abab token=0xc::Sets::A amount=5 supply=untracked",
                LogFormatter.formatMint(CREATOR, HOLDER, "0xc::Sets::A", 5, null));
    }

    @Test
    void abortLine() {
        assertEquals("✗ [ABORT] tx=mintTo code=MINT_LIMIT_EXCEEDED reason=cap",
                LogFormatter.formatAbort("mintTo", "MINT_LIMIT_EXCEEDED", "cap"));
    }

    @Test
    void eventLine() {
        assertEquals("[EVENT] key=0xc#2 seq=0 type=Deposited",
                LogFormatter.formatEvent("0xc#2", 0, "Deposited"));
    }
}
