// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class DebugLoggerTest {

    private final Logger logger = (Logger) LoggerFactory.getLogger("sh.mintage.debug");
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void attach() {
        assumeFalse(AnsiColors.IS_TTY, "TTY output bypasses SLF4J");
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void reset() {
        MintageDebug.setEnabled(false);
        logger.detachAndStopAllAppenders();
    }

    @Test
    void doesNotLogWhenDisabled() {
        DebugLogger.log("should not appear");
        DebugLogger.logLedger("should not appear");

        assertTrue(appender.list.isEmpty());
    }

    @Test
    void ledgerToggleIsIndependentOfEventToggle() {
        MintageDebug.setLedgerLogging(true);

        DebugLogger.logLedger("[MINT] amount=%d", 5);
        DebugLogger.logEvent("[EVENT] hidden");

        assertEquals(1, appender.list.size());
        assertEquals("[MINT] amount=5", appender.list.get(0).getFormattedMessage());
        assertTrue(MintageDebug.isEnabled());
        assertFalse(MintageDebug.isEventLoggingEnabled());
    }

    @Test
    void logsSanitizedMessagesWhenEnabled() {
        MintageDebug.setEnabled(true);
        DebugLogger.log("[COLLECTION] name=Sets\n[ABORT] forged");

        assertEquals(1, appender.list.size());
        assertEquals("[COLLECTION] name=Sets [ABORT] forged", appender.list.get(0).getFormattedMessage());
    }
}
