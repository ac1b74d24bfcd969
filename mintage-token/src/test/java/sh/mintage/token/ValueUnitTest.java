// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import sh.mintage.core.error.AbortCode;
import sh.mintage.core.error.ConsumedValueException;
import sh.mintage.core.error.LedgerAbortException;
import sh.mintage.core.types.Address;

class ValueUnitTest {

    private static final Address CREATOR = Address.parse("0xc");
    private static final AssetIdentity A = AssetIdentity.of(CREATOR, "Sets", "A");
    private static final AssetIdentity B = AssetIdentity.of(CREATOR, "Sets", "B");

    private UnitTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new UnitTracker();
    }

    @Test
    void issuedUnitIsTrackedUntilMerged() {
        ValueUnit slot = ValueUnit.emptySlot(A, tracker);
        ValueUnit unit = ValueUnit.issue(A, 5, tracker);
        assertEquals(1, tracker.outstanding());

        ValueUnit.merge(slot, unit);

        assertEquals(5, slot.amount());
        assertTrue(unit.isConsumed());
        assertEquals(0, tracker.outstanding());
    }

    @Test
    void splitMovesAmountIntoNewUnit() {
        ValueUnit unit = ValueUnit.issue(A, 10, tracker);

        ValueUnit part = ValueUnit.split(unit, 3);

        assertEquals(7, unit.amount());
        assertEquals(3, part.amount());
        assertEquals(A, part.identity());
        assertEquals(2, tracker.outstanding());
    }

    @ParameterizedTest
    @ValueSource(longs = {0, 1, 7, 12, 13})
    void splitThenMergeRestoresUnit(final long k) {
        ValueUnit unit = ValueUnit.issue(A, 13, tracker);

        ValueUnit part = ValueUnit.split(unit, k);
        assertEquals(13 - k, unit.amount());
        ValueUnit.merge(part, unit);

        assertEquals(13, part.amount());
        assertEquals(A, part.identity());
        assertTrue(unit.isConsumed());
        assertEquals(1, tracker.outstanding());
    }

    @Test
    void resetRevokesOpenUnitsOnly() {
        ValueUnit slot = ValueUnit.emptySlot(A, tracker);
        ValueUnit open = ValueUnit.issue(A, 4, tracker);
        ValueUnit settled = ValueUnit.issue(A, 1, tracker);
        ValueUnit.merge(slot, settled);

        assertEquals(1, tracker.reset());

        assertTrue(open.isConsumed());
        assertThrows(ConsumedValueException.class, () -> ValueUnit.merge(slot, open));
        assertEquals(1, slot.amount());
        assertEquals(0, tracker.outstanding());
    }

    @Test
    void splitAboveAmountAborts() {
        ValueUnit unit = ValueUnit.issue(A, 2, tracker);

        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> ValueUnit.split(unit, 3));

        assertEquals(AbortCode.SPLIT_AMOUNT_EXCEEDS_BALANCE, e.code());
        assertEquals(2, unit.amount());
    }

    @Test
    void mergeOfDifferentIdentitiesAborts() {
        ValueUnit a = ValueUnit.issue(A, 1, tracker);
        ValueUnit b = ValueUnit.issue(B, 1, tracker);

        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> ValueUnit.merge(a, b));

        assertEquals(AbortCode.INVALID_MERGE, e.code());
        assertFalse(b.isConsumed());
    }

    @Test
    void mergeIntoItselfAborts() {
        ValueUnit a = ValueUnit.issue(A, 4, tracker);

        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> ValueUnit.merge(a, a));

        assertEquals(AbortCode.INVALID_MERGE, e.code());
        assertEquals(4, a.amount());
    }

    @Test
    void destroyZeroOnlyAcceptsEmptyUnits() {
        ValueUnit empty = ValueUnit.issue(A, 0, tracker);
        ValueUnit full = ValueUnit.issue(A, 1, tracker);

        ValueUnit.destroyZero(empty);
        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> ValueUnit.destroyZero(full));

        assertTrue(empty.isConsumed());
        assertEquals(AbortCode.DESTROY_NON_ZERO, e.code());
        assertEquals(1, tracker.outstanding());
    }

    @Test
    void consumedUnitCannotBeUsedAgain() {
        ValueUnit slot = ValueUnit.emptySlot(A, tracker);
        ValueUnit unit = ValueUnit.issue(A, 3, tracker);
        ValueUnit.merge(slot, unit);

        assertThrows(ConsumedValueException.class, unit::amount);
        assertThrows(ConsumedValueException.class, unit::identity);
        assertThrows(ConsumedValueException.class, () -> ValueUnit.merge(slot, unit));
        assertThrows(ConsumedValueException.class, () -> ValueUnit.split(unit, 0));
        assertEquals(3, slot.amount());
    }

    @Test
    void withdrawFromSlotTrapsOnUnderflow() {
        ValueUnit slot = ValueUnit.emptySlot(A, tracker);
        ValueUnit.merge(slot, ValueUnit.issue(A, 2, tracker));

        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> slot.withdraw(3));

        assertEquals(AbortCode.ARITHMETIC_ERROR, e.code());
        assertEquals(2, slot.amount());
        assertEquals(0, tracker.outstanding());
    }

    @Test
    void mergeTrapsOnOverflow() {
        ValueUnit big = ValueUnit.issue(A, Long.MAX_VALUE, tracker);
        ValueUnit one = ValueUnit.issue(A, 1, tracker);

        LedgerAbortException e = assertThrows(LedgerAbortException.class, () -> ValueUnit.merge(big, one));

        assertEquals(AbortCode.ARITHMETIC_ERROR, e.code());
        assertFalse(one.isConsumed());
    }

    @Test
    void negativeAmountsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> ValueUnit.issue(A, -1, tracker));
        ValueUnit unit = ValueUnit.issue(A, 1, tracker);
        assertThrows(IllegalArgumentException.class, () -> ValueUnit.split(unit, -1));
    }
}
