// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.Objects;

import sh.mintage.core.error.AbortCode;
import sh.mintage.core.error.ConsumedValueException;

/**
 * A quantity of one {@link AssetIdentity}: the unit of transfer.
 *
 * <p>
 * Value units cannot be copied or silently dropped. Only the ledger creates them
 * (mint, withdraw, split). A unit is disposed of in exactly one of three ways:
 * <ul>
 * <li>{@link #merge(ValueUnit, ValueUnit)} into another unit of the same identity
 * (which is what depositing does)</li>
 * <li>{@link TokenLedger#burn} by a burn-capability holder</li>
 * <li>{@link #destroyZero(ValueUnit)} when its amount is zero</li>
 * </ul>
 * After that the unit is consumed and every accessor throws
 * {@link ConsumedValueException}. A transaction that ends with an unconsumed unit
 * outside an inventory is rolled back by {@link LedgerHost}, and every unit
 * handed out during a rolled-back transaction is revoked along with it.
 *
 * <p>
 * The identity is fixed for the unit's lifetime.
 *
 * @since 0.1.0
 */
public final class ValueUnit {

    private final AssetIdentity identity;
    private final UnitTracker tracker;
    private final boolean inFlight;
    private long amount;
    private boolean consumed;

    private ValueUnit(
            final AssetIdentity identity,
            final long amount,
            final UnitTracker tracker,
            final boolean inFlight) {
        this.identity = Objects.requireNonNull(identity, "identity");
        this.amount = Amounts.requireNonNegative(amount, "amount");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.inFlight = inFlight;
        if (inFlight) {
            tracker.opened(this);
        }
    }

    /** A unit handed to the caller; must be consumed before commit. */
    static ValueUnit issue(final AssetIdentity identity, final long amount, final UnitTracker tracker) {
        return new ValueUnit(identity, amount, tracker, true);
    }

    /** An empty unit that lives in an inventory slot. */
    static ValueUnit emptySlot(final AssetIdentity identity, final UnitTracker tracker) {
        return new ValueUnit(identity, 0, tracker, false);
    }

    public AssetIdentity identity() {
        ensureLive();
        return identity;
    }

    public long amount() {
        ensureLive();
        return amount;
    }

    public boolean isConsumed() {
        return consumed;
    }

    /**
     * Splits {@code amount} off {@code unit}.
     *
     * @param unit   the unit to decrease in place
     * @param amount the amount to move into the returned unit
     * @return a new unit of {@code amount} with the same identity
     * @throws sh.mintage.core.error.LedgerAbortException with
     *         {@link AbortCode#SPLIT_AMOUNT_EXCEEDS_BALANCE} if {@code unit} holds less
     */
    public static ValueUnit split(final ValueUnit unit, final long amount) {
        Objects.requireNonNull(unit, "unit").ensureLive();
        Amounts.requireNonNegative(amount, "amount");
        if (unit.amount < amount) {
            throw AbortCode.SPLIT_AMOUNT_EXCEEDS_BALANCE.abort(
                    unit.identity + ": split " + amount + " from " + unit.amount);
        }
        unit.amount -= amount;
        return issue(unit.identity, amount, unit.tracker);
    }

    /**
     * Adds {@code src} into {@code dst} and consumes {@code src}.
     *
     * @throws sh.mintage.core.error.LedgerAbortException with
     *         {@link AbortCode#INVALID_MERGE} for different identities or a unit
     *         merged into itself
     */
    public static void merge(final ValueUnit dst, final ValueUnit src) {
        Objects.requireNonNull(dst, "dst").ensureLive();
        Objects.requireNonNull(src, "src").ensureLive();
        if (dst == src) {
            throw AbortCode.INVALID_MERGE.abort(dst.identity + ": unit merged into itself");
        }
        if (!dst.identity.equals(src.identity)) {
            throw AbortCode.INVALID_MERGE.abort(src.identity + " into " + dst.identity);
        }
        dst.amount = Amounts.add(dst.amount, src.amount);
        src.consume();
    }

    /**
     * Consumes an empty unit.
     *
     * @throws sh.mintage.core.error.LedgerAbortException with
     *         {@link AbortCode#DESTROY_NON_ZERO} if the unit still holds value
     */
    public static void destroyZero(final ValueUnit unit) {
        Objects.requireNonNull(unit, "unit").ensureLive();
        if (unit.amount != 0) {
            throw AbortCode.DESTROY_NON_ZERO.abort(unit.identity + " holds " + unit.amount);
        }
        unit.consume();
    }

    /** Decreases a slot unit in place; underflow traps. */
    ValueUnit withdraw(final long requested) {
        ensureLive();
        Amounts.requireNonNegative(requested, "amount");
        amount = Amounts.subtract(amount, requested);
        return issue(identity, requested, tracker);
    }

    void consume() {
        ensureLive();
        consumed = true;
        amount = 0;
        if (inFlight) {
            tracker.settled(this);
        }
    }

    /** Invalidates an in-flight unit whose transaction was rolled back. */
    void revoke() {
        consumed = true;
        amount = 0;
    }

    /** Copy of a slot unit for host snapshots. */
    ValueUnit slotCopy() {
        ensureLive();
        return new ValueUnit(identity, amount, tracker, false);
    }

    private void ensureLive() {
        if (consumed) {
            throw new ConsumedValueException("value unit of " + identity + " was already consumed");
        }
    }

    @Override
    public String toString() {
        return consumed
                ? "ValueUnit[" + identity + ", consumed]"
                : "ValueUnit[" + identity + ", amount=" + amount + "]";
    }
}
