// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.mintage.core.DebugLogger;
import sh.mintage.core.LogFormatter;
import sh.mintage.core.error.LedgerAbortException;
import sh.mintage.core.error.UnconsumedValueException;
import sh.mintage.token.store.EventRecord;
import sh.mintage.token.store.InMemoryResourceStore;

/**
 * Runs ledger operations as all-or-nothing transactions over an
 * {@link InMemoryResourceStore}.
 *
 * <p>
 * Each {@link #execute} call snapshots the store, runs the body against the
 * ledger, then either commits or restores the snapshot:
 * <ul>
 * <li>any {@link RuntimeException} from the body rolls back and is rethrown
 * unchanged</li>
 * <li>a body that returns while value units are still in flight rolls back and
 * fails with {@link UnconsumedValueException}</li>
 * </ul>
 *
 * <pre>{@code
 * LedgerHost host = new LedgerHost();
 * host.run("createCollection", ledger ->
 *         ledger.createCollection(creator, "Sets", "A set", "https://sets.example", null));
 * AssetIdentity id = host.execute("createTokenType", ledger ->
 *         ledger.createTokenType(creator, "Sets", "A", "first", true, 10, null, "https://a.example", 0));
 * }</pre>
 *
 * <p>
 * Transactions are serialized. Snapshots copy the whole store, so cost grows with
 * state size.
 *
 * @since 0.1.0
 */
public final class LedgerHost {

    private static final Logger LOG = LoggerFactory.getLogger(LedgerHost.class);

    private final InMemoryResourceStore store;
    private final TokenLedger ledger;

    public LedgerHost() {
        this(new InMemoryResourceStore(), LedgerConfig.defaults());
    }

    public LedgerHost(final LedgerConfig config) {
        this(new InMemoryResourceStore(), config);
    }

    public LedgerHost(final InMemoryResourceStore store, final LedgerConfig config) {
        this.store = Objects.requireNonNull(store, "store");
        this.ledger = new TokenLedger(store, config);
    }

    /**
     * The ledger, for read-only queries. Writes made outside {@link #execute}
     * are not rolled back.
     */
    public TokenLedger ledger() {
        return ledger;
    }

    public InMemoryResourceStore store() {
        return store;
    }

    /**
     * Runs {@code body} as one transaction.
     *
     * @param transaction label used in logs and errors
     * @param body        the operations to run
     * @return whatever {@code body} returns
     * @throws LedgerAbortException     if the body aborts; state is unchanged
     * @throws UnconsumedValueException if the body leaves a value unit unconsumed;
     *                                  state is unchanged
     */
    public synchronized <T> T execute(final String transaction, final Function<TokenLedger, T> body) {
        Objects.requireNonNull(transaction, "transaction");
        Objects.requireNonNull(body, "body");

        if (ledger.outstandingUnits() != 0) {
            LOG.warn("Discarding {} value unit(s) created outside a transaction", ledger.outstandingUnits());
            ledger.discardOutstandingUnits();
        }

        final InMemoryResourceStore.Snapshot before = store.snapshot();
        final int eventsBefore = store.eventCount();
        final T result;
        try {
            result = body.apply(ledger);
        } catch (RuntimeException e) {
            rollback(before);
            logAbort(transaction, e);
            throw e;
        }

        final long outstanding = ledger.outstandingUnits();
        if (outstanding != 0) {
            rollback(before);
            final UnconsumedValueException e = new UnconsumedValueException(transaction, outstanding);
            logAbort(transaction, e);
            throw e;
        }

        logCommit(transaction, eventsBefore);
        return result;
    }

    /**
     * {@link #execute} for bodies without a result.
     */
    public void run(final String transaction, final Consumer<TokenLedger> body) {
        Objects.requireNonNull(body, "body");
        execute(transaction, l -> {
            body.accept(l);
            return null;
        });
    }

    private void rollback(final InMemoryResourceStore.Snapshot before) {
        store.restore(before);
        ledger.discardOutstandingUnits();
    }

    private static void logAbort(final String transaction, final RuntimeException e) {
        final String code;
        final String reason;
        if (e instanceof LedgerAbortException abort) {
            code = abort.code().name();
            reason = abort.detail() != null ? abort.detail() : abort.category().name();
        } else {
            code = e.getClass().getSimpleName();
            reason = String.valueOf(e.getMessage());
        }
        LOG.debug("Rolled back transaction '{}': {}", transaction, e.getMessage());
        DebugLogger.logLedger(LogFormatter.formatAbort(transaction, code, reason));
    }

    private void logCommit(final String transaction, final int eventsBefore) {
        final List<EventRecord<?>> emitted = store.events().subList(eventsBefore, store.eventCount());
        for (EventRecord<?> record : emitted) {
            DebugLogger.logEvent(LogFormatter.formatEvent(
                    record.key().toString(),
                    record.sequenceNumber(),
                    record.payload().getClass().getSimpleName()));
        }
        DebugLogger.logLedger(LogFormatter.formatCommit(transaction, emitted.size()));
    }
}
