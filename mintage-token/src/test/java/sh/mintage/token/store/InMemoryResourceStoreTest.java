// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.mintage.core.types.Address;

class InMemoryResourceStoreTest {

    private static final Address ALICE = Address.parse("0xa");
    private static final Address BOB = Address.parse("0xb");

    /** Minimal resource: a counter with an event log. */
    static final class Counter implements Resource<Counter> {
        long value;
        final EventHandle<String> events;

        Counter(final EventHandle<String> events) {
            this.events = events;
        }

        @Override
        public Counter copy() {
            Counter copy = new Counter(events.copy());
            copy.value = value;
            return copy;
        }
    }

    private InMemoryResourceStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryResourceStore();
    }

    private Counter counterOf(final Address account) {
        return store.getOrCreate(account, Counter.class, () -> new Counter(store.newEventHandle(account)));
    }

    @Test
    void getOrCreatePublishesOnce() {
        Counter first = counterOf(ALICE);
        Counter second = counterOf(ALICE);

        assertSame(first, second);
        assertTrue(store.find(ALICE, Counter.class).isPresent());
        assertTrue(store.find(BOB, Counter.class).isEmpty());
    }

    @Test
    void eventHandlesAreNumberedPerAccount() {
        EventHandle<String> a0 = store.newEventHandle(ALICE);
        EventHandle<String> a1 = store.newEventHandle(ALICE);
        EventHandle<String> b0 = store.newEventHandle(BOB);

        assertEquals(new EventKey(ALICE, 0), a0.key());
        assertEquals(new EventKey(ALICE, 1), a1.key());
        assertEquals(new EventKey(BOB, 0), b0.key());
    }

    @Test
    void eventsCarryPerHandleSequenceNumbers() {
        EventHandle<String> a = store.newEventHandle(ALICE);
        EventHandle<String> b = store.newEventHandle(BOB);
        a.emit("one");
        b.emit("two");
        a.emit("three");

        assertEquals(3, store.eventCount());
        assertEquals(2, a.count());
        assertEquals(1, store.events().get(2).sequenceNumber());
        assertEquals("three", store.eventsFor(a.key()).get(1).payload());
        assertEquals(1, store.eventsFor(b.key()).size());
    }

    @Test
    void restoreUndoesWritesEventsAndPublications() {
        Counter alice = counterOf(ALICE);
        alice.value = 5;
        alice.events.emit("before");

        InMemoryResourceStore.Snapshot snapshot = store.snapshot();
        alice.value = 9;
        alice.events.emit("during");
        counterOf(BOB);

        store.restore(snapshot);

        Counter restored = store.find(ALICE, Counter.class).orElseThrow();
        assertEquals(5, restored.value);
        assertEquals(1, restored.events.count());
        assertEquals(1, store.eventCount());
        assertTrue(store.find(BOB, Counter.class).isEmpty());
        // creation numbers rewind too
        assertEquals(new EventKey(BOB, 0), store.newEventHandle(BOB).key());
    }

    @Test
    void snapshotCanOnlyBeRestoredOnce() {
        InMemoryResourceStore.Snapshot snapshot = store.snapshot();
        store.restore(snapshot);

        assertThrows(IllegalStateException.class, () -> store.restore(snapshot));
    }
}
