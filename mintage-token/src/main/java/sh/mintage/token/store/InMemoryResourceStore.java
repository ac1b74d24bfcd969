// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import sh.mintage.core.types.Address;

/**
 * Heap-backed {@link ResourceStore} with snapshot and restore.
 *
 * <p>
 * Used as the host for tests and embedded ledgers. All emitted events land in a
 * single ordered stream, readable through {@link #events()} and
 * {@link #eventsFor(EventKey)}.
 *
 * <p>
 * <strong>Rollback:</strong> {@link #snapshot()} deep-copies every resource and
 * remembers the stream length; {@link #restore(Snapshot)} reinstates the copies
 * and drops events emitted since. A snapshot may be restored at most once.
 *
 * <pre>{@code
 * InMemoryResourceStore.Snapshot before = store.snapshot();
 * try {
 *     ledger.directTransfer(sender, receiver, identity, 5);
 * } catch (LedgerAbortException e) {
 *     store.restore(before);
 *     throw e;
 * }
 * }</pre>
 *
 * <p>
 * Not thread-safe; the host serializes transactions.
 *
 * @since 0.1.0
 */
public final class InMemoryResourceStore implements ResourceStore {

    private record ResourceKey(Address account, Class<?> type) {
    }

    /**
     * Opaque pre-transaction state.
     */
    public static final class Snapshot {
        private final Map<ResourceKey, Resource<?>> resources;
        private final Map<Address, Long> creationNumbers;
        private final int eventCount;
        private boolean restored;

        private Snapshot(
                final Map<ResourceKey, Resource<?>> resources,
                final Map<Address, Long> creationNumbers,
                final int eventCount) {
            this.resources = resources;
            this.creationNumbers = creationNumbers;
            this.eventCount = eventCount;
        }
    }

    private Map<ResourceKey, Resource<?>> resources = new LinkedHashMap<>();
    private Map<Address, Long> creationNumbers = new HashMap<>();
    private final List<EventRecord<?>> events = new ArrayList<>();

    @Override
    public <R extends Resource<R>> Optional<R> find(final Address account, final Class<R> type) {
        return Optional.ofNullable(type.cast(resources.get(key(account, type))));
    }

    @Override
    public <R extends Resource<R>> R getOrCreate(
            final Address account, final Class<R> type, final Supplier<R> factory) {
        final ResourceKey key = key(account, type);
        final Resource<?> existing = resources.get(key);
        if (existing != null) {
            return type.cast(existing);
        }
        final R created = Objects.requireNonNull(factory.get(), "factory returned null");
        resources.put(key, created);
        return created;
    }

    @Override
    public <E> EventHandle<E> newEventHandle(final Address account) {
        Objects.requireNonNull(account, "account");
        final long creationNumber = creationNumbers.merge(account, 1L, Long::sum) - 1;
        return new InMemoryEventHandle<>(new EventKey(account, creationNumber), events::add);
    }

    /**
     * Every event emitted so far, in emission order.
     */
    public List<EventRecord<?>> events() {
        return List.copyOf(events);
    }

    /**
     * Events emitted by one handle, in sequence order.
     */
    public List<EventRecord<?>> eventsFor(final EventKey key) {
        Objects.requireNonNull(key, "key");
        return events.stream().filter(record -> record.key().equals(key)).toList();
    }

    public int eventCount() {
        return events.size();
    }

    public Snapshot snapshot() {
        final Map<ResourceKey, Resource<?>> copied = new LinkedHashMap<>();
        resources.forEach((key, resource) -> copied.put(key, resource.copy()));
        return new Snapshot(copied, new HashMap<>(creationNumbers), events.size());
    }

    public void restore(final Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot");
        if (snapshot.restored) {
            throw new IllegalStateException("snapshot already restored");
        }
        snapshot.restored = true;
        resources = snapshot.resources;
        creationNumbers = snapshot.creationNumbers;
        events.subList(snapshot.eventCount, events.size()).clear();
    }

    private static ResourceKey key(final Address account, final Class<?> type) {
        return new ResourceKey(Objects.requireNonNull(account, "account"), Objects.requireNonNull(type, "type"));
    }
}
