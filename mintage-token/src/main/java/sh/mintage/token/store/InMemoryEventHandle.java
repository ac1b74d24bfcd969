// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * {@link EventHandle} that forwards every emitted event to a shared stream.
 *
 * @param <E> payload type
 * @since 0.1.0
 */
final class InMemoryEventHandle<E> implements EventHandle<E> {

    private final EventKey key;
    private final Consumer<EventRecord<?>> stream;
    private long count;

    InMemoryEventHandle(final EventKey key, final Consumer<EventRecord<?>> stream) {
        this(key, stream, 0);
    }

    private InMemoryEventHandle(final EventKey key, final Consumer<EventRecord<?>> stream, final long count) {
        this.key = Objects.requireNonNull(key, "key");
        this.stream = Objects.requireNonNull(stream, "stream");
        this.count = count;
    }

    @Override
    public EventKey key() {
        return key;
    }

    @Override
    public long count() {
        return count;
    }

    @Override
    public void emit(final E event) {
        stream.accept(new EventRecord<>(key, count, event));
        count++;
    }

    @Override
    public EventHandle<E> copy() {
        return new InMemoryEventHandle<>(key, stream, count);
    }
}
