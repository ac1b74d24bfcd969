// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

import sh.mintage.core.error.AbortCode;

/**
 * In-memory {@link Table} backed by an insertion-ordered hash map.
 * <p>
 * Null keys and values are rejected.
 *
 * @param <K> key type
 * @param <V> value type
 * @since 0.1.0
 */
public final class HashTable<K, V> implements Table<K, V> {

    private final Map<K, V> entries;

    public HashTable() {
        this.entries = new LinkedHashMap<>();
    }

    private HashTable(final Map<K, V> entries) {
        this.entries = entries;
    }

    @Override
    public boolean contains(final K key) {
        return entries.containsKey(Objects.requireNonNull(key, "key"));
    }

    @Override
    public Optional<V> get(final K key) {
        return Optional.ofNullable(entries.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public V borrow(final K key, final AbortCode ifAbsent) {
        final V value = entries.get(Objects.requireNonNull(key, "key"));
        if (value == null) {
            throw ifAbsent.abort(String.valueOf(key));
        }
        return value;
    }

    @Override
    public void add(final K key, final V value, final AbortCode ifPresent) {
        Objects.requireNonNull(value, "value");
        if (entries.putIfAbsent(Objects.requireNonNull(key, "key"), value) != null) {
            throw ifPresent.abort(String.valueOf(key));
        }
    }

    @Override
    public void put(final K key, final V value) {
        entries.put(Objects.requireNonNull(key, "key"), Objects.requireNonNull(value, "value"));
    }

    @Override
    public int size() {
        return entries.size();
    }

    @Override
    public Set<K> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    @Override
    public void forEach(final BiConsumer<? super K, ? super V> action) {
        entries.forEach(action);
    }

    @Override
    public Table<K, V> copy(final UnaryOperator<V> valueCopier) {
        final Map<K, V> copied = new LinkedHashMap<>();
        entries.forEach((key, value) -> copied.put(key, valueCopier.apply(value)));
        return new HashTable<>(copied);
    }
}
