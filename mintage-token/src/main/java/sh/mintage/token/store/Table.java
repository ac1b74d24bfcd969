// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Optional;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.UnaryOperator;

import sh.mintage.core.InternalApi;
import sh.mintage.core.error.AbortCode;
import sh.mintage.core.error.LedgerAbortException;

/**
 * Associative table stored inside a resource.
 * <p>
 * Keys are compared structurally ({@code equals}/{@code hashCode}), so records
 * such as an asset identity work as composite keys.
 *
 * @param <K> key type
 * @param <V> value type
 * @since 0.1.0
 */
public interface Table<K, V> {

    boolean contains(K key);

    Optional<V> get(K key);

    /**
     * Returns the value for {@code key}, aborting when absent.
     *
     * @throws LedgerAbortException with {@code ifAbsent} when the key is missing
     */
    V borrow(K key, AbortCode ifAbsent);

    /**
     * Inserts a new entry, aborting when the key already exists.
     *
     * @throws LedgerAbortException with {@code ifPresent} when the key exists
     */
    void add(K key, V value, AbortCode ifPresent);

    /**
     * Inserts or replaces an entry.
     */
    void put(K key, V value);

    int size();

    /**
     * Keys in insertion order, unmodifiable.
     */
    Set<K> keys();

    void forEach(BiConsumer<? super K, ? super V> action);

    /**
     * Copies the table, passing each value through {@code valueCopier}.
     */
    @InternalApi
    Table<K, V> copy(UnaryOperator<V> valueCopier);
}
