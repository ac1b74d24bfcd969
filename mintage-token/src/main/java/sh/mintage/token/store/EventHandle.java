// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import sh.mintage.core.InternalApi;

/**
 * Append-only event log owned by one resource.
 *
 * @param <E> payload type
 * @since 0.1.0
 */
public interface EventHandle<E> {

    EventKey key();

    /**
     * Number of events emitted so far; also the sequence number of the next one.
     */
    long count();

    void emit(E event);

    @InternalApi
    EventHandle<E> copy();
}
