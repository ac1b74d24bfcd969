// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.store;

import java.util.Objects;

/**
 * One entry of the append-only event stream.
 *
 * @param key            the handle that emitted the event
 * @param sequenceNumber the event's position within that handle, starting at 0
 * @param payload        the event itself
 * @param <E>            payload type
 * @since 0.1.0
 */
public record EventRecord<E>(EventKey key, long sequenceNumber, E payload) {

    public EventRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(payload, "payload");
    }
}
