// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import sh.mintage.core.error.EventEncodingException;
import sh.mintage.token.store.EventRecord;

/**
 * Renders event records as JSON for off-chain indexers.
 *
 * <p>
 * Shape of one record:
 * <pre>{@code
 * {
 *   "type": "Deposited",
 *   "key": {"account": "0x00..0c", "creationNumber": 2},
 *   "sequenceNumber": 0,
 *   "data": {"identity": {"creator": "0x00..0c", "collection": "Sets", "name": "A"}, "amount": 5}
 * }
 * }</pre>
 * Addresses are written in full 64-digit form.
 *
 * @since 0.1.0
 */
public final class EventJson {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private EventJson() {
    }

    /**
     * Converts one record into a JSON tree.
     */
    public static ObjectNode toTree(final EventRecord<?> record) {
        Objects.requireNonNull(record, "record");
        final ObjectNode node = MAPPER.createObjectNode();
        node.put("type", record.payload().getClass().getSimpleName());
        final ObjectNode key = node.putObject("key");
        key.put("account", record.key().account().value());
        key.put("creationNumber", record.key().creationNumber());
        node.put("sequenceNumber", record.sequenceNumber());
        try {
            node.set("data", MAPPER.valueToTree(record.payload()));
        } catch (IllegalArgumentException e) {
            throw new EventEncodingException("Unable to encode event " + record.key() + "/" + record.sequenceNumber(), e);
        }
        return node;
    }

    /**
     * Serializes one record as a compact JSON object.
     */
    public static String toJson(final EventRecord<?> record) {
        final ObjectNode tree = toTree(record);
        try {
            return MAPPER.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new EventEncodingException("Unable to write event " + record.key() + "/" + record.sequenceNumber(), e);
        }
    }

    /**
     * Serializes records as newline-delimited JSON, one object per line.
     */
    public static String toJsonLines(final List<EventRecord<?>> records) {
        Objects.requireNonNull(records, "records");
        final StringBuilder out = new StringBuilder();
        for (EventRecord<?> record : records) {
            out.append(toJson(record)).append('\n');
        }
        return out.toString();
    }
}
