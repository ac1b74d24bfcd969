// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.mintage.token.event;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import sh.mintage.core.types.Address;
import sh.mintage.token.AssetIdentity;
import sh.mintage.token.LedgerHost;
import sh.mintage.token.store.EventKey;
import sh.mintage.token.store.EventRecord;

class EventJsonTest {

    private static final Address CREATOR = Address.parse("0xc");
    private static final AssetIdentity A = AssetIdentity.of(CREATOR, "Sets", "A");

    @Test
    void depositedRecordShape() {
        EventRecord<Deposited> record = new EventRecord<>(new EventKey(CREATOR, 4), 2, new Deposited(A, 5));

        ObjectNode tree = EventJson.toTree(record);

        assertEquals("Deposited", tree.get("type").asText());
        assertEquals(CREATOR.value(), tree.get("key").get("account").asText());
        assertEquals(4, tree.get("key").get("creationNumber").asLong());
        assertEquals(2, tree.get("sequenceNumber").asLong());
        assertEquals(CREATOR.value(), tree.get("data").get("identity").get("creator").asText());
        assertEquals("Sets", tree.get("data").get("identity").get("collection").asText());
        assertEquals("A", tree.get("data").get("identity").get("name").asText());
        assertEquals(5, tree.get("data").get("amount").asLong());
    }

    @Test
    void unlimitedCollectionHasNullMaximum() {
        EventRecord<CollectionCreated> record = new EventRecord<>(
                new EventKey(CREATOR, 0), 0, new CollectionCreated(CREATOR, "Sets", "uri", "desc", null));

        JsonNode data = EventJson.toTree(record).get("data");

        assertTrue(data.get("maximum").isNull());
        assertEquals("uri", data.get("uri").asText());
    }

    @Test
    void tokenTypeCreatedIncludesMetadata() throws Exception {
        LedgerHost host = new LedgerHost();
        host.run("setup", l -> {
            l.createCollection(CREATOR, "Sets", "desc", "uri", null);
            l.createTokenType(CREATOR, "Sets", "A", "first", false, 0, 3L, "https://a.example", 10);
        });
        EventRecord<?> created = host.store().events().get(1);

        JsonNode json = new ObjectMapper().readTree(EventJson.toJson(created));

        assertEquals("TokenTypeCreated", json.get("type").asText());
        JsonNode metadata = json.get("data").get("metadata");
        assertEquals(3, metadata.get("maximum").asLong());
        assertTrue(metadata.get("supply").isNull());
        assertEquals(10, metadata.get("royalty").get("rate").asLong());
        assertFalse(metadata.has("supplyTracked"));
    }

    @Test
    void jsonLinesHasOneObjectPerLine() {
        List<EventRecord<?>> records = List.of(
                new EventRecord<>(new EventKey(CREATOR, 5), 0, new Withdrawn(A, 1)),
                new EventRecord<>(new EventKey(CREATOR, 4), 0, new Deposited(A, 1)));

        String lines = EventJson.toJsonLines(records);

        String[] split = lines.split("\n");
        assertEquals(2, split.length);
        assertTrue(split[0].startsWith("{\"type\":\"Withdrawn\""));
        assertTrue(split[1].startsWith("{\"type\":\"Deposited\""));
    }
}
