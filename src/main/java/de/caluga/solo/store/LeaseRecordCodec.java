package de.caluga.solo.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import de.caluga.solo.LeaseRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON wire format of a lease record:
 * <pre>
 * { "ownerId": "participant-...", "acquiredAt": 1700000000000 }
 * </pre>
 * Anything else decodes to {@code null}, which callers treat like an absent record.
 */
public class LeaseRecordCodec {
    public static final String OWNER_ID = "ownerId";
    public static final String ACQUIRED_AT = "acquiredAt";

    private static final Logger log = LoggerFactory.getLogger(LeaseRecordCodec.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private LeaseRecordCodec() {
    }

    public static String encode(LeaseRecord record) {
        ObjectNode node = mapper.createObjectNode();
        node.put(OWNER_ID, record.getOwnerId());
        node.put(ACQUIRED_AT, record.getAcquiredAt());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            //cannot happen for a tree of a string and a long
            throw new IllegalStateException("could not serialize lease record " + record, e);
        }
    }

    public static LeaseRecord decode(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }

        JsonNode node;

        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable lease record ignored: {}", e.getOriginalMessage());
            return null;
        }

        if (node == null || !node.isObject()) {
            log.debug("Lease record is not a json object - ignoring");
            return null;
        }

        JsonNode owner = node.get(OWNER_ID);
        JsonNode acquired = node.get(ACQUIRED_AT);

        if (owner == null || !owner.isTextual() || owner.asText().isEmpty()) {
            log.debug("Lease record without valid {} - ignoring", OWNER_ID);
            return null;
        }

        if (acquired == null || !acquired.isIntegralNumber() || !acquired.canConvertToLong()) {
            log.debug("Lease record without valid {} - ignoring", ACQUIRED_AT);
            return null;
        }

        return new LeaseRecord(owner.asText(), acquired.asLong());
    }
}
