package de.caluga.solo.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON envelope for messages travelling over the network:
 * <pre>
 * { "origin": "...", "topic": "...", "kind": "CLOSING", "senderId": "...", "sentAt": 1700000000000 }
 * </pre>
 * {@code origin} identifies the sending bus endpoint, so an endpoint can drop its own
 * datagrams.
 */
public class BroadcastMessageCodec {
    private static final Logger log = LoggerFactory.getLogger(BroadcastMessageCodec.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private BroadcastMessageCodec() {
    }

    public static String encode(String origin, String topic, BroadcastMessage msg) {
        ObjectNode node = mapper.createObjectNode();
        node.put("origin", origin);
        node.put("topic", topic);
        node.put("kind", msg.getKind().name());
        node.put("senderId", msg.getSenderId());
        node.put("sentAt", msg.getSentAt());

        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("could not serialize " + msg, e);
        }
    }

    /**
     * @return a text field of an encoded envelope, null if missing or unparsable
     */
    public static String textField(String json, String field) {
        JsonNode node = parse(json);

        if (node == null || !node.path(field).isTextual()) {
            return null;
        }

        return node.get(field).asText();
    }

    /**
     * @return the decoded message, null for anything that is not a valid envelope
     */
    public static BroadcastMessage decode(String json) {
        JsonNode node = parse(json);

        if (node == null) {
            return null;
        }

        JsonNode kind = node.get("kind");
        JsonNode sender = node.get("senderId");
        JsonNode sentAt = node.get("sentAt");

        if (kind == null || !kind.isTextual() || sender == null || !sender.isTextual() || sentAt == null || !sentAt.isIntegralNumber()) {
            log.debug("ignoring incomplete broadcast message");
            return null;
        }

        try {
            return new BroadcastMessage(BroadcastMessage.Kind.valueOf(kind.asText()), sender.asText(), sentAt.asLong());
        } catch (IllegalArgumentException e) {
            log.debug("ignoring broadcast message of unknown kind {}", kind.asText());
            return null;
        }
    }

    private static JsonNode parse(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }

        try {
            JsonNode node = mapper.readTree(json);
            return node != null && node.isObject() ? node : null;
        } catch (JsonProcessingException e) {
            log.debug("ignoring unparsable broadcast message: {}", e.getOriginalMessage());
            return null;
        }
    }
}
