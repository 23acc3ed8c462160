package de.caluga.test.solo.broadcast;

import de.caluga.solo.broadcast.BroadcastMessage;
import de.caluga.solo.broadcast.BroadcastMessageCodec;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BroadcastMessageCodecTest {

    @Test
    void testEnvelope() {
        BroadcastMessage msg = BroadcastMessage.leadershipChanged("participant-1", 1234);
        String json = BroadcastMessageCodec.encode("endpoint-1", "single-owner-my-app", msg);

        assertEquals("endpoint-1", BroadcastMessageCodec.textField(json, "origin"));
        assertEquals("single-owner-my-app", BroadcastMessageCodec.textField(json, "topic"));
        assertNull(BroadcastMessageCodec.textField(json, "sentAt"));
        assertNull(BroadcastMessageCodec.textField(json, "missing"));
        assertEquals(msg, BroadcastMessageCodec.decode(json));
    }

    @Test
    void testInvalidMessagesAreDropped() {
        assertNull(BroadcastMessageCodec.decode(null));
        assertNull(BroadcastMessageCodec.decode(""));
        assertNull(BroadcastMessageCodec.decode("{broken"));
        assertNull(BroadcastMessageCodec.decode("[]"));
        assertNull(BroadcastMessageCodec.decode("{\"kind\":\"CLOSING\",\"senderId\":\"A\"}"));
        assertNull(BroadcastMessageCodec.decode("{\"kind\":\"SHUTDOWN\",\"senderId\":\"A\",\"sentAt\":1}"));
        assertNull(BroadcastMessageCodec.decode("{\"kind\":\"CLOSING\",\"senderId\":1,\"sentAt\":1}"));
        assertNull(BroadcastMessageCodec.textField("{broken", "origin"));
    }
}
