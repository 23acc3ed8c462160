package de.caluga.solo.broadcast;

import de.caluga.solo.Subscription;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.MulticastSocket;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.net.StandardSocketOptions;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * Broadcast bus for participants living in different processes on one machine.
 * Messages are JSON datagrams sent to a multicast group on the loopback interface.
 * Hosts whose loopback interface does not support multicast report
 * {@link #factory()} as unsupported.
 */
public class MulticastBroadcastBus implements BroadcastBus, Runnable {
    public static final String DEFAULT_GROUP = "239.255.77.77";
    public static final int DEFAULT_PORT = 47077;
    private static final int MAX_DATAGRAM = 1024;

    private static final Logger log = LoggerFactory.getLogger(MulticastBroadcastBus.class);

    private final EnvelopeDispatcher dispatcher = new EnvelopeDispatcher(new ObjectId().toHexString());
    private final InetSocketAddress group;
    private final NetworkInterface networkInterface;
    private final MulticastSocket socket;
    private final Thread receiverThread;
    private volatile boolean running = true;

    public MulticastBroadcastBus(String groupAddress, int port) throws BroadcastException {
        MulticastSocket s = null;

        try {
            this.group = new InetSocketAddress(InetAddress.getByName(groupAddress), port);
            this.networkInterface = loopbackInterface();

            if (networkInterface == null) {
                throw new BroadcastException("no loopback interface found");
            }

            s = new MulticastSocket(port);
            s.setOption(StandardSocketOptions.IP_MULTICAST_IF, networkInterface);
            s.setOption(StandardSocketOptions.IP_MULTICAST_LOOP, true);
            s.joinGroup(group, networkInterface);
        } catch (IOException | IllegalArgumentException e) {
            if (s != null) {
                s.close();
            }

            throw new BroadcastException("could not open multicast socket on " + groupAddress + ":" + port, e);
        }

        socket = s;
        receiverThread = new Thread(this);
        receiverThread.setDaemon(true);
        receiverThread.setName("solo-multicast-" + port);
        receiverThread.start();
        log.debug("Multicast bus {} joined {}", dispatcher.getOrigin(), group);
    }

    public static BroadcastBusFactory factory() {
        return factory(DEFAULT_GROUP, DEFAULT_PORT);
    }

    public static BroadcastBusFactory factory(String groupAddress, int port) {
        return new BroadcastBusFactory() {
            @Override
            public boolean isSupported() {
                return isMulticastSupported();
            }

            @Override
            public BroadcastBus create() throws BroadcastException {
                return new MulticastBroadcastBus(groupAddress, port);
            }
        };
    }

    public static boolean isMulticastSupported() {
        try {
            NetworkInterface ni = loopbackInterface();
            return ni != null && ni.isUp() && ni.supportsMulticast();
        } catch (SocketException e) {
            log.debug("multicast detection failed: {}", e.getMessage());
            return false;
        }
    }

    private static NetworkInterface loopbackInterface() throws SocketException {
        return NetworkInterface.getByInetAddress(InetAddress.getLoopbackAddress());
    }

    /**
     * id of this endpoint, sent with every datagram
     */
    public String getOrigin() {
        return dispatcher.getOrigin();
    }

    @Override
    public void publish(String topic, BroadcastMessage message) throws BroadcastException {
        if (!running) {
            throw new BroadcastException("bus is closed");
        }

        byte[] payload = BroadcastMessageCodec.encode(dispatcher.getOrigin(), topic, message).getBytes(StandardCharsets.UTF_8);

        if (payload.length > MAX_DATAGRAM) {
            throw new BroadcastException("message too large for a datagram: " + payload.length + " bytes");
        }

        try {
            socket.send(new DatagramPacket(payload, payload.length, group));
        } catch (IOException e) {
            throw new BroadcastException("could not send datagram", e);
        }
    }

    @Override
    public Subscription subscribe(String topic, Consumer<BroadcastMessage> callback) throws BroadcastException {
        if (!running) {
            throw new BroadcastException("bus is closed");
        }

        return dispatcher.subscribe(topic, callback);
    }

    @Override
    public void run() {
        byte[] buffer = new byte[MAX_DATAGRAM];

        while (running) {
            DatagramPacket packet = new DatagramPacket(buffer, buffer.length);

            try {
                socket.receive(packet);
            } catch (IOException e) {
                if (running) {
                    log.warn("Error receiving datagram - continuing: {}", e.getMessage());
                }
                continue;
            }

            dispatcher.dispatch(new String(packet.getData(), packet.getOffset(), packet.getLength(), StandardCharsets.UTF_8));
        }

        log.debug("Multicast receiver {} finished", dispatcher.getOrigin());
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void close() {
        if (!running) {
            return;
        }

        running = false;
        dispatcher.close();

        try {
            socket.leaveGroup(group, networkInterface);
        } catch (IOException e) {
            log.debug("leaving multicast group failed: {}", e.getMessage());
        }

        //unblocks receive()
        socket.close();
    }
}
