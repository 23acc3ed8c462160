package de.caluga.solo.broadcast;

/**
 * Feature detection and construction of a {@link BroadcastBus}. Participants call
 * {@link #isSupported()} first and fall back to polling when it returns false or
 * {@link #create()} fails.
 */
public interface BroadcastBusFactory {

    boolean isSupported();

    BroadcastBus create() throws BroadcastException;

    /**
     * factory for hosts without any broadcast facility
     */
    static BroadcastBusFactory unsupported() {
        return new BroadcastBusFactory() {
            @Override
            public boolean isSupported() {
                return false;
            }

            @Override
            public BroadcastBus create() throws BroadcastException {
                throw new BroadcastException("broadcast not supported on this host");
            }
        };
    }
}
