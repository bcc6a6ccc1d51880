package com.prudhvi.vlm_relay.subscriber;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One connected client, owned by the {@link SubscriberRegistry}.
 * The transport layer only keeps the id.
 */
public class Subscriber {

    private final String id;
    private final Instant connectedAt;
    private final SubscriberHandle handle;
    private final AtomicLong messagesSent = new AtomicLong();

    public Subscriber(String id, Instant connectedAt, SubscriberHandle handle) {
        this.id = id;
        this.connectedAt = connectedAt;
        this.handle = handle;
    }

    public String getId() {
        return id;
    }

    public Instant getConnectedAt() {
        return connectedAt;
    }

    public SubscriberHandle getHandle() {
        return handle;
    }

    public long getMessagesSent() {
        return messagesSent.get();
    }

    void recordDelivery() {
        messagesSent.incrementAndGet();
    }
}
