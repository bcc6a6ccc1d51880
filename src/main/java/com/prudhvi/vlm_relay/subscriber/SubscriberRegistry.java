package com.prudhvi.vlm_relay.subscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe registry of every open subscriber connection.
 *
 * WebSocket threads add and remove entries while the stream reader thread
 * broadcasts. ConcurrentHashMap gives O(1) add/remove without blocking the
 * broadcast, and {@link #snapshot()} copies the current values so the fan-out
 * never holds any lock while it writes to a slow socket.
 *
 * One instance per process, created by Spring at startup.
 */
@Component
public class SubscriberRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriberRegistry.class);

    private final Map<String, Subscriber> subscribers = new ConcurrentHashMap<>();

    public void add(Subscriber subscriber) {
        subscribers.put(subscriber.getId(), subscriber);
        log.info("Client {} connected. Total: {}", subscriber.getId(), subscribers.size());
    }

    /**
     * Removes a subscriber and closes its handle. Removing an unknown or
     * already removed id is a no-op.
     *
     * @return true if this call removed it
     */
    public boolean remove(String id) {
        Subscriber removed = id == null ? null : subscribers.remove(id);
        if (removed == null) {
            return false;
        }
        log.info("Client {} disconnected. Total: {}", id, subscribers.size());
        try {
            removed.getHandle().close();
        } catch (RuntimeException e) {
            log.debug("Closing handle of client {} failed: {}", id, e.getMessage());
        }
        return true;
    }

    /**
     * Point-in-time copy for one broadcast pass. Subscribers that connect after
     * the copy is taken are not part of this pass.
     */
    public List<Subscriber> snapshot() {
        return List.copyOf(subscribers.values());
    }

    public int count() {
        return subscribers.size();
    }
}
