package com.prudhvi.vlm_relay.subscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

/**
 * Pushes one encoded frame to every registered subscriber.
 *
 * A failed write is treated as a disconnect: that subscriber is removed (which
 * closes it) and delivery carries on with the rest. Handles registered by the
 * WebSocket transport are {@link QueuedSubscriberHandle}s, so a write here only
 * enqueues and a stalled socket cannot hold up the loop. Nothing is buffered for
 * subscribers that connect later, so delivery is at most once per subscriber
 * connected at the time of the broadcast.
 */
@Component
public class BroadcastFanout {

    private static final Logger log = LoggerFactory.getLogger(BroadcastFanout.class);

    private final SubscriberRegistry registry;

    public BroadcastFanout(SubscriberRegistry registry) {
        this.registry = registry;
    }

    /**
     * @return number of subscribers the frame was delivered to
     */
    public int broadcast(String eventJson) {
        List<Subscriber> recipients = registry.snapshot();
        if (recipients.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (Subscriber subscriber : recipients) {
            try {
                subscriber.getHandle().send(eventJson);
                subscriber.recordDelivery();
                delivered++;
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to send to client {}: {}", subscriber.getId(), e.getMessage());
                registry.remove(subscriber.getId());
            }
        }

        log.debug("Broadcast to {}/{} clients", delivered, recipients.size());
        return delivered;
    }
}
