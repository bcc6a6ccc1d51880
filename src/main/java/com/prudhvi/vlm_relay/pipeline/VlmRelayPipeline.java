package com.prudhvi.vlm_relay.pipeline;

import com.prudhvi.vlm_relay.event.CanonicalEvent;
import com.prudhvi.vlm_relay.event.EventFrameEncoder;
import com.prudhvi.vlm_relay.event.EventNormalizer;
import com.prudhvi.vlm_relay.stream.StreamEntry;
import com.prudhvi.vlm_relay.stream.StreamEntryProcessor;
import com.prudhvi.vlm_relay.subscriber.BroadcastFanout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-entry work of the relay: normalize, encode once, broadcast, count.
 *
 * The processed counter goes up once per entry that made it through broadcast,
 * whether or not anyone was connected to receive it.
 *
 * A failure while handling one entry is logged with the raw fields and
 * swallowed here so the reader moves on to the next entry.
 */
@Service
public class VlmRelayPipeline implements StreamEntryProcessor {

    private static final Logger log = LoggerFactory.getLogger(VlmRelayPipeline.class);

    private final EventNormalizer normalizer;
    private final EventFrameEncoder encoder;
    private final BroadcastFanout fanout;

    private final AtomicLong processed = new AtomicLong();

    public VlmRelayPipeline(EventNormalizer normalizer, EventFrameEncoder encoder, BroadcastFanout fanout) {
        this.normalizer = normalizer;
        this.encoder = encoder;
        this.fanout = fanout;
    }

    @Override
    public void process(StreamEntry entry) {
        try {
            CanonicalEvent event = normalizer.normalize(entry.fields(), entry.id());
            String frame = encoder.encode(event);
            fanout.broadcast(frame);
            processed.incrementAndGet();
            log.debug("Processed VLM result {}: frame {}, source {}",
                    event.messageId(), event.frameNumber(), event.sourceId());
        } catch (RuntimeException e) {
            log.error("Error processing VLM message {}: {}", entry.id(), e.getMessage());
            log.error("Raw fields for {}: {}", entry.id(), entry.fields());
        }
    }

    public long getProcessedCount() {
        return processed.get();
    }
}
