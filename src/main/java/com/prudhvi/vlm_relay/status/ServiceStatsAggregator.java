package com.prudhvi.vlm_relay.status;

import com.prudhvi.vlm_relay.pipeline.VlmRelayPipeline;
import com.prudhvi.vlm_relay.stream.StreamLogClient;
import com.prudhvi.vlm_relay.subscriber.SubscriberRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Read-only view over the registry, pipeline counter and upstream client.
 * Holds no state of its own beyond the service start time.
 */
@Service
public class ServiceStatsAggregator {

    public static final String SERVICE_NAME = "VLM WebSocket Service";

    private final SubscriberRegistry registry;
    private final VlmRelayPipeline pipeline;
    private final StreamLogClient upstream;
    private final Clock clock;
    private final Instant startedAt;

    public ServiceStatsAggregator(SubscriberRegistry registry, VlmRelayPipeline pipeline,
                                  StreamLogClient upstream, Clock clock) {
        this.registry = registry;
        this.pipeline = pipeline;
        this.upstream = upstream;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public ServiceStats stats() {
        return new ServiceStats(
                registry.count(),
                pipeline.getProcessedCount(),
                uptimeSeconds(),
                upstream.isConnected());
    }

    public HealthResponse health() {
        ServiceStats stats = stats();
        return new HealthResponse(
                "healthy",
                SERVICE_NAME,
                stats.redisConnected() ? "connected" : "disconnected",
                stats.connectedClients(),
                stats.totalMessagesProcessed(),
                stats.uptimeSeconds(),
                clock.millis());
    }

    private long uptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).getSeconds();
    }
}
