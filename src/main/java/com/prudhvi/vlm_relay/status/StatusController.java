package com.prudhvi.vlm_relay.status;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.prudhvi.vlm_relay.config.RelayProperties;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read-only status endpoints for dashboards and container health checks.
 *
 * GET /        service descriptor with the other endpoint paths
 * GET /health  liveness plus Redis status and counters
 * GET /stats   counters only
 */
@RestController
public class StatusController {

    public record ServiceDescriptor(
            @JsonProperty("service")            String service,
            @JsonProperty("version")            String version,
            @JsonProperty("description")        String description,
            @JsonProperty("websocket_endpoint") String websocketEndpoint,
            @JsonProperty("health_check")       String healthCheck,
            @JsonProperty("statistics")         String statistics
    ) {}

    private final ServiceStatsAggregator aggregator;
    private final ServiceDescriptor descriptor;

    public StatusController(ServiceStatsAggregator aggregator, RelayProperties properties) {
        this.aggregator = aggregator;
        this.descriptor = new ServiceDescriptor(
                ServiceStatsAggregator.SERVICE_NAME,
                "1.0.0",
                "WebSocket streaming of VLM results from DeepStream",
                properties.getWebsocket().getPath(),
                "/health",
                "/stats");
    }

    @GetMapping("/")
    public ServiceDescriptor root() {
        return descriptor;
    }

    @GetMapping("/health")
    public HealthResponse health() {
        return aggregator.health();
    }

    @GetMapping("/stats")
    public ServiceStats stats() {
        return aggregator.stats();
    }
}
