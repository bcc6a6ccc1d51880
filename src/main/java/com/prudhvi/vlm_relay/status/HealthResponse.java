package com.prudhvi.vlm_relay.status;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /health response body. redisStatus is "connected" or "disconnected";
 * timestamp is wall-clock millis at the time of the request.
 */
public record HealthResponse(
        @JsonProperty("status")                   String status,
        @JsonProperty("service")                  String service,
        @JsonProperty("redis_status")             String redisStatus,
        @JsonProperty("connected_clients")        int    connectedClients,
        @JsonProperty("total_messages_processed") long   totalMessagesProcessed,
        @JsonProperty("uptime_seconds")           long   uptimeSeconds,
        @JsonProperty("timestamp")                long   timestamp
) {}
