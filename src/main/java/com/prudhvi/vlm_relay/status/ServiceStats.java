package com.prudhvi.vlm_relay.status;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * GET /stats response body.
 */
public record ServiceStats(
        @JsonProperty("connected_clients")        int     connectedClients,
        @JsonProperty("total_messages_processed") long    totalMessagesProcessed,
        @JsonProperty("uptime_seconds")           long    uptimeSeconds,
        @JsonProperty("redis_connected")          boolean redisConnected
) {}
