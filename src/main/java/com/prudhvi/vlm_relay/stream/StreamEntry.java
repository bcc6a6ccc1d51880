package com.prudhvi.vlm_relay.stream;

import java.util.Map;

/**
 * One entry read from the upstream log.
 *
 * id:     the log-assigned entry id (e.g. "1700000000000-0"), increasing in log order
 * fields: raw field/value pairs in the order the producer wrote them
 */
public record StreamEntry(String id, Map<String, String> fields) {}
