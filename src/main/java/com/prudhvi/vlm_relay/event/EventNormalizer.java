package com.prudhvi.vlm_relay.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a raw stream record into a fully populated {@link CanonicalEvent}.
 *
 * Each field is resolved through the {@link FieldAliasTable} and falls back to
 * its default when no alias is present. Numeric fields that do not parse as
 * integers also fall back to their default, so normalization never fails.
 *
 * Defaults:
 *   frame_number  0
 *   source_id     0
 *   vlm_response  ""
 *   model_name    "default"
 *   timestamp     current wall-clock millis
 *   type          "vlm_result"
 */
@Component
public class EventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(EventNormalizer.class);

    public static final long   DEFAULT_FRAME_NUMBER = 0L;
    public static final long   DEFAULT_SOURCE_ID    = 0L;
    public static final String DEFAULT_VLM_RESPONSE = "";
    public static final String DEFAULT_MODEL_NAME   = "default";
    public static final String DEFAULT_KIND         = "vlm_result";

    private final FieldAliasTable aliasTable;
    private final Clock clock;

    public EventNormalizer(FieldAliasTable aliasTable, Clock clock) {
        this.aliasTable = aliasTable;
        this.clock = clock;
    }

    public CanonicalEvent normalize(Map<String, String> raw, String messageId) {
        return new CanonicalEvent(
                messageId == null ? "" : messageId,
                longField(raw, FieldAliasTable.FRAME_NUMBER, DEFAULT_FRAME_NUMBER),
                longField(raw, FieldAliasTable.SOURCE_ID, DEFAULT_SOURCE_ID),
                textField(raw, FieldAliasTable.VLM_RESPONSE, DEFAULT_VLM_RESPONSE),
                textField(raw, FieldAliasTable.MODEL_NAME, DEFAULT_MODEL_NAME),
                longField(raw, FieldAliasTable.TIMESTAMP, clock.millis()),
                textField(raw, FieldAliasTable.TYPE, DEFAULT_KIND)
        );
    }

    private String textField(Map<String, String> raw, String field, String defaultValue) {
        return aliasTable.lookup(raw, field).orElse(defaultValue);
    }

    private long longField(Map<String, String> raw, String field, long defaultValue) {
        Optional<String> value = aliasTable.lookup(raw, field);
        if (value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.get().trim());
        } catch (NumberFormatException e) {
            log.warn("Unparseable {} '{}' in record {}, using default {}",
                    field, value.get(), raw, defaultValue);
            return defaultValue;
        }
    }
}
