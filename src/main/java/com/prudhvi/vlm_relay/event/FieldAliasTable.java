package com.prudhvi.vlm_relay.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps each canonical field to the source keys producers have used for it.
 *
 * Aliases are consulted in declared order and the first key present in the
 * record wins, even if a later alias is also present. Producers can rename a
 * field by appending the new name here without breaking older producers.
 *
 * The default table matches the DeepStream Redis writer, which emits the first
 * alias of each list.
 */
public final class FieldAliasTable {

    public static final String FRAME_NUMBER = "frame_number";
    public static final String SOURCE_ID    = "source_id";
    public static final String VLM_RESPONSE = "vlm_response";
    public static final String MODEL_NAME   = "model_name";
    public static final String TIMESTAMP    = "timestamp";
    public static final String TYPE         = "type";

    private static final FieldAliasTable DEFAULT;

    static {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put(FRAME_NUMBER, List.of("frame_number", "frame", "frame_num"));
        table.put(SOURCE_ID,    List.of("source_id", "source", "camera_id"));
        table.put(VLM_RESPONSE, List.of("vlm_response", "vlm", "response"));
        table.put(MODEL_NAME,   List.of("model_name", "model"));
        table.put(TIMESTAMP,    List.of("timestamp", "time", "ts"));
        // Message kind has only ever been sent as "type".
        table.put(TYPE,         List.of("type"));
        DEFAULT = new FieldAliasTable(table);
    }

    private final Map<String, List<String>> aliases;

    public FieldAliasTable(Map<String, List<String>> aliases) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        aliases.forEach((field, names) -> copy.put(field, List.copyOf(names)));
        this.aliases = Collections.unmodifiableMap(copy);
    }

    public static FieldAliasTable defaults() {
        return DEFAULT;
    }

    /**
     * Returns the alias list for a canonical field, or an empty list when the
     * field is unknown to this table.
     */
    public List<String> aliasesFor(String canonicalField) {
        return aliases.getOrDefault(canonicalField, List.of());
    }

    public Map<String, List<String>> asMap() {
        return aliases;
    }

    /**
     * Looks up a canonical field in a raw record's fields.
     *
     * @return the value stored under the first alias present in the record,
     *         or empty if none of the aliases appear
     */
    public Optional<String> lookup(Map<String, String> fields, String canonicalField) {
        for (String alias : aliasesFor(canonicalField)) {
            if (fields.containsKey(alias)) {
                return Optional.ofNullable(fields.get(alias));
            }
        }
        return Optional.empty();
    }
}
