package com.prudhvi.vlm_relay.stream;

/**
 * Downstream step the cursor reader hands each entry to, in log order.
 * The cursor advances past an entry only once this returns.
 */
@FunctionalInterface
public interface StreamEntryProcessor {

    void process(StreamEntry entry);
}
