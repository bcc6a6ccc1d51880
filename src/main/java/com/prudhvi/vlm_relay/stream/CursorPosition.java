package com.prudhvi.vlm_relay.stream;

/**
 * Last consumed entry id in the upstream log.
 *
 * The sentinel "$" means "only entries appended from now on", so a freshly
 * started reader never replays history. The reader swaps it for the log's
 * concrete last id on first connect; reading from "$" itself would skip
 * anything appended between two reads.
 */
public record CursorPosition(String messageId) {

    public static final String LATEST_SENTINEL = "$";
    public static final String EMPTY_LOG_ID    = "0-0";

    public static CursorPosition latest() {
        return new CursorPosition(LATEST_SENTINEL);
    }

    public static CursorPosition at(String messageId) {
        return new CursorPosition(messageId);
    }

    public boolean isLatest() {
        return LATEST_SENTINEL.equals(messageId);
    }
}
