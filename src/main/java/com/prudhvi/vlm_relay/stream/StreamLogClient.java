package com.prudhvi.vlm_relay.stream;

import java.time.Duration;
import java.util.List;

/**
 * Blocking tail of an ordered, append-only log.
 */
public interface StreamLogClient {

    /**
     * Opens (or re-validates) the upstream connection.
     *
     * @return true if the upstream answered, false otherwise; never throws
     */
    boolean connect();

    /**
     * Marks the upstream as disconnected. Safe to call repeatedly.
     */
    void disconnect();

    /**
     * Whether the last connect succeeded and no connectivity loss has been seen since.
     */
    boolean isConnected();

    /**
     * Id of the newest entry currently in the log, or "0-0" if it is empty or
     * does not exist yet. Used to pin the "$" start to a concrete position.
     *
     * @throws UpstreamUnavailableException if the upstream connection is lost
     */
    String latestId();

    /**
     * Returns entries strictly after {@code position}, in log order, waiting up
     * to {@code maxWait} for at least one to arrive.
     *
     * @return zero to {@code maxCount} entries; never null
     * @throws UpstreamUnavailableException if the upstream connection is lost
     */
    List<StreamEntry> readAfter(String position, Duration maxWait, int maxCount);
}
