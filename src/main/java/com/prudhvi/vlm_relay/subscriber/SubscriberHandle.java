package com.prudhvi.vlm_relay.subscriber;

import java.io.IOException;

/**
 * Outbound side of one live connection, as seen by the fan-out.
 * The transport layer supplies the implementation.
 */
public interface SubscriberHandle {

    /**
     * Writes one text frame.
     *
     * @throws IOException if the connection is closed, timed out or otherwise unusable
     */
    void send(String text) throws IOException;

    /**
     * Closes the connection. Called after a failed delivery; must tolerate an
     * already closed connection.
     */
    void close();
}
