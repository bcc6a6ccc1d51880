package com.prudhvi.vlm_relay.stream;

/**
 * The upstream log cannot be reached. The reader reacts by dropping to the
 * DISCONNECTED state and reconnecting; any other read failure is retried in place.
 */
public class UpstreamUnavailableException extends RuntimeException {

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
