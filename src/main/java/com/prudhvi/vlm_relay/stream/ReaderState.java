package com.prudhvi.vlm_relay.stream;

public enum ReaderState {
    DISCONNECTED,
    CONNECTED_IDLE,
    CONNECTED_READING
}
