package com.prudhvi.vlm_relay.stream;

import com.prudhvi.vlm_relay.config.RelayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Tails the upstream log from a resumable cursor and feeds each entry, in log
 * order, to the {@link StreamEntryProcessor}.
 *
 * Runs as a state machine on a single dedicated thread:
 *
 *   DISCONNECTED       connect ok  -> CONNECTED_IDLE ("$" pinned to the log's last id)
 *                      connect bad -> wait reconnectBackoff, stay
 *   CONNECTED_IDLE     begin read  -> CONNECTED_READING
 *   CONNECTED_READING  batch done  -> CONNECTED_IDLE (cursor at last entry)
 *                      upstream lost -> DISCONNECTED, wait reconnectBackoff
 *                      other error -> CONNECTED_IDLE, wait readErrorBackoff, same cursor
 *
 * The cursor starts at "$". On the first successful connect it is replaced by
 * the id of the newest entry already in the log, so every entry appended after
 * that point is read, including ones that land between two reads or during a
 * backoff. From then on it moves forward only after an entry has been
 * processed, so a crash loses at most the in-flight batch and never reorders.
 * It lives in memory only; a restarted process starts from "$" again.
 *
 * Started with the Spring context and stopped on shutdown. Stopping lets the
 * current read/broadcast iteration finish and cuts any backoff wait short.
 */
@Component
public class StreamCursorReader implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(StreamCursorReader.class);

    private final StreamLogClient client;
    private final StreamEntryProcessor processor;
    private final Duration blockTimeout;
    private final int batchSize;
    private final Duration reconnectBackoff;
    private final Duration readErrorBackoff;

    // Written only by the reader thread; volatile so status readers see current values.
    private volatile ReaderState state = ReaderState.DISCONNECTED;
    private volatile CursorPosition position = CursorPosition.latest();

    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread worker;

    public StreamCursorReader(StreamLogClient client, StreamEntryProcessor processor,
                              RelayProperties properties) {
        RelayProperties.Stream stream = properties.getStream();
        this.client = client;
        this.processor = processor;
        this.blockTimeout = stream.getBlockTimeout();
        this.batchSize = stream.getBatchSize();
        this.reconnectBackoff = stream.getReconnectBackoff();
        this.readErrorBackoff = stream.getReadErrorBackoff();
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        stopSignal = new CountDownLatch(1);
        worker = new Thread(this::runLoop, "vlm-stream-reader");
        worker.setDaemon(true);
        worker.start();
        log.info("Stream reader started");
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("Stopping stream reader");
        running = false;
        stopSignal.countDown();
        try {
            // One blocking read plus a broadcast pass is the longest we should wait.
            worker.join(blockTimeout.toMillis() + 5_000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    public ReaderState getState() {
        return state;
    }

    public CursorPosition getPosition() {
        return position;
    }

    public boolean isUpstreamConnected() {
        return client.isConnected();
    }

    private void runLoop() {
        while (running) {
            try {
                step();
            } catch (RuntimeException e) {
                // The processor handles its own failures; anything reaching here is a bug
                // in a downstream step. Retry from the unchanged cursor.
                log.error("Unexpected stream reader failure at {}", position.messageId(), e);
                state = client.isConnected() ? ReaderState.CONNECTED_IDLE : ReaderState.DISCONNECTED;
                pause(readErrorBackoff);
            }
        }
        client.disconnect();
        state = ReaderState.DISCONNECTED;
        log.info("Stream reader stopped at {}", position.messageId());
    }

    /**
     * Performs one state transition. Package-private so tests can drive the
     * machine deterministically without the background thread.
     */
    void step() {
        switch (state) {
            case DISCONNECTED -> connectOnce();
            case CONNECTED_IDLE, CONNECTED_READING -> readOnce();
        }
    }

    private void connectOnce() {
        if (!client.connect()) {
            log.warn("Upstream unavailable, retrying in {}s", reconnectBackoff.toSeconds());
            pause(reconnectBackoff);
            return;
        }
        if (position.isLatest() && !pinLatest()) {
            return;
        }
        state = ReaderState.CONNECTED_IDLE;
        log.info("Upstream connected, resuming from {}", position.messageId());
    }

    private boolean pinLatest() {
        try {
            position = CursorPosition.at(client.latestId());
            return true;
        } catch (UpstreamUnavailableException e) {
            log.error("Upstream connection lost while locating stream tail, reconnecting in {}s: {}",
                    reconnectBackoff.toSeconds(), e.getMessage());
            client.disconnect();
            pause(reconnectBackoff);
            return false;
        } catch (RuntimeException e) {
            // Still connected; "$" keeps the start at "new entries only", so carry on with it.
            log.warn("Could not locate stream tail, reading from {}: {}",
                    CursorPosition.LATEST_SENTINEL, e.getMessage());
            return true;
        }
    }

    private void readOnce() {
        state = ReaderState.CONNECTED_READING;
        List<StreamEntry> batch;
        try {
            batch = client.readAfter(position.messageId(), blockTimeout, batchSize);
        } catch (UpstreamUnavailableException e) {
            log.error("Upstream connection lost, reconnecting in {}s: {}",
                    reconnectBackoff.toSeconds(), e.getMessage());
            client.disconnect();
            state = ReaderState.DISCONNECTED;
            pause(reconnectBackoff);
            return;
        } catch (RuntimeException e) {
            log.error("Stream read error at {}: {}", position.messageId(), e.getMessage());
            state = ReaderState.CONNECTED_IDLE;
            pause(readErrorBackoff);
            return;
        }

        for (StreamEntry entry : batch) {
            processor.process(entry);
            position = CursorPosition.at(entry.id());
        }
        state = ReaderState.CONNECTED_IDLE;
    }

    private void pause(Duration backoff) {
        try {
            stopSignal.await(backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
