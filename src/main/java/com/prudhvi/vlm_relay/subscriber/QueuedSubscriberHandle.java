package com.prudhvi.vlm_relay.subscriber;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Moves the socket write of one subscriber off the broadcasting thread.
 *
 * Frames are queued for a single sender thread owned by this subscriber, so a
 * socket that stops draining stalls only its own queue. The broadcaster sees
 * the subscriber as failed (IOException from {@link #send}) once:
 *   - the queue already holds maxPending frames,
 *   - the frame currently being written has been blocked longer than sendTimeLimit, or
 *   - an earlier write failed.
 *
 * Frames stay in order because there is exactly one sender thread.
 */
public class QueuedSubscriberHandle implements SubscriberHandle {

    private static final Logger log = LoggerFactory.getLogger(QueuedSubscriberHandle.class);

    private final String name;
    private final SubscriberHandle delegate;
    private final long sendTimeLimitNanos;
    private final int maxPending;
    private final ThreadPoolExecutor sender;

    private volatile boolean writing;
    private volatile long writeStartedNanos;
    private volatile IOException failure;

    public QueuedSubscriberHandle(String name, SubscriberHandle delegate,
                                  Duration sendTimeLimit, int maxPending) {
        this.name = name;
        this.delegate = delegate;
        this.sendTimeLimitNanos = sendTimeLimit.toNanos();
        this.maxPending = maxPending;
        this.sender = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(maxPending),
                r -> {
                    Thread t = new Thread(r, "vlm-send-" + name);
                    t.setDaemon(true);
                    return t;
                });
    }

    @Override
    public void send(String text) throws IOException {
        IOException failed = failure;
        if (failed != null) {
            throw new IOException("Earlier send to " + name + " failed: " + failed.getMessage(), failed);
        }
        if (writing && System.nanoTime() - writeStartedNanos > sendTimeLimitNanos) {
            throw new IOException("Send to " + name + " blocked for more than "
                    + TimeUnit.NANOSECONDS.toMillis(sendTimeLimitNanos) + " ms");
        }
        try {
            sender.execute(() -> write(text));
        } catch (RejectedExecutionException e) {
            throw new IOException(sender.isShutdown()
                    ? "Subscriber " + name + " is closed"
                    : "Send queue for " + name + " is full (" + maxPending + " frames)", e);
        }
    }

    @Override
    public void close() {
        sender.shutdownNow();
        delegate.close();
    }

    /**
     * Frames accepted but not yet handed to the socket.
     */
    public int pendingFrames() {
        return sender.getQueue().size();
    }

    private void write(String text) {
        if (failure != null) {
            return;
        }
        writeStartedNanos = System.nanoTime();
        writing = true;
        try {
            delegate.send(text);
        } catch (IOException e) {
            failure = e;
        } catch (RuntimeException e) {
            failure = new IOException(e.getMessage(), e);
        } finally {
            writing = false;
        }
        if (failure != null) {
            log.debug("Write to {} failed, dropping further frames: {}", name, failure.getMessage());
        }
    }
}
