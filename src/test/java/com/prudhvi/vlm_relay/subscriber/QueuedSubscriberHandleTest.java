package com.prudhvi.vlm_relay.subscriber;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueuedSubscriberHandleTest {

    @Test
    void send_ShouldReturnImmediatelyAndDeliverInOrder() throws Exception {
        RecordingHandle delegate = new RecordingHandle(false);
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("a", delegate, Duration.ofSeconds(5), 100);
        List<String> expected = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                handle.send("frame-" + i);
                expected.add("frame-" + i);
            }

            awaitTrue(() -> delegate.received.size() == 20);
            assertThat(delegate.received).containsExactlyElementsOf(expected);
        } finally {
            handle.close();
        }
    }

    @Test
    void send_WhileWriteBlockedPastLimit_ShouldFail() throws Exception {
        BlockingHandle delegate = new BlockingHandle();
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("slow", delegate, Duration.ofMillis(100), 100);
        try {
            handle.send("first");
            assertThat(delegate.started.await(1, TimeUnit.SECONDS)).isTrue();

            Thread.sleep(250);

            assertThatThrownBy(() -> handle.send("late"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("blocked");
        } finally {
            delegate.release();
            handle.close();
        }
    }

    @Test
    void send_QueueFull_ShouldFail() throws Exception {
        BlockingHandle delegate = new BlockingHandle();
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("backlog", delegate, Duration.ofSeconds(30), 2);
        try {
            handle.send("writing");
            assertThat(delegate.started.await(1, TimeUnit.SECONDS)).isTrue();
            handle.send("queued-1");
            handle.send("queued-2");

            assertThat(handle.pendingFrames()).isEqualTo(2);
            assertThatThrownBy(() -> handle.send("overflow"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("full");
        } finally {
            delegate.release();
            handle.close();
        }
    }

    @Test
    void send_AfterDelegateFailure_ShouldFailAndStopWriting() throws Exception {
        RecordingHandle delegate = new RecordingHandle(true);
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("broken", delegate, Duration.ofSeconds(5), 100);
        try {
            handle.send("first");

            IOException failure = awaitSendFailure(handle);

            assertThat(failure).hasMessageContaining("broken pipe");
            assertThat(delegate.attempts).isEqualTo(1);
        } finally {
            handle.close();
        }
    }

    @Test
    void close_ShouldCloseDelegateAndRejectFurtherSends() {
        RecordingHandle delegate = new RecordingHandle(false);
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("gone", delegate, Duration.ofSeconds(5), 100);

        handle.close();

        assertThat(delegate.closed).isTrue();
        assertThatThrownBy(() -> handle.send("after-close"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("closed");
    }

    @Test
    void close_WhileWriteBlocked_ShouldInterruptSender() throws Exception {
        BlockingHandle delegate = new BlockingHandle();
        QueuedSubscriberHandle handle = new QueuedSubscriberHandle("stuck", delegate, Duration.ofSeconds(5), 100);
        handle.send("hangs");
        assertThat(delegate.started.await(1, TimeUnit.SECONDS)).isTrue();

        handle.close();

        assertThat(delegate.closed).isTrue();
        Thread.sleep(50);
        assertThat(delegate.received).isEmpty();
    }

    private static IOException awaitSendFailure(QueuedSubscriberHandle handle) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (System.nanoTime() < deadline) {
            try {
                handle.send("retry");
            } catch (IOException e) {
                return e;
            }
            Thread.sleep(10);
        }
        throw new AssertionError("send never failed");
    }

    static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("condition not met within 2s");
            }
            Thread.sleep(10);
        }
    }
}
