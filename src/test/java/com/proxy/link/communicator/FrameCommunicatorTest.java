package com.proxy.link.communicator;

import com.proxy.link.protocol.Frame;
import com.proxy.link.protocol.FrameType;
import com.proxy.link.support.FrameConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class FrameCommunicatorTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    private ServerSocket serverSocket;
    private FrameConnection peer;
    private FrameCommunicator communicator;

    private final CountDownLatch lost = new CountDownLatch(1);
    private final AtomicReference<Throwable> lostCause = new AtomicReference<>();

    @BeforeEach
    void setUp() throws Exception {
        serverSocket = new ServerSocket(0);
    }

    @AfterEach
    void tearDown() throws Exception {
        if (communicator != null) {
            communicator.close();
        }
        if (peer != null) {
            peer.close();
        }
        serverSocket.close();
    }

    private void connect(FrameListener listener) throws Exception {
        Socket socket = new Socket("127.0.0.1", serverSocket.getLocalPort());
        peer = new FrameConnection(serverSocket.accept());
        communicator = new FrameCommunicator("test-link", socket, listener);
        communicator.start();
    }

    private FrameListener listener(Runnable onFrame) {
        return new FrameListener() {
            @Override
            public void onFrame(FrameCommunicator source, Frame frame) {
                onFrame.run();
            }

            @Override
            public void onConnectionLost(FrameCommunicator source, Throwable cause) {
                lostCause.set(cause);
                lost.countDown();
            }
        };
    }

    @Test
    void deliversFramesAndSendsQueuedOnes() throws Exception {
        CountDownLatch received = new CountDownLatch(1);
        connect(listener(received::countDown));

        peer.send(Frame.of(FrameType.REQUEST, "ping"));
        communicator.send(Frame.of(FrameType.RESPONSE, "pong"));

        assertThat(received.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThat(peer.readFrame(WAIT).payloadAsString()).isEqualTo("pong");
    }

    @Test
    void peerCloseIsReportedWithoutCause() throws Exception {
        connect(listener(() -> { }));

        peer.close();

        assertThat(lost.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThat(lostCause.get()).isNull();
        assertThat(communicator.isConnected()).isFalse();
    }

    @Test
    void failureOutsideIoStillReportsTheLink() throws Exception {
        connect(listener(() -> {
            throw new OutOfMemoryError("no room for payload");
        }));

        peer.send(Frame.of(FrameType.RESPONSE, "big"));

        assertThat(lost.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThat(lostCause.get()).isInstanceOf(OutOfMemoryError.class);
        assertThat(communicator.isConnected()).isFalse();
        assertThat(communicator.isRunning()).isFalse();
    }

    @Test
    void listenerRuntimeFailureDoesNotEndTheLink() throws Exception {
        CountDownLatch calls = new CountDownLatch(2);
        connect(listener(() -> {
            calls.countDown();
            throw new IllegalStateException("listener bug");
        }));

        peer.send(Frame.of(FrameType.RESPONSE, "one"));
        peer.send(Frame.of(FrameType.RESPONSE, "two"));

        assertThat(calls.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
        assertThat(communicator.isConnected()).isTrue();
    }
}
