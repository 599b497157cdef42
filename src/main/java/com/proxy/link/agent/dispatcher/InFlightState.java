package com.proxy.link.agent.dispatcher;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;

/**
 * The single in-flight slot on the relay link. Answers carry no correlation id: the next response frame
 * always belongs to the request currently in flight. A request abandoned on timeout still gets its answer
 * from the relay later, in order, so those answers are remembered and discarded instead of being attributed
 * to whatever request is in flight by then.
 */
@Slf4j
class InFlightState {

    enum Match {
        /** Resolved the in-flight HTTP request. */
        MATCHED,
        /** Resolved the in-flight CONNECT. */
        MATCHED_TUNNEL,
        /** Late answer to an abandoned HTTP request. */
        ABANDONED,
        /** Late acknowledgement of an abandoned CONNECT; the relay may be holding the tunnel open. */
        ABANDONED_TUNNEL,
        /** Nothing was waiting for it. */
        UNSOLICITED
    }

    /** A write to the link made while the slot is locked. */
    interface LinkAction {
        void run() throws IOException;
    }

    private CompletableFuture<byte[]> current;
    private boolean currentIsTunnel;
    // true entries are CONNECTs, in the order the relay will answer them
    private final Deque<Boolean> abandoned = new ArrayDeque<>();

    /**
     * Claims the slot for a request about to be sent.
     *
     * @throws IllegalStateException if another request is still in flight
     */
    synchronized CompletableFuture<byte[]> begin(boolean tunnel) {
        if (current != null) {
            throw new IllegalStateException("A request is already in flight");
        }
        current = new CompletableFuture<>();
        currentIsTunnel = tunnel;
        return current;
    }

    /**
     * Matches a response frame to the head of the queue.
     */
    synchronized Match onResponse(byte[] payload) {
        if (!abandoned.isEmpty()) {
            boolean tunnel = abandoned.removeFirst();
            log.warn("Discarding late answer to an abandoned {} ({} still outstanding)",
                    tunnel ? "CONNECT" : "request", abandoned.size());
            return tunnel ? Match.ABANDONED_TUNNEL : Match.ABANDONED;
        }
        if (current == null) {
            log.warn("Discarding unsolicited response frame ({} bytes)", payload.length);
            return Match.UNSOLICITED;
        }
        current.complete(payload);
        current = null;
        return currentIsTunnel ? Match.MATCHED_TUNNEL : Match.MATCHED;
    }

    /**
     * Called when waiting for {@code pending} timed out.
     *
     * @return the answer if it arrived in the meantime, otherwise {@code null} after marking it abandoned
     */
    synchronized byte[] expire(CompletableFuture<byte[]> pending) {
        if (pending.isDone() && !pending.isCompletedExceptionally()) {
            return pending.getNow(null);
        }
        if (current == pending) {
            current = null;
            abandoned.addLast(currentIsTunnel);
        }
        pending.cancel(false);
        return null;
    }

    /**
     * Runs {@code action} unless a CONNECT is still queued at the relay, abandoned or in flight. Tunnel close
     * frames carry no tunnel id, so a close meant for an earlier tunnel would end that CONNECT instead.
     * No request can be sent while the action runs, so nothing overtakes it on the link.
     *
     * @return false if the action was withheld
     */
    synchronized boolean runUnlessTunnelQueued(LinkAction action) throws IOException {
        if (abandoned.contains(Boolean.TRUE) || (current != null && currentIsTunnel)) {
            return false;
        }
        action.run();
        return true;
    }

    /**
     * Releases the slot for a request that never reached the link.
     */
    synchronized void release(CompletableFuture<byte[]> pending) {
        if (current == pending) {
            current = null;
        }
    }

    /**
     * The relay drops its queue with the connection, so no late answers can follow.
     */
    synchronized void onLinkLost() {
        abandoned.clear();
        if (current != null) {
            current.completeExceptionally(new IOException("Relay connection lost while request was in flight"));
            current = null;
        }
    }

    synchronized boolean isIdle() {
        return current == null;
    }

    synchronized int getAbandonedAnswers() {
        return abandoned.size();
    }
}
