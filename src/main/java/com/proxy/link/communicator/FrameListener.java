package com.proxy.link.communicator;

import com.proxy.link.protocol.Frame;

/**
 * Receives everything a {@link FrameCommunicator} reads, on its receive thread.
 */
public interface FrameListener {

    void onFrame(FrameCommunicator communicator, Frame frame);

    /**
     * Fired at most once per communicator, when the peer closes the link or an I/O error breaks it.
     * Not fired for a deliberate {@link FrameCommunicator#close()}.
     *
     * @param cause the failure, or {@code null} on an orderly end of stream
     */
    void onConnectionLost(FrameCommunicator communicator, Throwable cause);
}
