package io.github.drompincen.vibehub.runtime.transport;

import io.github.drompincen.vibehub.protocol.ws.WsMessage;

/**
 * Outbound seam to the client transport. Every event is addressed to exactly one connection.
 */
public interface SessionEventSink {

    /**
     * Delivers {@code message} to the connection, or drops it if the connection is gone.
     */
    void send(String connectionId, WsMessage message);
}
