package com.tradebot.client.channel;

import org.java_websocket.framing.CloseFrame;

/**
 * Why an established channel went away.
 */
public enum CloseReason {
    /** This client closed the channel. */
    CLIENT_REQUESTED,
    /** The service closed the channel on purpose; do not retry. */
    SERVER_TERMINATED,
    /** Network-level loss; worth reconnecting. */
    CONNECTION_LOST;

    /**
     * Classify a WebSocket close.
     *
     * A remote close with NORMAL or POLICY_VALIDATION is the service telling
     * us to go away. GOING_AWAY (restart) and every abnormal code count as
     * connection loss.
     *
     * @param code   close code from the close frame
     * @param remote true when the peer initiated the close
     */
    public static CloseReason fromCloseCode(int code, boolean remote) {
        if (remote) {
            if (code == CloseFrame.NORMAL || code == CloseFrame.POLICY_VALIDATION) {
                return SERVER_TERMINATED;
            }
            return CONNECTION_LOST;
        }
        return code == CloseFrame.NORMAL ? CLIENT_REQUESTED : CONNECTION_LOST;
    }
}
