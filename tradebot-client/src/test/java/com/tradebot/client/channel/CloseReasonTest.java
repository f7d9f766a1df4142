package com.tradebot.client.channel;

import org.java_websocket.framing.CloseFrame;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CloseReasonTest {

    @Test
    @DisplayName("Remote normal and policy closes are deliberate")
    void remoteDeliberateClose() {
        assertEquals(CloseReason.SERVER_TERMINATED, CloseReason.fromCloseCode(CloseFrame.NORMAL, true));
        assertEquals(CloseReason.SERVER_TERMINATED, CloseReason.fromCloseCode(CloseFrame.POLICY_VALIDATION, true));
    }

    @Test
    @DisplayName("Restarts and abnormal closes are connection loss")
    void connectionLoss() {
        assertEquals(CloseReason.CONNECTION_LOST, CloseReason.fromCloseCode(CloseFrame.GOING_AWAY, true));
        assertEquals(CloseReason.CONNECTION_LOST, CloseReason.fromCloseCode(CloseFrame.ABNORMAL_CLOSE, false));
        assertEquals(CloseReason.CONNECTION_LOST, CloseReason.fromCloseCode(-1, false));
    }

    @Test
    @DisplayName("Local normal close is client requested")
    void clientRequested() {
        assertEquals(CloseReason.CLIENT_REQUESTED, CloseReason.fromCloseCode(CloseFrame.NORMAL, false));
    }
}
