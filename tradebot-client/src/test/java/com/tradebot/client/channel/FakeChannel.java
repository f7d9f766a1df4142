package com.tradebot.client.channel;

import com.tradebot.client.exception.TransportUnavailableException;

import java.net.ConnectException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * Scripted in-memory channel. The open behaviour is fixed at creation; the
 * test drives everything else (inbound messages, closes).
 */
public class FakeChannel implements Channel {

    public enum OpenBehavior {
        OPEN_IMMEDIATELY,   // onOpen during open()
        FAIL_WITH_ERROR,    // onError then onClose during open()
        CLOSE_BEFORE_OPEN,  // onClose during open()
        MANUAL              // nothing until the test calls completeOpen()
    }

    private final ChannelListener listener;
    private final OpenBehavior behavior;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open;
    private volatile boolean closed;
    private volatile BiConsumer<FakeChannel, String> responder;

    FakeChannel(ChannelListener listener, OpenBehavior behavior) {
        this.listener = listener;
        this.behavior = behavior;
    }

    @Override
    public void open() {
        switch (behavior) {
            case OPEN_IMMEDIATELY -> completeOpen();
            case FAIL_WITH_ERROR -> {
                listener.onError(new ConnectException("Connection refused"));
                listener.onClose(CloseReason.CONNECTION_LOST, -1, "Connection refused");
            }
            case CLOSE_BEFORE_OPEN -> listener.onClose(CloseReason.CONNECTION_LOST, 1006, "handshake failed");
            case MANUAL -> { }
        }
    }

    public void completeOpen() {
        open = true;
        listener.onOpen();
    }

    @Override
    public void send(String message) throws TransportUnavailableException {
        if (!open) {
            throw new TransportUnavailableException("Fake channel not open");
        }
        sent.add(message);
        BiConsumer<FakeChannel, String> r = responder;
        if (r != null) {
            r.accept(this, message);
        }
    }

    @Override
    public void close() {
        boolean wasOpen = open;
        open = false;
        closed = true;
        if (wasOpen) {
            listener.onClose(CloseReason.CLIENT_REQUESTED, 1000, "");
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    /** Simulate the remote side dropping or ending the channel. */
    public void remoteClose(CloseReason reason, int code) {
        open = false;
        listener.onClose(reason, code, "remote");
    }

    /** Simulate an inbound text frame. */
    public void receive(String message) {
        listener.onMessage(message);
    }

    /** Called for every message written while open. */
    public void setResponder(BiConsumer<FakeChannel, String> responder) {
        this.responder = responder;
    }

    public List<String> sent() {
        return sent;
    }

    public boolean isClosed() {
        return closed;
    }
}
