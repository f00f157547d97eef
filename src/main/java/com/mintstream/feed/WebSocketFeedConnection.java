package com.mintstream.feed;

import com.mintstream.domain.enums.SessionState;
import com.mintstream.exception.FeedConnectionException;
import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.PingMessage;
import org.springframework.web.socket.PongMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * {@link FeedConnection} over a Spring {@link WebSocketSession}.
 *
 * <p>The container delivers frames to {@link InboundHandler} on its own threads; the handler
 * queues them so the reconnect loop can consume them in receipt order with a bounded wait.
 * The queue is bounded: when it is full the container thread waits for room, which stops
 * further socket reads until the loop catches up. Close and transport errors are recorded as
 * a terminal reason, reported once every frame queued before them has been received.
 * Outbound sends go through a
 * {@link org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator} so the
 * dispatcher and the sweeper can send while the loop is receiving.
 *
 * <p>Keep-alive: after one heartbeat interval without a frame, {@link #receive()} sends a
 * ping. If nothing (pong or data) arrives within the pong timeout after that ping, the session
 * is lost. A single {@code receive()} never blocks longer than the larger of the two, and a
 * silent peer is dropped at most {@code heartbeatInterval + pongTimeout} after its last frame.
 */
public class WebSocketFeedConnection implements FeedConnection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketFeedConnection.class);

    private static final long QUEUE_WAIT_MILLIS = 200;

    private final BlockingQueue<InboundFrame> inbound;
    private final InboundHandler handler = new InboundHandler();
    private final Duration heartbeatInterval;
    private final Duration pongTimeout;
    private final int inboundCapacity;

    private volatile WebSocketSession session;
    private volatile SessionState state = SessionState.CONNECTING;
    private volatile long lastInboundNanos = System.nanoTime();
    private volatile String closedReason;

    // Touched only by the receiving thread
    private boolean pingOutstanding;
    private long pingSentNanos;

    public WebSocketFeedConnection(Duration heartbeatInterval, Duration pongTimeout, int inboundCapacity) {
        this.heartbeatInterval = heartbeatInterval;
        this.pongTimeout = pongTimeout;
        this.inboundCapacity = inboundCapacity;
        this.inbound = new LinkedBlockingQueue<>(inboundCapacity);
    }

    public WebSocketHandler handler() {
        return handler;
    }

    /** Binds the (decorated) session once the handshake completed. */
    public void bind(WebSocketSession session) {
        this.session = session;
        this.lastInboundNanos = System.nanoTime();
        this.state = SessionState.ACTIVE;
    }

    @Override
    public void send(String text) throws IOException {
        WebSocketSession current = session;
        if (current == null || !current.isOpen() || state != SessionState.ACTIVE) {
            throw new IOException("Feed session is not open");
        }
        current.sendMessage(new TextMessage(text));
    }

    @Override
    public Optional<String> receive() {
        if (pingOutstanding && lastInboundNanos - pingSentNanos >= 0) {
            pingOutstanding = false;
        }
        long waitNanos = pingOutstanding
                ? Math.max(0, pingSentNanos + pongTimeout.toNanos() - System.nanoTime())
                : heartbeatInterval.toNanos();

        InboundFrame frame = inbound.poll();
        if (frame == null) {
            throwIfClosed();
            try {
                frame = inbound.poll(waitNanos, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new FeedConnectionException("Interrupted while waiting for feed messages", e);
            }
        }

        if (frame == null) {
            throwIfClosed();
            long now = System.nanoTime();
            if (pingOutstanding) {
                if (lastInboundNanos - pingSentNanos >= 0) {
                    pingOutstanding = false;
                } else if (now - pingSentNanos >= pongTimeout.toNanos()) {
                    state = SessionState.DISCONNECTED;
                    throw new FeedConnectionException("Heartbeat timed out, no pong within "
                            + pongTimeout.toMillis() + "ms of keep-alive ping");
                }
                return Optional.empty();
            }
            sendPing();
            pingOutstanding = true;
            pingSentNanos = now;
            return Optional.empty();
        }

        if (frame.closed()) {
            state = SessionState.DISCONNECTED;
            throw new FeedConnectionException("Feed session closed: " + closedReason);
        }
        return Optional.of(frame.payload());
    }

    private void throwIfClosed() {
        String reason = closedReason;
        if (reason != null && inbound.isEmpty()) {
            state = SessionState.DISCONNECTED;
            throw new FeedConnectionException("Feed session closed: " + reason);
        }
    }

    @Override
    public boolean isOpen() {
        WebSocketSession current = session;
        return state == SessionState.ACTIVE && current != null && current.isOpen();
    }

    @Override
    public SessionState getState() {
        return state;
    }

    @Override
    public void close() {
        if (state == SessionState.CLOSING || (state == SessionState.DISCONNECTED && session == null)) {
            return;
        }
        state = SessionState.CLOSING;
        WebSocketSession current = session;
        try {
            if (current != null && current.isOpen()) {
                current.close(CloseStatus.GOING_AWAY);
            }
        } catch (IOException e) {
            log.warn("Error closing feed session: {}", e.getMessage());
        } finally {
            session = null;
            state = SessionState.DISCONNECTED;
            markClosed("closed locally");
        }
    }

    /** Records the first terminal reason and wakes a receive() blocked on an empty queue. */
    private void markClosed(String reason) {
        if (closedReason == null) {
            closedReason = reason;
        }
        inbound.offer(InboundFrame.closedFrame(reason));
    }

    private void sendPing() {
        WebSocketSession current = session;
        if (current == null || !current.isOpen()) {
            return;
        }
        try {
            current.sendMessage(new PingMessage());
        } catch (IOException | RuntimeException e) {
            log.debug("Keep-alive ping failed: {}", e.getMessage());
        }
    }

    private record InboundFrame(String payload, boolean closed) {

        static InboundFrame text(String payload) {
            return new InboundFrame(payload, false);
        }

        static InboundFrame closedFrame(String reason) {
            return new InboundFrame(reason, true);
        }
    }

    private class InboundHandler extends TextWebSocketHandler {

        @Override
        protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) {
            lastInboundNanos = System.nanoTime();
            InboundFrame frame = InboundFrame.text(message.getPayload());
            boolean warned = false;
            try {
                while (!inbound.offer(frame, QUEUE_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                    if (closedReason != null) {
                        log.debug("Dropping inbound frame, feed session closed: {}", closedReason);
                        return;
                    }
                    if (!warned) {
                        log.warn("Inbound queue full ({} frames), pausing feed reads", inboundCapacity);
                        warned = true;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                markClosed("interrupted while queueing inbound frame");
            }
        }

        @Override
        protected void handlePongMessage(WebSocketSession webSocketSession, PongMessage message) {
            lastInboundNanos = System.nanoTime();
        }

        @Override
        public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
            markClosed("transport error: " + exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
            markClosed(status.toString());
        }
    }
}
