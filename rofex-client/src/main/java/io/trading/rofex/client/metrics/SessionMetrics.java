package io.trading.rofex.client.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.trading.rofex.client.stream.SessionState;
import io.trading.rofex.protocol.message.MessageCategory;

/**
 * Prometheus metrics of streaming sessions.
 *
 * Tracks:
 * - Frames received per category and frames sent
 * - Decode and handler failures
 * - Reconnect attempts
 * - Session state and retained subscriptions
 * - Handshake latency
 *
 * Every series is labelled by session name so several sessions can share a registry.
 */
public class SessionMetrics {

    private final String session;

    private final Counter framesReceived;
    private final Counter framesSent;
    private final Counter decodeErrors;
    private final Counter handlerErrors;
    private final Counter reconnectAttempts;

    private final Gauge sessionState;
    private final Gauge activeSubscriptions;

    private final Summary handshakeLatencyMillis;

    /**
     * Metrics registered on a private registry.
     */
    public SessionMetrics(String session) {
        this(session, new CollectorRegistry());
    }

    public SessionMetrics(String session, CollectorRegistry registry) {
        this.session = session;

        this.framesReceived = Counter.build()
            .name("rofex_frames_received_total")
            .help("Total number of inbound frames dispatched")
            .labelNames("session", "category")
            .register(registry);

        this.framesSent = Counter.build()
            .name("rofex_frames_sent_total")
            .help("Total number of frames written to the stream")
            .labelNames("session")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("rofex_decode_errors_total")
            .help("Total number of inbound frames that could not be decoded")
            .labelNames("session")
            .register(registry);

        this.handlerErrors = Counter.build()
            .name("rofex_handler_errors_total")
            .help("Total number of exceptions thrown by message handlers")
            .labelNames("session")
            .register(registry);

        this.reconnectAttempts = Counter.build()
            .name("rofex_reconnect_attempts_total")
            .help("Total number of reconnection attempts")
            .labelNames("session")
            .register(registry);

        // Ordinal of SessionState
        this.sessionState = Gauge.build()
            .name("rofex_session_state")
            .help("Session state (ordinal of SessionState)")
            .labelNames("session")
            .register(registry);

        this.activeSubscriptions = Gauge.build()
            .name("rofex_active_subscriptions")
            .help("Number of retained subscriptions")
            .labelNames("session")
            .register(registry);

        this.handshakeLatencyMillis = Summary.build()
            .name("rofex_handshake_latency_milliseconds")
            .help("Time from connect to an accepted WebSocket upgrade")
            .labelNames("session")
            .register(registry);

        sessionState.labels(session).set(SessionState.IDLE.ordinal());
    }

    public void recordFrameReceived(MessageCategory category) {
        framesReceived.labels(session, category.name()).inc();
    }

    public void recordFrameSent() {
        framesSent.labels(session).inc();
    }

    public void recordDecodeError() {
        decodeErrors.labels(session).inc();
    }

    public void recordHandlerErrors(int count) {
        if (count > 0) {
            handlerErrors.labels(session).inc(count);
        }
    }

    public void recordReconnectAttempt() {
        reconnectAttempts.labels(session).inc();
    }

    public void setState(SessionState state) {
        sessionState.labels(session).set(state.ordinal());
    }

    public void setActiveSubscriptions(int count) {
        activeSubscriptions.labels(session).set(count);
    }

    public void recordHandshakeLatency(long millis) {
        handshakeLatencyMillis.labels(session).observe(millis);
    }

    public double getFramesReceived(MessageCategory category) {
        return framesReceived.labels(session, category.name()).get();
    }

    public double getFramesSent() {
        return framesSent.labels(session).get();
    }

    public double getDecodeErrors() {
        return decodeErrors.labels(session).get();
    }

    public double getHandlerErrors() {
        return handlerErrors.labels(session).get();
    }

    public double getReconnectAttempts() {
        return reconnectAttempts.labels(session).get();
    }

    public SessionState getState() {
        return SessionState.values()[(int) sessionState.labels(session).get()];
    }
}
