package io.trading.rofex.client.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.rofex.client.stream.SessionState;
import io.trading.rofex.protocol.message.MessageCategory;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SessionMetricsTest {

    @Test
    void testCountersLabelledBySession() {
        CollectorRegistry registry = new CollectorRegistry();
        SessionMetrics metrics = new SessionMetrics("rofex-remarket", registry);

        metrics.recordFrameReceived(MessageCategory.MARKET_DATA);
        metrics.recordFrameReceived(MessageCategory.MARKET_DATA);
        metrics.recordFrameSent();
        metrics.recordDecodeError();
        metrics.recordHandlerErrors(0);
        metrics.recordHandlerErrors(2);
        metrics.recordReconnectAttempt();

        assertEquals(2.0, metrics.getFramesReceived(MessageCategory.MARKET_DATA));
        assertEquals(0.0, metrics.getFramesReceived(MessageCategory.ORDER_REPORT));
        assertEquals(1.0, metrics.getFramesSent());
        assertEquals(1.0, metrics.getDecodeErrors());
        assertEquals(2.0, metrics.getHandlerErrors());
        assertEquals(2.0, registry.getSampleValue("rofex_frames_received_total",
            new String[]{"session", "category"}, new String[]{"rofex-remarket", "MARKET_DATA"}));
        assertEquals(1.0, registry.getSampleValue("rofex_reconnect_attempts_total",
            new String[]{"session"}, new String[]{"rofex-remarket"}));
    }

    @Test
    void testStateAndSubscriptionGauges() {
        CollectorRegistry registry = new CollectorRegistry();
        SessionMetrics metrics = new SessionMetrics("rofex-live", registry);

        assertEquals(SessionState.IDLE, metrics.getState());

        metrics.setState(SessionState.ACTIVE);
        metrics.setActiveSubscriptions(3);
        metrics.recordHandshakeLatency(42);

        assertEquals(SessionState.ACTIVE, metrics.getState());
        assertEquals(3.0, registry.getSampleValue("rofex_active_subscriptions",
            new String[]{"session"}, new String[]{"rofex-live"}));
        assertEquals(1.0, registry.getSampleValue("rofex_handshake_latency_milliseconds_count",
            new String[]{"session"}, new String[]{"rofex-live"}));
    }
}
