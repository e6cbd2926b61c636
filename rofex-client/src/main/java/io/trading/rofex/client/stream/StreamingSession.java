package io.trading.rofex.client.stream;

import io.trading.rofex.client.auth.CredentialProvider;
import io.trading.rofex.client.auth.Token;
import io.trading.rofex.client.config.ClientConfig;
import io.trading.rofex.client.config.SessionConfig;
import io.trading.rofex.client.dispatch.DispatchRegistry;
import io.trading.rofex.client.error.AuthenticationException;
import io.trading.rofex.client.error.TransportException;
import io.trading.rofex.client.metrics.SessionMetrics;
import io.trading.rofex.client.subscription.OutboundChannel;
import io.trading.rofex.client.subscription.Subscription;
import io.trading.rofex.client.subscription.SubscriptionManager;
import io.trading.rofex.protocol.codec.MessageCodec;
import io.trading.rofex.protocol.error.RofexException;
import io.trading.rofex.protocol.message.ErrorMessage;
import io.trading.rofex.protocol.message.InboundMessage;
import io.trading.rofex.protocol.request.CancelOrderRequest;
import io.trading.rofex.protocol.request.LoginRequest;
import io.trading.rofex.protocol.request.NewOrderRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Persistent, authenticated streaming connection.
 *
 * A dedicated worker thread owns the transport. Socket callbacks, outbound frames and
 * close requests reach it through one FIFO queue; it decodes and dispatches inbound frames,
 * replays subscriptions and reconnects with exponential backoff. {@link #start()} is the
 * only blocking call: it returns once the WebSocket upgrade carrying the token is accepted.
 *
 * Events are tagged with the connection they belong to. After a reconnect, whatever the
 * previous connection left in the queue is ignored.
 */
public class StreamingSession implements OutboundChannel, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingSession.class);

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final String name;
    private final ClientConfig clientConfig;
    private final SessionConfig sessionConfig;
    private final CredentialProvider credentials;
    private final TransportFactory transportFactory;
    private final MessageCodec codec;
    private final SessionMetrics metrics;
    private final DispatchRegistry handlers = new DispatchRegistry();
    private final SubscriptionManager subscriptions;

    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.IDLE);
    private final BlockingQueue<SessionEvent> events = new LinkedBlockingQueue<>();
    private final CompletableFuture<Void> startup = new CompletableFuture<>();
    private final CountDownLatch closeLatch = new CountDownLatch(1);
    private final CompletableFuture<Void> closeSignal = new CompletableFuture<>();
    private final AtomicLong generation = new AtomicLong();

    private volatile boolean closeRequested = false;
    private volatile Thread worker;

    // Worker thread only
    private StreamTransport transport;

    public StreamingSession(
        String name,
        ClientConfig clientConfig,
        SessionConfig sessionConfig,
        CredentialProvider credentials,
        TransportFactory transportFactory,
        MessageCodec codec,
        SessionMetrics metrics
    ) {
        this.name = name;
        this.clientConfig = clientConfig;
        this.sessionConfig = sessionConfig;
        this.credentials = credentials;
        this.transportFactory = transportFactory;
        this.codec = codec;
        this.metrics = metrics;
        this.subscriptions = new SubscriptionManager(name, codec, this, clientConfig.account());
        this.subscriptions.setSizeListener(metrics::setActiveSubscriptions);
    }

    /**
     * Connects and authenticates, blocking until the session is active.
     *
     * @throws AuthenticationException if the token is rejected or the upgrade is not acknowledged in time
     * @throws TransportException if the connection cannot be established
     * @throws IllegalStateException if the session was already started or closed
     */
    public void start() {
        if (!transition(SessionState.IDLE, SessionState.CONNECTING)) {
            throw new IllegalStateException(name + ": cannot start a session in state " + state.get());
        }

        Thread thread = new Thread(this::run, "rofex-stream-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        worker = thread;
        thread.start();

        try {
            startup.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RofexException rofex) {
                throw rofex;
            }
            throw new TransportException(name + ": failed to start", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            close();
            throw new TransportException(name + ": interrupted while starting", e);
        }
    }

    /**
     * Sends a new order on the stream. A null account means the configured default account.
     *
     * @throws IllegalStateException if the session is not active
     * @throws io.trading.rofex.protocol.error.ValidationException if the order is malformed
     */
    public void sendOrder(NewOrderRequest request) {
        requireActive("send an order");
        NewOrderRequest order = request.account() == null ? request.withAccount(clientConfig.account()) : request;
        events.offer(SessionEvent.outbound(generation.get(), codec.encode(order), true));
    }

    /**
     * Cancels an order on the stream. A null proprietary means the environment's proprietary.
     *
     * @throws IllegalStateException if the session is not active
     */
    public void cancelOrder(CancelOrderRequest request) {
        requireActive("cancel an order");
        CancelOrderRequest cancel = request.proprietary() == null
            ? new CancelOrderRequest(request.clOrdId(), clientConfig.proprietary())
            : request;
        events.offer(SessionEvent.outbound(generation.get(), codec.encode(cancel), true));
    }

    public void cancelOrder(String clOrdId) {
        cancelOrder(new CancelOrderRequest(clOrdId, null));
    }

    /**
     * Stops the session. Pending outbound frames are dropped and no message is dispatched
     * once this returns. Idempotent; may be called from a handler.
     */
    @Override
    public void close() {
        if (transition(SessionState.IDLE, SessionState.CLOSED)) {
            LOGGER.info("[{}] Closed before start", name);
            return;
        }

        closeRequested = true;
        closeLatch.countDown();
        closeSignal.completeExceptionally(new TransportException(name + ": closed while connecting"));
        while (true) {
            SessionState current = state.get();
            if (current.isTerminal() || transition(current, SessionState.CLOSING)) {
                break;
            }
        }
        events.offer(SessionEvent.closeRequested());

        Thread thread = worker;
        if (thread != null && thread != Thread.currentThread()) {
            try {
                thread.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("[{}] Interrupted while waiting for the session to stop", name);
            }
        }
    }

    @Override
    public boolean isActive() {
        return state.get() == SessionState.ACTIVE;
    }

    @Override
    public void enqueue(String frame) {
        events.offer(SessionEvent.outbound(generation.get(), frame, false));
    }

    public String name() {
        return name;
    }

    public SessionState state() {
        return state.get();
    }

    public DispatchRegistry handlers() {
        return handlers;
    }

    public SubscriptionManager subscriptions() {
        return subscriptions;
    }

    public SessionMetrics metrics() {
        return metrics;
    }

    private void run() {
        try {
            connect();
            if (!activate()) {
                throw new TransportException(name + ": closed while starting", null, true);
            }
        } catch (Throwable e) {
            LOGGER.error("[{}] Failed to start: {}", name, e.getMessage());
            shutdown();
            startup.completeExceptionally(e);
            rethrowIfFatal(e);
            return;
        }
        startup.complete(null);

        try {
            eventLoop();
        } catch (Throwable e) {
            LOGGER.error("[{}] Receive loop failed", name, e);
            handlers.reportError(new TransportException(name + ": receive loop failed: " + e, e, true));
            rethrowIfFatal(e);
        } finally {
            shutdown();
        }
    }

    private void eventLoop() {
        while (!closeRequested && state.get() != SessionState.CLOSED) {
            SessionEvent event;
            try {
                event = events.poll(sessionConfig.pollIntervalMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOGGER.warn("[{}] Worker interrupted, closing", name);
                return;
            }

            if (event == null || event.type() == SessionEvent.Type.CLOSE_REQUESTED) {
                continue;
            }
            if (event.generation() != generation.get()) {
                onStaleEvent(event);
                continue;
            }

            switch (event.type()) {
                case FRAME -> onFrame(event.text());
                case OUTBOUND -> onOutbound(event);
                case ERROR -> onConnectionLost(event.cause());
                case CLOSED -> onConnectionLost(null);
                default -> LOGGER.warn("[{}] Unexpected event {}", name, event.type());
            }
        }
    }

    private void onFrame(String text) {
        InboundMessage message = codec.decode(text);
        if (message instanceof ErrorMessage error && error.source() != ErrorMessage.Source.GATEWAY) {
            metrics.recordDecodeError();
            LOGGER.warn("[{}] Could not decode frame ({}): {}", name, error.code(), error.description());
        }
        if (closeRequested) {
            return;
        }
        metrics.recordFrameReceived(message.category());
        metrics.recordHandlerErrors(handlers.dispatch(message));
    }

    private void onOutbound(SessionEvent event) {
        try {
            write(event.text());
        } catch (TransportException e) {
            // the closed/error event of this connection follows and triggers the reconnect
            LOGGER.warn("[{}] Failed to send frame: {}", name, e.getMessage());
            handlers.reportError(e);
        }
    }

    private void onStaleEvent(SessionEvent event) {
        if (event.type() == SessionEvent.Type.OUTBOUND && event.critical()) {
            TransportException dropped = new TransportException(
                name + ": connection lost before the frame could be sent: " + event.text());
            LOGGER.warn("[{}] {}", name, dropped.getMessage());
            handlers.reportError(dropped);
            return;
        }
        LOGGER.debug("[{}] Ignoring {} event of connection #{}", name, event.type(), event.generation());
    }

    private void onConnectionLost(Throwable cause) {
        if (closeRequested || !transition(SessionState.ACTIVE, SessionState.RECONNECTING)) {
            return;
        }
        TransportException lost = cause == null
            ? new TransportException(name + ": connection closed by peer")
            : new TransportException(name + ": connection error: " + cause.getMessage(), cause);
        LOGGER.warn("[{}] {}", name, lost.getMessage());
        closeTransport();
        handlers.reportError(lost);
        reconnect();
    }

    private void reconnect() {
        ReconnectPolicy policy = new ReconnectPolicy(sessionConfig);
        RofexException lastFailure = null;

        while (!closeRequested) {
            if (!policy.hasAttemptsLeft()) {
                terminate(new TransportException(
                    name + ": giving up after " + policy.getRetryCount() + " reconnect attempt(s)", lastFailure, true));
                return;
            }

            long delay = policy.nextDelayMs();
            LOGGER.info("[{}] Reconnect attempt {} in {} ms", name, policy.getRetryCount(), delay);
            try {
                if (closeLatch.await(delay, TimeUnit.MILLISECONDS)) {
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            metrics.recordReconnectAttempt();
            try {
                connect();
            } catch (AuthenticationException e) {
                if (isRejection(e)) {
                    terminate(e);
                    return;
                }
                lastFailure = e;
                LOGGER.warn("[{}] Reconnect attempt {} failed: {}", name, policy.getRetryCount(), e.getMessage());
                continue;
            } catch (RofexException e) {
                lastFailure = e;
                LOGGER.warn("[{}] Reconnect attempt {} failed: {}", name, policy.getRetryCount(), e.getMessage());
                continue;
            }

            if (activate()) {
                LOGGER.info("[{}] Reconnected after {} attempt(s)", name, policy.getRetryCount());
            }
            return;
        }
    }

    /**
     * Opens a connection with the current token. A rejected token is refreshed once.
     */
    private void connect() {
        try {
            open(credentials.getToken());
        } catch (AuthenticationException e) {
            if (!isRejection(e)) {
                throw e;
            }
            LOGGER.info("[{}] Token rejected (HTTP {}), refreshing", name, e.getStatusCode());
            open(credentials.refresh());
        }
    }

    private void open(Token token) {
        long connection = generation.incrementAndGet();
        Map<String, String> headers = codec.encodeLogin(new LoginRequest(token.value()));
        StreamTransport next = transportFactory.create(name, sessionConfig);
        transport = next;

        LOGGER.info("[{}] Connecting to {} (connection #{})", name, clientConfig.streamUri(), connection);
        long startNanos = System.nanoTime();
        CompletableFuture<Void> handshake = next.open(clientConfig.streamUri(), headers, new ConnectionListener(connection));
        try {
            // close() fails closeSignal, ending the wait early
            CompletableFuture.anyOf(handshake, closeSignal).get(sessionConfig.loginTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            closeTransport();
            throw new AuthenticationException(
                name + ": login not acknowledged within " + sessionConfig.loginTimeoutMs() + " ms", e);
        } catch (ExecutionException e) {
            closeTransport();
            Throwable cause = e.getCause();
            if (cause instanceof RofexException rofex) {
                throw rofex;
            }
            throw new TransportException(name + ": connection failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeTransport();
            throw new TransportException(name + ": interrupted while connecting", e);
        }
        metrics.recordHandshakeLatency(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
    }

    /**
     * Marks the session active and re-sends retained subscriptions before any queued frame is dispatched.
     *
     * @return false if the session was closed meanwhile
     */
    private boolean activate() {
        List<Subscription> replay = subscriptions.replayOnActivation(this::markActive);
        if (state.get() != SessionState.ACTIVE) {
            return false;
        }

        for (Subscription subscription : replay) {
            try {
                write(codec.encode(subscription.request()));
            } catch (TransportException e) {
                LOGGER.warn("[{}] Failed to replay subscription #{}: {}", name, subscription.id(), e.getMessage());
                handlers.reportError(e);
                break;
            }
        }
        LOGGER.info("[{}] Session active, {} subscription(s) replayed", name, replay.size());
        return true;
    }

    private boolean markActive() {
        while (true) {
            SessionState current = state.get();
            if (current != SessionState.CONNECTING
                && current != SessionState.AUTHENTICATING
                && current != SessionState.RECONNECTING) {
                return false;
            }
            if (transition(current, SessionState.ACTIVE)) {
                return true;
            }
        }
    }

    private void write(String frame) {
        StreamTransport current = transport;
        if (current == null) {
            throw new TransportException(name + ": not connected");
        }
        current.send(frame);
        metrics.recordFrameSent();
        LOGGER.debug("[{}] Sent {}", name, frame);
    }

    private void terminate(RofexException cause) {
        LOGGER.error("[{}] Session terminated: {}", name, cause.getMessage());
        setState(SessionState.CLOSED);
        closeTransport();
        handlers.reportError(cause);
    }

    private void shutdown() {
        if (state.get() != SessionState.CLOSED) {
            setState(SessionState.CLOSING);
        }
        closeTransport();
        events.clear();
        subscriptions.clear();
        setState(SessionState.CLOSED);
        LOGGER.info("[{}] Session closed", name);
    }

    private void closeTransport() {
        StreamTransport current = transport;
        transport = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Failed to close transport", name, e);
        }
    }

    private void requireActive(String action) {
        if (!isActive()) {
            throw new IllegalStateException(name + ": cannot " + action + " while " + state.get());
        }
    }

    private boolean transition(SessionState expected, SessionState next) {
        if (!state.compareAndSet(expected, next)) {
            return false;
        }
        metrics.setState(next);
        LOGGER.debug("[{}] {} -> {}", name, expected, next);
        return true;
    }

    private void setState(SessionState next) {
        SessionState previous = state.getAndSet(next);
        metrics.setState(next);
        LOGGER.debug("[{}] {} -> {}", name, previous, next);
    }

    private static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError error) {
            throw error;
        }
    }

    private static boolean isRejection(AuthenticationException e) {
        return e.getStatusCode() == 401 || e.getStatusCode() == 403;
    }

    private final class ConnectionListener implements TransportListener {

        private final long connection;

        ConnectionListener(long connection) {
            this.connection = connection;
        }

        @Override
        public void onConnected() {
            if (connection == generation.get()) {
                transition(SessionState.CONNECTING, SessionState.AUTHENTICATING);
            }
        }

        @Override
        public void onFrame(String text) {
            events.offer(SessionEvent.frame(connection, text));
        }

        @Override
        public void onClosed() {
            events.offer(SessionEvent.closed(connection));
        }

        @Override
        public void onError(Throwable cause) {
            events.offer(SessionEvent.error(connection, cause));
        }
    }
}
