package com.tablewrite.bridge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues commands to attached Foundry clients and correlates each one with
 * exactly one reply or deadline.
 * <p>
 * A call fans out to every registered connection (or to one, see
 * {@link #callClient}); the first reply carrying the call's
 * {@code request_id} wins and every later reply is routed to the
 * {@link UnsolicitedMessageHandler}. Calls never block: they return a
 * future completed by the receive path, the deadline timer, or a sweep.
 * The dispatcher performs no retries.
 */
@Slf4j
public class BridgeDispatcher implements AutoCloseable {

    private final ConnectionRegistry registry;
    private final PendingCallTable pendingCalls;
    private final ObjectMapper objectMapper;
    private final DispatcherOptions options;
    private final UnsolicitedMessageHandler unsolicitedHandler;
    private final Executor completionExecutor;
    /**
     * Request ids issued by this dispatcher, mapped to their command. Only
     * consulted once an id has left the pending table, i.e. its call ended.
     */
    private final Cache<String, String> issuedCalls;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "bridge-call-timeout");
        t.setDaemon(true);
        return t;
    });
    private final ScheduledFuture<?> sweepTask;
    private volatile boolean closed;

    public BridgeDispatcher(ConnectionRegistry registry, PendingCallTable pendingCalls,
            ObjectMapper objectMapper, DispatcherOptions options) {
        this(registry, pendingCalls, objectMapper, options,
                new LoggingUnsolicitedMessageHandler(), ForkJoinPool.commonPool());
    }

    public BridgeDispatcher(ConnectionRegistry registry, PendingCallTable pendingCalls,
            ObjectMapper objectMapper, DispatcherOptions options,
            UnsolicitedMessageHandler unsolicitedHandler, Executor completionExecutor) {
        this.registry = registry;
        this.pendingCalls = pendingCalls;
        this.objectMapper = objectMapper;
        this.options = options != null ? options : DispatcherOptions.defaults();
        this.unsolicitedHandler = unsolicitedHandler != null
                ? unsolicitedHandler
                : new LoggingUnsolicitedMessageHandler();
        this.completionExecutor = completionExecutor != null ? completionExecutor : ForkJoinPool.commonPool();
        this.issuedCalls = Caffeine.newBuilder()
                .expireAfterWrite(this.options.lateReplyRetention())
                .maximumSize(10_000)
                .build();
        long sweepMs = this.options.sweepInterval().toMillis();
        this.sweepTask = scheduler.scheduleWithFixedDelay(this::sweep, sweepMs, sweepMs, TimeUnit.MILLISECONDS);
    }

    // --- Connection lifecycle ---

    /**
     * Register a newly opened connection and greet it with its client id.
     */
    public String attach(BridgeConnection connection) {
        String clientId = registry.register(connection);
        send(clientId, connection, BridgeMessage.connected(clientId));
        return clientId;
    }

    /**
     * Forget a connection. Calls addressed only to it end with
     * {@link CallOutcome.Status#CONNECTION_LOST}; fan-out calls keep waiting
     * for the remaining clients.
     */
    public void detach(String clientId) {
        if (clientId == null) {
            return;
        }
        // May already be gone after a failed send; targeted calls still need failing.
        registry.unregister(clientId);
        List<PendingCall> lost = pendingCalls.failTargeting(clientId);
        if (!lost.isEmpty()) {
            log.info("bridge:detach conn={} failed-calls={}", clientId, lost.size());
        }
    }

    // --- Calls ---

    /**
     * Send a command to every attached client using the default timeout.
     */
    public CompletableFuture<CallOutcome> call(String command, Object payload) {
        return call(command, payload, null);
    }

    /**
     * Send a command to every attached client and wait for the first reply.
     *
     * @param timeout deadline for the reply; null or non-positive means the
     *                configured default
     */
    public CompletableFuture<CallOutcome> call(String command, Object payload, Duration timeout) {
        return dispatch(null, command, payload, timeout);
    }

    /**
     * Send a command to one client only.
     */
    public CompletableFuture<CallOutcome> callClient(String clientId, String command, Object payload,
            Duration timeout) {
        if (clientId == null) {
            throw new IllegalArgumentException("clientId is required");
        }
        return dispatch(clientId, command, payload, timeout);
    }

    /**
     * End a call early. Behaves exactly like its deadline passing, except for
     * the reported status.
     *
     * @return true if the call was still waiting
     */
    public boolean cancel(String requestId) {
        PendingCall call = pendingCalls.expire(requestId, CallOutcome.Status.CANCELLED);
        if (call == null) {
            return false;
        }
        log.debug("bridge:cancel id={} command={}", requestId, call.getCommand());
        return true;
    }

    private CompletableFuture<CallOutcome> dispatch(String targetId, String command, Object payload,
            Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command is required");
        }
        if (closed) {
            log.debug("bridge:call command={} outcome=closed", command);
            return CompletableFuture.completedFuture(CallOutcome.of(CallOutcome.Status.CANCELLED));
        }
        boolean reachable = targetId == null ? !registry.isEmpty() : registry.contains(targetId);
        if (!reachable) {
            log.debug("bridge:call command={} target={} outcome=no-connection", command, targetId);
            return CompletableFuture.completedFuture(CallOutcome.noConnection());
        }

        long timeoutNanos = toNanos(effectiveTimeout(timeout));
        long now = System.nanoTime();
        // May wrap; deadlines are only compared by difference.
        long deadlineAt = now + timeoutNanos;
        PendingCall call;
        do {
            call = new PendingCall(UUID.randomUUID().toString(), command, targetId,
                    now, deadlineAt, completionExecutor);
        } while (!pendingCalls.register(call));

        String requestId = call.getRequestId();
        issuedCalls.put(requestId, command);
        try {
            call.attachTimeout(scheduler.schedule(() -> expire(requestId), timeoutNanos, TimeUnit.NANOSECONDS));
        } catch (RejectedExecutionException e) {
            // close() ran between the flag check and here; it may have missed this entry.
            pendingCalls.expire(requestId, CallOutcome.Status.CANCELLED);
            return call.getFuture();
        }

        // Caller cancellation goes through the same path as a timeout.
        call.getFuture().whenComplete((outcome, err) -> {
            if (err != null) {
                cancel(requestId);
            }
        });

        BridgeMessage message = BridgeMessage.request(command, toData(payload), requestId);
        int delivered;
        if (targetId == null) {
            delivered = fanOut(message);
        } else {
            BridgeConnection target = registry.get(targetId);
            delivered = target != null && send(targetId, target, message) ? 1 : 0;
        }
        log.debug("bridge:call id={} command={} delivered={} timeoutMs={}",
                requestId, command, delivered, TimeUnit.NANOSECONDS.toMillis(timeoutNanos));

        if (delivered == 0) {
            pendingCalls.expire(requestId, CallOutcome.Status.NO_CONNECTION);
        }
        return call.getFuture();
    }

    // --- Inbound ---

    /**
     * Route one inbound message. Never blocks on a pending call.
     */
    public void handleInbound(String clientId, BridgeMessage message) {
        if (message == null) {
            log.warn("bridge:drop conn={} reason=empty", clientId);
            return;
        }
        // A live request id makes it a reply even without a type; the adapter judges the shape.
        if (message.hasRequestId() && !message.isKeepAlive()) {
            PendingCall call = pendingCalls.resolve(message.getRequestId(), message);
            if (call != null) {
                log.debug("bridge:reply id={} command={} type={} conn={} elapsedMs={}",
                        call.getRequestId(), call.getCommand(), message.getType(), clientId,
                        call.elapsedMillis(System.nanoTime()));
                return;
            }
        }
        if (message.getType() == null || message.getType().isEmpty()) {
            log.warn("bridge:drop conn={} reason=missing-type", clientId);
            return;
        }
        if (message.isKeepAlive()) {
            BridgeConnection connection = registry.get(clientId);
            if (connection != null) {
                send(clientId, connection, BridgeMessage.pong());
            }
            return;
        }
        String endedCommand = message.hasRequestId() ? issuedCalls.getIfPresent(message.getRequestId()) : null;
        try {
            unsolicitedHandler.handle(clientId, message, endedCommand);
        } catch (RuntimeException e) {
            log.error("bridge:unsolicited handler failed conn={} type={}: {}",
                    clientId, message.getType(), e.getMessage(), e);
        }
    }

    // --- Maintenance ---

    /**
     * Time out every call whose deadline passed without its timer firing.
     *
     * @return number of calls ended
     */
    public int sweep() {
        List<PendingCall> swept = pendingCalls.sweepExpired(System.nanoTime());
        if (!swept.isEmpty()) {
            log.warn("bridge:sweep timed-out={}", swept.size());
        }
        return swept.size();
    }

    public int connectionCount() {
        return registry.count();
    }

    public int pendingCount() {
        return pendingCalls.size();
    }

    public Duration defaultTimeout() {
        return options.defaultTimeout();
    }

    @Override
    public void close() {
        closed = true;
        sweepTask.cancel(false);
        List<PendingCall> cancelled = pendingCalls.cancelAll();
        scheduler.shutdownNow();
        log.info("bridge:close cancelled-calls={}", cancelled.size());
    }

    // --- Helpers ---

    private void expire(String requestId) {
        PendingCall call = pendingCalls.expire(requestId, CallOutcome.Status.TIMED_OUT);
        if (call != null) {
            log.info("bridge:timeout id={} command={} afterMs={}", requestId, call.getCommand(),
                    call.elapsedMillis(System.nanoTime()));
        }
    }

    private int fanOut(BridgeMessage message) {
        AtomicInteger delivered = new AtomicInteger();
        registry.forEach((id, connection) -> {
            if (send(id, connection, message)) {
                delivered.incrementAndGet();
            }
        });
        return delivered.get();
    }

    /**
     * Write one message; a connection that cannot take it is dropped.
     */
    private boolean send(String clientId, BridgeConnection connection, BridgeMessage message) {
        if (!connection.isOpen()) {
            log.debug("bridge:send conn={} type={} skipped=closed", clientId, message.getType());
            dropConnection(clientId, connection);
            return false;
        }
        try {
            connection.send(message);
            return true;
        } catch (Exception e) {
            log.warn("bridge:send failed conn={} type={}: {}", clientId, message.getType(), e.getMessage());
            dropConnection(clientId, connection);
            return false;
        }
    }

    private void dropConnection(String clientId, BridgeConnection connection) {
        if (registry.unregister(clientId) != null) {
            connection.close();
        }
    }

    private Duration effectiveTimeout(Duration timeout) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            return options.defaultTimeout();
        }
        return timeout;
    }

    /** Saturates at {@code Long.MAX_VALUE} instead of overflowing. */
    private static long toNanos(Duration timeout) {
        try {
            return timeout.toNanos();
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    private JsonNode toData(Object payload) {
        if (payload == null) {
            return objectMapper.createObjectNode();
        }
        if (payload instanceof JsonNode node) {
            return node;
        }
        return objectMapper.valueToTree(payload);
    }
}
