package com.tablewrite.bridge;

import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * In-flight calls keyed by request id.
 * <p>
 * Removal from the map and the waiter's own claim are both atomic, so a reply
 * and a deadline racing for the same id can never both resolve it.
 */
public class PendingCallTable {

    private final Map<String, PendingCall> calls = new ConcurrentHashMap<>();

    /**
     * Insert a call.
     *
     * @return false if the request id is already taken
     */
    public boolean register(PendingCall call) {
        return calls.putIfAbsent(call.getRequestId(), call) == null;
    }

    /**
     * Resolve the call waiting on {@code requestId} with a reply.
     *
     * @return the call that was resolved, or null if no call was waiting
     */
    public PendingCall resolve(String requestId, BridgeMessage reply) {
        return finish(requestId, CallOutcome.replied(reply));
    }

    /**
     * End the call waiting on {@code requestId} without a reply.
     *
     * @return the call that was ended, or null if no call was waiting
     */
    public PendingCall expire(String requestId, CallOutcome.Status status) {
        return finish(requestId, CallOutcome.of(status));
    }

    public boolean contains(String requestId) {
        return requestId != null && calls.containsKey(requestId);
    }

    public int size() {
        return calls.size();
    }

    /**
     * Time out every call whose deadline has passed.
     *
     * @return the calls that were ended
     */
    public List<PendingCall> sweepExpired(long nowNanos) {
        return finishMatching(call -> call.isPastDeadline(nowNanos), CallOutcome.Status.TIMED_OUT);
    }

    /**
     * Fail every call addressed to the given connection.
     */
    public List<PendingCall> failTargeting(String connectionId) {
        return finishMatching(call -> connectionId.equals(call.getTargetConnectionId()),
                CallOutcome.Status.CONNECTION_LOST);
    }

    /** Cancel everything, used on shutdown. */
    public List<PendingCall> cancelAll() {
        return finishMatching(call -> true, CallOutcome.Status.CANCELLED);
    }

    private PendingCall finish(String requestId, CallOutcome outcome) {
        if (requestId == null)
            return null;
        PendingCall call = calls.remove(requestId);
        if (call != null && call.complete(outcome)) {
            return call;
        }
        return null;
    }

    private List<PendingCall> finishMatching(Predicate<PendingCall> filter, CallOutcome.Status status) {
        List<PendingCall> finished = new ArrayList<>();
        for (PendingCall call : calls.values()) {
            if (filter.test(call) && calls.remove(call.getRequestId(), call)
                    && call.complete(CallOutcome.of(status))) {
                finished.add(call);
            }
        }
        return finished;
    }
}
