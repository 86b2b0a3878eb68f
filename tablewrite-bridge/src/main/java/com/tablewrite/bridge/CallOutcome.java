package com.tablewrite.bridge;

import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;

/**
 * Terminal result of one {@link BridgeDispatcher} call.
 * Only {@link Status#REPLIED} carries a reply.
 */
public record CallOutcome(Status status, BridgeMessage reply) {

    public enum Status {
        /** A client answered with a matching request id. */
        REPLIED,
        /** No client was attached, nothing was sent. */
        NO_CONNECTION,
        /** The deadline passed before any reply. */
        TIMED_OUT,
        /** The caller or a shutdown abandoned the call. */
        CANCELLED,
        /** The only client the call was addressed to went away. */
        CONNECTION_LOST
    }

    public CallOutcome {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        if ((status == Status.REPLIED) != (reply != null)) {
            throw new IllegalArgumentException("reply must be present exactly when status is REPLIED");
        }
    }

    public static CallOutcome replied(BridgeMessage reply) {
        return new CallOutcome(Status.REPLIED, reply);
    }

    public static CallOutcome noConnection() {
        return new CallOutcome(Status.NO_CONNECTION, null);
    }

    public static CallOutcome timedOut() {
        return new CallOutcome(Status.TIMED_OUT, null);
    }

    public static CallOutcome of(Status status) {
        return new CallOutcome(status, null);
    }

    public boolean isReplied() {
        return status == Status.REPLIED;
    }
}
