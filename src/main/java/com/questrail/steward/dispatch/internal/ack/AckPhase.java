package com.questrail.steward.dispatch.internal.ack;

/**
 * Acknowledgment phase of one event. Advances monotonically in declaration
 * order and never regresses.
 */
public enum AckPhase {
    UNACKED,
    DEFERRED,
    RESPONDED;

    public boolean isAtLeast(AckPhase other) {
        return compareTo(other) >= 0;
    }
}
