package org.carma.slotcoord.runner;

/**
 * Lifecycle of a {@link RoundCoordinator}.
 *
 * IDLE -> DEMAND_GENERATED -> NEGOTIATING -> RESOLVED -> RECORDED -> (IDLE | TERMINATED)
 *
 * DEMAND_GENERATED is skipped on rounds that keep the previous demand.
 */
public enum CoordinatorState {
    IDLE,
    DEMAND_GENERATED,
    NEGOTIATING,
    RESOLVED,
    RECORDED,
    TERMINATED
}
