package org.carma.slotcoord.config;

/**
 * When demand is regenerated between rounds. A successful round always
 * triggers regeneration regardless of policy.
 */
public enum DemandRefreshPolicy {

    /** Keep demand until a round succeeds. */
    ON_SUCCESS,

    /** New demand before every round. */
    EVERY_ROUND,

    /** New demand every {@code interval} rounds. */
    EVERY_K_ROUNDS;

    /**
     * @param round 1-based number of the round about to start
     * @param interval cadence for {@link #EVERY_K_ROUNDS}
     */
    public boolean isDue(int round, int interval) {
        switch (this) {
            case EVERY_ROUND:
                return round > 1;
            case EVERY_K_ROUNDS:
                return round > 1 && (round - 1) % interval == 0;
            case ON_SUCCESS:
            default:
                return false;
        }
    }
}
