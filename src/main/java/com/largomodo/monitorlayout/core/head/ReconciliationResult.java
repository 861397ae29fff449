package com.largomodo.monitorlayout.core.head;

/**
 * Counters describing what one reconciliation pass did to the head set.
 *
 * @param exactMatches     heads kept untouched because their descriptor was identical
 * @param reused           heads reused for a changed descriptor
 * @param modeChanges      reused heads whose output mode was reprogrammed
 * @param created          heads created
 * @param destroyed        heads destroyed
 * @param moved            bound outputs repositioned
 * @param outputFailures   output manager calls that failed and were skipped
 * @param scalingDegraded  scaling was requested but dropped for a complex placement
 */
public record ReconciliationResult(int exactMatches, int reused, int modeChanges, int created,
                                   int destroyed, int moved, int outputFailures, boolean scalingDegraded) {

    public ReconciliationResult withScalingDegraded(boolean degraded) {
        return new ReconciliationResult(exactMatches, reused, modeChanges, created,
                destroyed, moved, outputFailures, degraded);
    }

    /**
     * Number of heads active after the pass.
     */
    public int activeHeads() {
        return exactMatches + reused + created;
    }
}
