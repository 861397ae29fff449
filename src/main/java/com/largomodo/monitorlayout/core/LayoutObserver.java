package com.largomodo.monitorlayout.core;

import com.largomodo.monitorlayout.core.head.ReconciliationResult;

/**
 * Observer interface for monitor layout change events.
 * <p>
 * Callbacks run on the compositor thread, in the order topology changes were
 * submitted. All methods have default no-op implementations, allowing
 * consumers to override only the events they care about.
 * </p>
 *
 * @see com.largomodo.monitorlayout.service.TopologyDispatcher
 */
public interface LayoutObserver {

    /**
     * Called when a topology change starts being applied.
     *
     * @param sequence     submission sequence number, starting at 1
     * @param monitorCount number of monitors the client reported
     */
    default void onStart(long sequence, int monitorCount) {}

    /**
     * Called after the head set has been reconciled with the new topology.
     *
     * @param sequence submission sequence number
     * @param result   what the pass did
     */
    default void onSuccess(long sequence, ReconciliationResult result) {}

    /**
     * Called when a topology change was rejected or aborted.
     *
     * @param sequence submission sequence number
     * @param e        the exception that stopped the change
     */
    default void onFailure(long sequence, Exception e) {}
}
