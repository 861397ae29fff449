package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.geometry.Region;

/**
 * Accumulated client-space and local-space area of every head.
 * <p>
 * Cleared when a reconciliation pass begins and grown one descriptor at a
 * time while the pass runs, so it is only meaningful between passes.
 */
public class RegionTracker {

    private final Region clientRegion = new Region();
    private final Region localRegion = new Region();

    void clear() {
        clientRegion.clear();
        localRegion.clear();
    }

    void add(MonitorDescriptor descriptor) {
        clientRegion.union(descriptor.clientRect());
        localRegion.union(descriptor.localRect());
    }

    public Rect clientExtents() {
        return clientRegion.extents();
    }

    public Rect localExtents() {
        return localRegion.extents();
    }

    /**
     * Copy of the accumulated client area.
     */
    public Region getClientRegion() {
        return clientRegion.copy();
    }

    public Region getLocalRegion() {
        return localRegion.copy();
    }
}
