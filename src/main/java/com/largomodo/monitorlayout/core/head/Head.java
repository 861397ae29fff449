package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Region;

/**
 * One logical display exposed to the compositor, owned by {@link HeadStore}.
 * <p>
 * Identity is the {@link HeadId}; descriptor, regions and output binding change
 * in place when the head is reused for a different monitor. Mutators are
 * package-private so only the store can change a head.
 */
public final class Head {

    private final HeadId id;
    private final Region clientRegion = new Region();
    private final Region localRegion = new Region();
    private MonitorDescriptor descriptor;
    private Output output;
    private HeadState state;

    Head(HeadId id, MonitorDescriptor descriptor, HeadState state) {
        this.id = id;
        this.state = state;
        assign(descriptor);
    }

    public HeadId getId() {
        return id;
    }

    public String getName() {
        return id.name();
    }

    public MonitorDescriptor getDescriptor() {
        return descriptor;
    }

    /**
     * Copy of the head's client-space area; changing it does not affect the head.
     */
    public Region getClientRegion() {
        return clientRegion.copy();
    }

    public Region getLocalRegion() {
        return localRegion.copy();
    }

    public boolean containsClientPoint(Point client) {
        return clientRegion.contains(client);
    }

    /**
     * Bound output, or null until the compositor enables one for this head.
     */
    public Output getOutput() {
        return output;
    }

    public HeadState getState() {
        return state;
    }

    public boolean isPrimary() {
        return descriptor.primary();
    }

    void assign(MonitorDescriptor newDescriptor) {
        this.descriptor = newDescriptor;
        clientRegion.reset(newDescriptor.clientRect());
        localRegion.reset(newDescriptor.localRect());
    }

    void setState(HeadState state) {
        this.state = state;
    }

    void setOutput(Output output) {
        this.output = output;
    }

    void release() {
        output = null;
        clientRegion.clear();
        localRegion.clear();
    }

    @Override
    public String toString() {
        return id.name() + "[" + state + ", client " + descriptor.clientRect()
                + ", local " + descriptor.localRect() + (isPrimary() ? ", primary" : "") + "]";
    }
}
