package com.largomodo.monitorlayout.core.domain;

import com.largomodo.monitorlayout.core.geometry.Rect;

/**
 * Validated monitor: the client report plus the scale and local placement
 * computed for it.
 * <p>
 * Record equality covers every field, so two descriptors compare equal only
 * when the client report, both scales and the local rectangle all match. The
 * head store relies on that for its exact-match reuse rule.
 *
 * @param monitor     client report
 * @param outputScale integer compositor scale (at least 1)
 * @param clientScale true client-to-local ratio (positive; the scaling policy keeps it at 1.0 or above)
 * @param localRect   placement in local space, {@link Rect#EMPTY} until the layout is computed
 */
public record MonitorDescriptor(MonitorRecord monitor, int outputScale, float clientScale, Rect localRect) {

    public MonitorDescriptor {
        if (monitor == null) {
            throw new IllegalArgumentException("monitor must not be null");
        }
        if (outputScale < 1) {
            throw new IllegalArgumentException("outputScale must be at least 1, got: " + outputScale);
        }
        if (!(clientScale > 0.0f)) {
            throw new IllegalArgumentException("clientScale must be positive, got: " + clientScale);
        }
        if (localRect == null) {
            throw new IllegalArgumentException("localRect must not be null");
        }
    }

    public Rect clientRect() {
        return monitor.clientRect();
    }

    public boolean primary() {
        return monitor.primary();
    }

    public MonitorDescriptor withScale(int newOutputScale, float newClientScale) {
        return new MonitorDescriptor(monitor, newOutputScale, newClientScale, localRect);
    }

    public MonitorDescriptor withLocalRect(Rect newLocalRect) {
        return new MonitorDescriptor(monitor, outputScale, clientScale, newLocalRect);
    }

    /**
     * Width, height and output scale all match: the compositor mode would not change.
     */
    public boolean sameMode(MonitorDescriptor other) {
        return monitor.width() == other.monitor.width()
                && monitor.height() == other.monitor.height()
                && outputScale == other.outputScale;
    }

    /**
     * Client-space origin matches.
     */
    public boolean sameSlot(MonitorDescriptor other) {
        return monitor.x() == other.monitor.x() && monitor.y() == other.monitor.y();
    }
}
