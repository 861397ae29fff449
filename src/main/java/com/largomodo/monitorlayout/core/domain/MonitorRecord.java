package com.largomodo.monitorlayout.core.domain;

import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.geometry.Size;

/**
 * One monitor exactly as the remote client reported it, in client pixel space.
 * <p>
 * Unsigned wire fields are range-checked here so that nothing downstream has
 * to deal with negative sizes or percentages.
 *
 * @param x                  left edge in client space
 * @param y                  top edge in client space
 * @param width              width in client pixels (must be > 0)
 * @param height             height in client pixels (must be > 0)
 * @param primary            whether the client designates this monitor primary
 * @param physicalWidthMm    physical width in millimetres (0 if unknown)
 * @param physicalHeightMm   physical height in millimetres (0 if unknown)
 * @param orientation        monitor rotation
 * @param desktopScaleFactor client desktop scale in percent (0 if not sent)
 * @param deviceScaleFactor  client device scale in percent (0 if not sent)
 */
public record MonitorRecord(int x, int y, int width, int height, boolean primary,
                            int physicalWidthMm, int physicalHeightMm, Orientation orientation,
                            int desktopScaleFactor, int deviceScaleFactor) {

    public MonitorRecord {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Monitor size must be positive, got: " + width + "x" + height);
        }
        if (physicalWidthMm < 0 || physicalHeightMm < 0) {
            throw new IllegalArgumentException(
                    "Physical size must not be negative, got: " + physicalWidthMm + "x" + physicalHeightMm);
        }
        if (orientation == null) {
            throw new IllegalArgumentException("orientation must not be null");
        }
        if (desktopScaleFactor < 0 || deviceScaleFactor < 0) {
            throw new IllegalArgumentException("Scale factors must not be negative, got: "
                    + desktopScaleFactor + "/" + deviceScaleFactor);
        }
    }

    /**
     * Shorthand for a landscape monitor with no physical size and the given
     * desktop scale.
     */
    public static MonitorRecord of(int x, int y, int width, int height, boolean primary, int desktopScaleFactor) {
        return new MonitorRecord(x, y, width, height, primary, 0, 0,
                Orientation.LANDSCAPE, desktopScaleFactor, 100);
    }

    public Rect clientRect() {
        return new Rect(x, y, width, height);
    }

    public Size physicalSize() {
        return new Size(physicalWidthMm, physicalHeightMm);
    }
}
