package com.largomodo.monitorlayout.core.domain;

/**
 * Physical monitor rotation as reported by the remote client, in degrees.
 * <p>
 * Carried through to diagnostics and descriptor equality only: the layout is
 * always computed on the rectangle the client reports, which is already in
 * rotated pixel space.
 */
public enum Orientation {
    LANDSCAPE(0),
    PORTRAIT(90),
    LANDSCAPE_FLIPPED(180),
    PORTRAIT_FLIPPED(270);

    private final int degrees;

    Orientation(int degrees) {
        this.degrees = degrees;
    }

    /**
     * Resolves the wire value (0, 90, 180 or 270).
     *
     * @throws IllegalArgumentException for any other angle
     */
    public static Orientation fromDegrees(int degrees) {
        for (Orientation o : values()) {
            if (o.degrees == degrees) {
                return o;
            }
        }
        throw new IllegalArgumentException("Unsupported monitor orientation: " + degrees
                + " (expected 0, 90, 180 or 270)");
    }

    public int getDegrees() {
        return degrees;
    }
}
