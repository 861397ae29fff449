package com.largomodo.monitorlayout.core.domain;

/**
 * Stable identity of a head for its whole lifetime.
 * <p>
 * Outputs hold a HeadId rather than the head itself; the head store resolves
 * it on demand.
 *
 * @param index monotonically increasing allocation index, never reused
 */
public record HeadId(int index) {

    public HeadId {
        if (index < 0) {
            throw new IllegalArgumentException("Head index must not be negative: " + index);
        }
    }

    /**
     * Compositor-visible head name, e.g. {@code rdp-1a}.
     */
    public String name() {
        return "rdp-" + Integer.toHexString(index);
    }

    @Override
    public String toString() {
        return name();
    }
}
