package com.largomodo.monitorlayout.core.layout;

/**
 * Placement class of a topology. Per-monitor scaling is only coherent when
 * every monitor sits on one edge-to-edge chain along a single axis.
 */
public enum Connectivity {
    /** Sorted by x, each right edge touches the next left edge and rows overlap. */
    HORIZONTAL,
    /** Sorted by y, each bottom edge touches the next top edge and columns overlap. */
    VERTICAL,
    /** No single chain. */
    COMPLEX;

    public boolean isChain() {
        return this != COMPLEX;
    }
}
