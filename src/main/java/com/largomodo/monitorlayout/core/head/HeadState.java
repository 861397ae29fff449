package com.largomodo.monitorlayout.core.head;

/**
 * Reconciliation tag carried by every head.
 * <p>
 * Outside a pass every head is ACTIVE. During a pass a head moves
 * {@code PENDING -> MOVE_PENDING -> ACTIVE}, or stays PENDING and is destroyed
 * when the pass ends.
 */
public enum HeadState {
    ACTIVE,
    PENDING,
    MOVE_PENDING
}
