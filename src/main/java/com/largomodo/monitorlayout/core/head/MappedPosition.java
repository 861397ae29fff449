package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Size;

/**
 * Result of mapping a client point into local space.
 *
 * @param output output of the head that contains the point
 * @param head   head that contains the point
 * @param point  mapped position in local space
 * @param size   mapped size, or null when only a point was mapped
 */
public record MappedPosition(Output output, HeadId head, Point point, Size size) {
}
