package com.largomodo.monitorlayout.core.layout;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.geometry.Point;

import java.util.List;

/**
 * Output of {@link LayoutValidator} and, once {@link LayoutComputer} has run,
 * of the whole layout step.
 *
 * @param descriptors     monitors in the order the client reported them (unmodifiable)
 * @param connectivity    placement class used to lay out local rectangles
 * @param upperLeft       top-left corner of the client desktop, both coordinates &lt;= 0
 * @param scalingDegraded true when scaling was requested but dropped because the placement is complex
 */
public record ValidatedLayout(List<MonitorDescriptor> descriptors, Connectivity connectivity,
                              Point upperLeft, boolean scalingDegraded) {

    public ValidatedLayout {
        descriptors = List.copyOf(descriptors);
    }

    /**
     * True when at least one monitor keeps a client scale other than 1.
     */
    public boolean isScaled() {
        return descriptors.stream().anyMatch(d -> d.clientScale() != 1.0f);
    }

    public ValidatedLayout withDescriptors(List<MonitorDescriptor> newDescriptors) {
        return new ValidatedLayout(newDescriptors, connectivity, upperLeft, scalingDegraded);
    }
}
