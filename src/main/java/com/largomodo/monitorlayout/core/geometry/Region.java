package com.largomodo.monitorlayout.core.geometry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable union of rectangles.
 * <p>
 * Only what the layout engine needs: point containment, union with a
 * rectangle, and the bounding extents. Rectangles are stored as given; the
 * region never splits or coalesces them, which is enough for the handful of
 * monitors a remote client can report.
 */
public class Region {

    private final List<Rect> rects = new ArrayList<>();
    private Rect extents = Rect.EMPTY;

    public Region() {
    }

    public Region(Rect initial) {
        union(initial);
    }

    /**
     * Adds a rectangle to the region. Empty rectangles are ignored.
     */
    public void union(Rect rect) {
        if (rect.isEmpty()) {
            return;
        }
        rects.add(rect);
        extents = extents.boundingUnion(rect);
    }

    /**
     * Independent region with the same rectangles.
     */
    public Region copy() {
        Region copy = new Region();
        for (Rect r : rects) {
            copy.union(r);
        }
        return copy;
    }

    public void clear() {
        rects.clear();
        extents = Rect.EMPTY;
    }

    /**
     * Replaces the content with a single rectangle.
     */
    public void reset(Rect rect) {
        clear();
        union(rect);
    }

    public boolean contains(Point p) {
        for (Rect r : rects) {
            if (r.contains(p)) {
                return true;
            }
        }
        return false;
    }

    public boolean intersects(Region other) {
        for (Rect mine : rects) {
            for (Rect theirs : other.rects) {
                if (mine.intersects(theirs)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean isEmpty() {
        return rects.isEmpty();
    }

    /**
     * Bounding box of every rectangle in the region, {@link Rect#EMPTY} when empty.
     */
    public Rect extents() {
        return extents;
    }

    public List<Rect> rects() {
        return Collections.unmodifiableList(rects);
    }

    @Override
    public String toString() {
        return "Region" + rects;
    }
}
