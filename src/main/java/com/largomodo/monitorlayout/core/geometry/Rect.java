package com.largomodo.monitorlayout.core.geometry;

/**
 * Axis-aligned rectangle with a half-open extent: a rectangle at (0,0) of
 * width 1920 covers columns 0..1919.
 *
 * @param x      left edge
 * @param y      top edge
 * @param width  horizontal extent, never negative
 * @param height vertical extent, never negative
 */
public record Rect(int x, int y, int width, int height) {

    public static final Rect EMPTY = new Rect(0, 0, 0, 0);

    public Rect {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Rectangle size must not be negative: " + width + "x" + height);
        }
    }

    /**
     * Builds a rectangle from its corner coordinates (x2/y2 exclusive).
     */
    public static Rect fromCorners(int x1, int y1, int x2, int y2) {
        return new Rect(x1, y1, x2 - x1, y2 - y1);
    }

    public int x2() {
        return x + width;
    }

    public int y2() {
        return y + height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public Point origin() {
        return new Point(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }

    public boolean contains(int px, int py) {
        return px >= x && px < x2() && py >= y && py < y2();
    }

    public boolean contains(Point p) {
        return contains(p.x(), p.y());
    }

    /**
     * True when both rectangles share at least one pixel.
     */
    public boolean intersects(Rect other) {
        if (isEmpty() || other.isEmpty()) {
            return false;
        }
        return spanOverlaps(x, x2(), other.x, other.x2())
                && spanOverlaps(y, y2(), other.y, other.y2());
    }

    public Rect translate(int dx, int dy) {
        return new Rect(x + dx, y + dy, width, height);
    }

    /**
     * Smallest rectangle covering both. An empty operand is ignored.
     */
    public Rect boundingUnion(Rect other) {
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        return fromCorners(
                Math.min(x, other.x), Math.min(y, other.y),
                Math.max(x2(), other.x2()), Math.max(y2(), other.y2()));
    }

    /**
     * Whether the half-open intervals [l1, l2) and [r1, r2) share a point.
     */
    public static boolean spanOverlaps(int l1, int l2, int r1, int r2) {
        return Math.max(l1, r1) < Math.min(l2, r2);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + " " + width + "x" + height + ")";
    }
}
