package com.largomodo.monitorlayout.core.geometry;

/**
 * Integer pixel position in either client or local space.
 *
 * @param x horizontal coordinate
 * @param y vertical coordinate
 */
public record Point(int x, int y) {

    public Point translate(int dx, int dy) {
        return new Point(x + dx, y + dy);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
