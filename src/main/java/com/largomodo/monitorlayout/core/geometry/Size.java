package com.largomodo.monitorlayout.core.geometry;

/**
 * Width/height pair with no position component.
 *
 * @param width  horizontal extent in pixels (or millimetres for physical sizes)
 * @param height vertical extent
 */
public record Size(int width, int height) {

    /**
     * Scales both dimensions, truncating toward zero the same way the
     * compositor's float-to-int conversion does.
     */
    public Size scale(float factor) {
        return new Size((int) ((float) width * factor), (int) ((float) height * factor));
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
