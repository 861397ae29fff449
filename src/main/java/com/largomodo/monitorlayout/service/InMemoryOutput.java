package com.largomodo.monitorlayout.service;

import com.largomodo.monitorlayout.core.head.Output;

/**
 * Output kept entirely in memory by {@link InMemoryOutputManager}.
 * <p>
 * The mode is stored in client pixels; width and height report the mode
 * divided by the current scale, as a compositor output does.
 */
public class InMemoryOutput implements Output {

    private final String name;
    private int x;
    private int y;
    private int modeWidth;
    private int modeHeight;
    private int scale;
    private int physicalWidthMm;
    private int physicalHeightMm;
    private boolean enabled;
    private boolean transformIdentity;
    private int moveCount;

    InMemoryOutput(String name, int modeWidth, int modeHeight, int scale) {
        this.name = name;
        this.modeWidth = modeWidth;
        this.modeHeight = modeHeight;
        this.scale = scale;
        this.transformIdentity = true;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public int x() {
        return x;
    }

    @Override
    public int y() {
        return y;
    }

    @Override
    public int width() {
        return scale == 0 ? modeWidth : modeWidth / scale;
    }

    @Override
    public int height() {
        return scale == 0 ? modeHeight : modeHeight / scale;
    }

    @Override
    public int scale() {
        return scale;
    }

    public int getPhysicalWidthMm() {
        return physicalWidthMm;
    }

    public int getPhysicalHeightMm() {
        return physicalHeightMm;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isTransformIdentity() {
        return transformIdentity;
    }

    /**
     * Number of times the output was repositioned.
     */
    public int getMoveCount() {
        return moveCount;
    }

    void setMode(int width, int height, int newScale) {
        this.modeWidth = width;
        this.modeHeight = height;
        this.scale = newScale;
    }

    void setScale(int scale) {
        this.scale = scale;
    }

    void setPhysicalSize(int widthMm, int heightMm) {
        this.physicalWidthMm = widthMm;
        this.physicalHeightMm = heightMm;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    void setTransformIdentity() {
        this.transformIdentity = true;
    }

    void moveTo(int newX, int newY) {
        this.x = newX;
        this.y = newY;
        moveCount++;
    }

    @Override
    public String toString() {
        return name + "@(" + x + "," + y + ") " + width() + "x" + height() + " scale:" + scale
                + (enabled ? "" : " disabled");
    }
}
