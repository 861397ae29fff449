package com.largomodo.monitorlayout.core.head;

/**
 * Native configuration for an output: the true client resolution, not
 * adjusted for DPI, and the integer scale of the head it shows.
 *
 * @param width  client width in pixels
 * @param height client height in pixels
 * @param scale  integer output scale
 */
public record OutputConfig(int width, int height, int scale) {
}
