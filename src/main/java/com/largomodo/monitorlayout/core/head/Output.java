package com.largomodo.monitorlayout.core.head;

/**
 * Compositor display output as the layout engine sees it.
 * <p>
 * The engine never constructs outputs. The {@link OutputManager} creates one
 * for a head and hands it over through the head store's binding callback; the
 * engine then only reads geometry from it and drives it through the manager.
 * Width and height are in local (post-scale) pixels.
 */
public interface Output {

    String name();

    int x();

    int y();

    int width();

    int height();

    /**
     * Current integer scale, 0 while unset.
     */
    int scale();
}
