package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;

/**
 * Compositor-side resource manager driven by the head store.
 * <p>
 * Every call is synchronous. A call that fails throws
 * {@link OutputManagerException} and leaves whatever state it reached; the
 * head store never rolls back.
 */
public interface OutputManager {

    /**
     * Registers a new head with the compositor. Binding an output to it happens
     * later, when the compositor enables one and calls back into the engine.
     *
     * @throws OutputManagerException if the compositor cannot take another head
     */
    void createHead(HeadId head, MonitorDescriptor descriptor) throws OutputManagerException;

    /**
     * Releases a head and detaches it from its output, if any.
     */
    void destroyHead(HeadId head) throws OutputManagerException;

    void disable(Output output) throws OutputManagerException;

    void enable(Output output) throws OutputManagerException;

    /**
     * Clears the scale to the unset state. Outputs refuse to change a scale
     * that is already set, so this must precede {@link #setScale}.
     */
    void resetScale(Output output) throws OutputManagerException;

    void setScale(Output output, int scale) throws OutputManagerException;

    /**
     * Sets the native mode in client pixels; the output's size becomes
     * {@code width / scale} by {@code height / scale}.
     */
    void setNativeMode(Output output, int width, int height, int scale) throws OutputManagerException;

    void setPhysicalSize(Output output, int widthMm, int heightMm) throws OutputManagerException;

    void setTransformIdentity(Output output) throws OutputManagerException;

    /**
     * Repositions the output in local space and notifies its clients.
     */
    void move(Output output, int x, int y) throws OutputManagerException;
}
