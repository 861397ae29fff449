package com.largomodo.monitorlayout.service;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.head.Output;
import com.largomodo.monitorlayout.core.head.OutputManager;
import com.largomodo.monitorlayout.core.head.OutputManagerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.BiConsumer;

/**
 * Output manager that keeps heads and outputs in memory.
 * <p>
 * Behaves like a compositor backend as far as the layout engine can tell:
 * a created head gets its output on a later turn of the loop, reported
 * through the output-enabled listener; a set scale must be reset before it
 * can change; and only a fixed number of heads fit.
 */
public class InMemoryOutputManager implements OutputManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryOutputManager.class);

    private final Executor deferred;
    private final int capacity;
    private final Map<HeadId, MonitorDescriptor> heads = new LinkedHashMap<>();
    private final Map<HeadId, InMemoryOutput> outputs = new LinkedHashMap<>();
    private BiConsumer<HeadId, Output> outputEnabledListener = (id, output) -> {};

    /**
     * @param deferred runs output enabling after the current task, normally the {@link DisplayLoop}
     * @param capacity maximum number of live heads
     */
    public InMemoryOutputManager(Executor deferred, int capacity) {
        this.deferred = deferred;
        this.capacity = capacity;
    }

    public void setOutputEnabledListener(BiConsumer<HeadId, Output> listener) {
        this.outputEnabledListener = listener;
    }

    @Override
    public void createHead(HeadId head, MonitorDescriptor descriptor) {
        if (heads.size() >= capacity) {
            throw new OutputManagerException("No room for head " + head.name() + ", " + capacity + " in use");
        }
        heads.put(head, descriptor);
        log.debug("Head {} created", head.name());
        deferred.execute(() -> enableOutput(head));
    }

    @Override
    public void destroyHead(HeadId head) {
        if (heads.remove(head) == null) {
            throw new OutputManagerException("Unknown head " + head.name());
        }
        InMemoryOutput output = outputs.remove(head);
        if (output != null) {
            output.setEnabled(false);
        }
        log.debug("Head {} destroyed", head.name());
    }

    @Override
    public void disable(Output output) {
        own(output).setEnabled(false);
    }

    @Override
    public void enable(Output output) {
        own(output).setEnabled(true);
    }

    @Override
    public void resetScale(Output output) {
        own(output).setScale(0);
    }

    @Override
    public void setScale(Output output, int scale) {
        InMemoryOutput o = own(output);
        if (o.scale() != 0) {
            throw new OutputManagerException("Output " + o.name() + " already has scale " + o.scale());
        }
        if (scale < 1) {
            throw new OutputManagerException("Invalid scale " + scale + " for output " + o.name());
        }
        o.setScale(scale);
    }

    @Override
    public void setNativeMode(Output output, int width, int height, int scale) {
        own(output).setMode(width, height, scale);
    }

    @Override
    public void setPhysicalSize(Output output, int widthMm, int heightMm) {
        own(output).setPhysicalSize(widthMm, heightMm);
    }

    @Override
    public void setTransformIdentity(Output output) {
        own(output).setTransformIdentity();
    }

    @Override
    public void move(Output output, int x, int y) {
        own(output).moveTo(x, y);
    }

    public int headCount() {
        return heads.size();
    }

    public Optional<InMemoryOutput> outputOf(HeadId head) {
        return Optional.ofNullable(outputs.get(head));
    }

    private void enableOutput(HeadId head) {
        MonitorDescriptor descriptor = heads.get(head);
        if (descriptor == null) {
            log.debug("Head {} was removed before its output came up", head.name());
            return;
        }
        InMemoryOutput output = new InMemoryOutput(head.name(),
                descriptor.monitor().width(), descriptor.monitor().height(), descriptor.outputScale());
        output.setPhysicalSize(descriptor.monitor().physicalWidthMm(), descriptor.monitor().physicalHeightMm());
        output.setEnabled(true);
        outputs.put(head, output);
        log.debug("Output {} enabled", output);
        outputEnabledListener.accept(head, output);
    }

    private InMemoryOutput own(Output output) {
        if (output instanceof InMemoryOutput) {
            InMemoryOutput o = (InMemoryOutput) output;
            if (outputs.containsValue(o)) {
                return o;
            }
        }
        throw new OutputManagerException("Output " + output.name() + " is not managed here");
    }
}
