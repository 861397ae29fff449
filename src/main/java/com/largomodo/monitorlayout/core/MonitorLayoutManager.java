package com.largomodo.monitorlayout.core;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.geometry.Size;
import com.largomodo.monitorlayout.core.head.CoordinateMapper;
import com.largomodo.monitorlayout.core.head.Head;
import com.largomodo.monitorlayout.core.head.HeadStore;
import com.largomodo.monitorlayout.core.head.MappedPosition;
import com.largomodo.monitorlayout.core.head.Output;
import com.largomodo.monitorlayout.core.head.OutputConfig;
import com.largomodo.monitorlayout.core.head.OutputManager;
import com.largomodo.monitorlayout.core.head.ReconciliationResult;
import com.largomodo.monitorlayout.core.layout.InvalidTopologyException;
import com.largomodo.monitorlayout.core.layout.LayoutComputer;
import com.largomodo.monitorlayout.core.layout.LayoutValidator;
import com.largomodo.monitorlayout.core.layout.ScalingConfig;
import com.largomodo.monitorlayout.core.layout.ValidatedLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Monitor layout engine entry point.
 * <p>
 * Pipeline per topology change:
 * 1. Validate the client report and decide scales ({@link LayoutValidator})
 * 2. Compute local rectangles ({@link LayoutComputer})
 * 3. Reconcile the head set with the result ({@link HeadStore})
 * <p>
 * A rejected topology never reaches step 3, so the previous layout stays
 * queryable. All methods must be called on the compositor thread.
 */
public class MonitorLayoutManager {

    private static final Logger log = LoggerFactory.getLogger(MonitorLayoutManager.class);

    private final LayoutValidator validator;
    private final LayoutComputer computer;
    private final HeadStore store;
    private final CoordinateMapper mapper;

    public MonitorLayoutManager(ScalingConfig config, OutputManager outputManager) {
        this(new LayoutValidator(config), new LayoutComputer(), new HeadStore(outputManager));
    }

    MonitorLayoutManager(LayoutValidator validator, LayoutComputer computer, HeadStore store) {
        this.validator = validator;
        this.computer = computer;
        this.store = store;
        this.mapper = new CoordinateMapper(store);
    }

    /**
     * Applies a new client topology.
     *
     * @param monitors monitors as the client reported them
     * @return what the reconciliation did
     * @throws InvalidTopologyException if the topology is rejected; nothing is changed
     * @throws com.largomodo.monitorlayout.core.head.ResourceExhaustionException if a head could not be created
     */
    public ReconciliationResult adjustMonitorLayout(List<MonitorRecord> monitors) {
        ValidatedLayout layout;
        try {
            layout = validator.validate(monitors);
        } catch (InvalidTopologyException e) {
            log.error("Monitor layout rejected: {}", e.getMessage());
            throw e;
        }
        ValidatedLayout computed = computer.compute(layout);
        return store.reconcile(computed.descriptors()).withScalingDegraded(computed.scalingDegraded());
    }

    public Optional<MappedPosition> mapToLocal(Point client) {
        return mapper.toLocal(client);
    }

    public Optional<MappedPosition> mapToLocal(Point client, Size size) {
        return mapper.toLocal(client, size);
    }

    public Point mapToClient(Output output, Point local) {
        return mapper.toClient(output, local);
    }

    public MappedPosition mapToClient(Output output, Point local, Size size) {
        return mapper.toClient(output, local, size);
    }

    /**
     * Bounding box of the client desktop, {@link Rect#EMPTY} before the first layout.
     */
    public Rect boundingClientExtents() {
        return store.getRegions().clientExtents();
    }

    public Rect boundingLocalExtents() {
        return store.getRegions().localExtents();
    }

    /**
     * Output of the primary head, empty until the compositor has enabled one.
     */
    public Optional<Output> primaryOutput() {
        return store.primaryHead().map(Head::getOutput);
    }

    /**
     * Client-space size of the primary monitor.
     */
    public Optional<Size> primarySize() {
        return store.primaryHead().map(h -> h.getDescriptor().clientRect().size());
    }

    /**
     * Native configuration for the head shown on an output.
     */
    public Optional<OutputConfig> outputConfig(Output output) {
        return store.findByOutput(output).map(h -> {
            MonitorRecord m = h.getDescriptor().monitor();
            return new OutputConfig(m.width(), m.height(), h.getDescriptor().outputScale());
        });
    }

    public Optional<Size> headPhysicalSize(HeadId id) {
        return store.find(id).map(h -> h.getDescriptor().monitor().physicalSize());
    }

    /**
     * Compositor callback: an output was enabled for a head.
     */
    public Optional<Head> outputEnabled(HeadId id, Output output) {
        return store.bindOutput(id, output);
    }

    public List<Head> heads() {
        return store.getHeads();
    }

    /**
     * Logs every head at INFO and returns the same text.
     */
    public String dumpHeads() {
        String dump = store.dump();
        log.info("{}", dump);
        return dump;
    }

    /**
     * Destroys every head, e.g. when the remote peer disconnects.
     */
    public void shutdown() {
        log.info("Destroying {} head(s)", store.size());
        store.destroyAll();
    }
}
