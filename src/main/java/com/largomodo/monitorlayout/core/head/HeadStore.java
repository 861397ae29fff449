package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.geometry.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Owns every live head and reconciles them against each new client topology.
 * <p>
 * A pass runs in three phases over one arena of tagged heads:
 * <ol>
 *   <li>Begin: every head becomes PENDING; heads whose descriptor is identical
 *       to an incoming one are claimed at once (MOVE_PENDING).</li>
 *   <li>Apply: each unclaimed descriptor reuses a PENDING head (the default head
 *       for the primary, otherwise same mode, then same slot, then any
 *       non-primary head) or creates a new one.</li>
 *   <li>End: MOVE_PENDING heads become ACTIVE and their outputs are moved;
 *       heads still PENDING are destroyed.</li>
 * </ol>
 * Not thread-safe. The store belongs to the compositor thread; a pass runs
 * inside a single {@link #reconcile} call so no caller ever sees a PENDING or
 * MOVE_PENDING head.
 */
public class HeadStore {

    private static final Logger log = LoggerFactory.getLogger(HeadStore.class);

    private final OutputManager outputManager;
    private final Map<HeadId, Head> heads = new LinkedHashMap<>();
    private final Map<Output, HeadId> bindings = new IdentityHashMap<>();
    private final RegionTracker regions = new RegionTracker();
    private HeadId defaultHeadId;
    private int nextIndex;
    private PassStats stats = new PassStats();

    public HeadStore(OutputManager outputManager) {
        this.outputManager = outputManager;
    }

    /**
     * Applies a computed layout to the head set.
     *
     * @param descriptors monitors with local rectangles computed, in client order
     * @return what the pass did
     * @throws ResourceExhaustionException if a head could not be created; the pass
     *                                     stops there and every head is left ACTIVE
     */
    public ReconciliationResult reconcile(List<MonitorDescriptor> descriptors) {
        if (descriptors.size() > Integer.SIZE) {
            throw new IllegalArgumentException("Too many monitors for one pass: " + descriptors.size());
        }
        stats = new PassStats();
        try {
            int claimed = begin(descriptors);
            for (int i = 0; i < descriptors.size(); i++) {
                if ((claimed & (1 << i)) == 0) {
                    apply(descriptors.get(i));
                }
            }
            end();
        } catch (ResourceExhaustionException e) {
            settleAfterAbort();
            throw e;
        }
        ReconciliationResult result = stats.toResult();
        log.info("Monitor layout applied: {} head(s) active ({} unchanged, {} reused, {} created, {} destroyed)",
                result.activeHeads(), result.exactMatches(), result.reused(), result.created(), result.destroyed());
        return result;
    }

    /**
     * Phase 1. Returns a bitmask of descriptor indices claimed by exact match.
     */
    int begin(List<MonitorDescriptor> descriptors) {
        regions.clear();
        for (Head head : heads.values()) {
            head.setState(HeadState.PENDING);
        }

        int claimed = 0;
        for (int i = 0; i < descriptors.size(); i++) {
            MonitorDescriptor incoming = descriptors.get(i);
            Head match = firstPending(h -> h.getDescriptor().equals(incoming));
            if (match != null) {
                log.debug("Head exact match: {} client {} primary:{}",
                        match.getName(), incoming.clientRect(), incoming.primary());
                match.setState(HeadState.MOVE_PENDING);
                regions.add(incoming);
                stats.exactMatches++;
                claimed |= 1 << i;
            }
        }
        return claimed;
    }

    /**
     * Phase 2 for one unclaimed descriptor.
     *
     * @throws ResourceExhaustionException if a new head is needed and cannot be created
     */
    void apply(MonitorDescriptor incoming) {
        Head candidate = null;
        boolean modeChange = false;

        if (incoming.primary()) {
            Head defaultHead = defaultHeadId == null ? null : heads.get(defaultHeadId);
            if (defaultHead != null && defaultHead.getState() == HeadState.PENDING) {
                candidate = defaultHead;
                modeChange = !defaultHead.getDescriptor().sameMode(incoming);
            }
        } else {
            candidate = firstPending(h -> isSecondary(h) && h.getDescriptor().sameMode(incoming));
            if (candidate == null) {
                candidate = firstPending(h -> isSecondary(h) && h.getDescriptor().sameSlot(incoming));
                if (candidate == null) {
                    candidate = firstPending(this::isSecondary);
                }
                modeChange = candidate != null;
            }
        }

        if (candidate != null) {
            reuse(candidate, incoming, modeChange);
        } else {
            create(incoming);
        }
        regions.add(incoming);
    }

    /**
     * Phase 3: finalize claimed heads, destroy the rest, check the result.
     */
    void end() {
        for (Head head : new ArrayList<>(heads.values())) {
            if (head.getState() != HeadState.MOVE_PENDING) {
                continue;
            }
            head.setState(HeadState.ACTIVE);
            Output output = head.getOutput();
            Rect local = head.getDescriptor().localRect();
            // output position may lag the head after an aborted pass or a failed move
            if (output != null && (output.x() != local.x() || output.y() != local.y())) {
                log.debug("Move head/output {} ({},{}) -> ({},{})",
                        head.getName(), output.x(), output.y(), local.x(), local.y());
                try {
                    outputManager.move(output, local.x(), local.y());
                    stats.moved++;
                } catch (OutputManagerException e) {
                    outputFailed(head, "move", e);
                }
            }
        }

        for (Head head : new ArrayList<>(heads.values())) {
            if (head.getState() == HeadState.PENDING) {
                destroy(head);
            }
        }

        checkFinalState();
        log.debug("Client virtual desktop is {}", regions.clientExtents());
        log.debug("Local virtual desktop is {}", regions.localExtents());
    }

    /**
     * Binds an output the compositor has just enabled to its head and moves the
     * output to the head's local position.
     *
     * @return the head, or empty if it was destroyed before the output came up
     */
    public Optional<Head> bindOutput(HeadId id, Output output) {
        Head head = heads.get(id);
        if (head == null) {
            log.warn("Output {} enabled for unknown head {}", output.name(), id);
            return Optional.empty();
        }
        Output previous = head.getOutput();
        if (previous != null && previous != output) {
            bindings.remove(previous);
        }
        head.setOutput(output);
        bindings.put(output, id);

        MonitorDescriptor descriptor = head.getDescriptor();
        Rect local = descriptor.localRect();
        // head may have been reused for another mode while the output was coming up
        if (output.scale() != descriptor.outputScale()
                || output.width() != local.width() || output.height() != local.height()) {
            try {
                programMode(output, descriptor);
            } catch (OutputManagerException e) {
                log.error("Output {} mode change failed for head {}: {}",
                        output.name(), head.getName(), e.getMessage());
            }
        }
        log.debug("Move head/output {} ({},{}) -> ({},{})",
                output.name(), output.x(), output.y(), local.x(), local.y());
        try {
            outputManager.move(output, local.x(), local.y());
        } catch (OutputManagerException e) {
            log.error("Output {} move failed for head {}: {}", output.name(), head.getName(), e.getMessage());
        }
        return Optional.of(head);
    }

    /**
     * Destroys every head, e.g. when the remote peer disconnects.
     */
    public void destroyAll() {
        for (Head head : new ArrayList<>(heads.values())) {
            destroy(head);
        }
        regions.clear();
    }

    /**
     * Active heads in creation order.
     */
    public List<Head> getHeads() {
        return List.copyOf(heads.values());
    }

    public Optional<Head> find(HeadId id) {
        return Optional.ofNullable(heads.get(id));
    }

    /**
     * Resolves the head bound to an output through the arena.
     */
    public Optional<Head> findByOutput(Output output) {
        HeadId id = bindings.get(output);
        return id == null ? Optional.empty() : find(id);
    }

    public Optional<Head> primaryHead() {
        return heads.values().stream().filter(Head::isPrimary).findFirst();
    }

    public Optional<HeadId> getDefaultHeadId() {
        return Optional.ofNullable(defaultHeadId);
    }

    public RegionTracker getRegions() {
        return regions;
    }

    public int size() {
        return heads.size();
    }

    /**
     * Multi-line description of every head and its bound output.
     */
    public String dump() {
        StringBuilder sb = new StringBuilder("monitor layout: ").append(heads.size()).append(" head(s)\n");
        for (Head head : heads.values()) {
            MonitorDescriptor d = head.getDescriptor();
            MonitorRecord m = d.monitor();
            sb.append("    head ").append(head.getName())
                    .append(head.getId().equals(defaultHeadId) ? " (default)" : "")
                    .append(": primary:").append(m.primary()).append('\n');
            sb.append("    client ").append(d.clientRect())
                    .append(", local ").append(d.localRect()).append('\n');
            sb.append("    physical ").append(m.physicalSize()).append("mm, orientation:")
                    .append(m.orientation().getDegrees()).append('\n');
            sb.append("    desktopScaleFactor:").append(m.desktopScaleFactor())
                    .append(", deviceScaleFactor:").append(m.deviceScaleFactor()).append('\n');
            sb.append("    scale:").append(d.outputScale())
                    .append(", client scale:").append(String.format("%3.2f", d.clientScale())).append('\n');
            Output output = head.getOutput();
            if (output == null) {
                sb.append("    assigned output: (no output)\n");
            } else {
                sb.append("    assigned output: ").append(output.name())
                        .append(" at (").append(output.x()).append(',').append(output.y()).append(") ")
                        .append(output.width()).append('x').append(output.height())
                        .append(", scale:").append(output.scale()).append('\n');
            }
        }
        sb.append("client extents ").append(regions.clientExtents())
                .append(", local extents ").append(regions.localExtents());
        return sb.toString();
    }

    private boolean isSecondary(Head head) {
        return !head.isPrimary() && !head.getId().equals(defaultHeadId);
    }

    private Head firstPending(Predicate<Head> filter) {
        for (Head head : heads.values()) {
            if (head.getState() == HeadState.PENDING && filter.test(head)) {
                return head;
            }
        }
        return null;
    }

    private void reuse(Head head, MonitorDescriptor incoming, boolean modeChange) {
        MonitorDescriptor old = head.getDescriptor();
        log.debug("Head mode change: {} OLD {}x{} scale:{} clientScale:{}",
                head.getName(), old.monitor().width(), old.monitor().height(),
                old.outputScale(), old.clientScale());
        head.assign(incoming);
        head.setState(HeadState.MOVE_PENDING);
        stats.reused++;

        if (!modeChange) {
            return;
        }
        stats.modeChanges++;
        Output output = head.getOutput();
        if (output == null) {
            // mode is applied when the output gets enabled
            log.debug("Output doesn't exist for head {}", head.getName());
            return;
        }
        try {
            programMode(output, incoming);
        } catch (OutputManagerException e) {
            outputFailed(head, "mode change", e);
        }
    }

    /**
     * Reprograms an output for a descriptor: scale (only if it differs), native
     * mode, physical size and transform, then checks the resulting size.
     */
    private void programMode(Output output, MonitorDescriptor incoming) {
        MonitorRecord m = incoming.monitor();
        log.debug("Head mode change: {} NEW {}x{} scale:{} clientScale:{}",
                output.name(), m.width(), m.height(), incoming.outputScale(), incoming.clientScale());
        if (output.scale() != incoming.outputScale()) {
            outputManager.disable(output);
            outputManager.resetScale(output);
            outputManager.setScale(output, incoming.outputScale());
            outputManager.enable(output);
        }
        outputManager.setNativeMode(output, m.width(), m.height(), incoming.outputScale());
        outputManager.setPhysicalSize(output, m.physicalWidthMm(), m.physicalHeightMm());
        outputManager.setTransformIdentity(output);

        Rect local = incoming.localRect();
        if (output.width() != local.width() || output.height() != local.height()) {
            throw new OutputManagerException("Output size " + output.width() + "x" + output.height()
                    + " does not match local rectangle " + local.size());
        }
    }

    private void create(MonitorDescriptor incoming) {
        HeadId id = new HeadId(nextIndex++);
        Head head = new Head(id, incoming, HeadState.MOVE_PENDING);
        heads.put(id, head);
        try {
            outputManager.createHead(id, incoming);
        } catch (OutputManagerException e) {
            heads.remove(id);
            bindings.values().remove(id);
            throw new ResourceExhaustionException("Cannot create head " + id.name()
                    + " for monitor at " + incoming.clientRect(), e);
        }
        if (incoming.primary()) {
            log.info("Default head {} is being added", id.name());
            defaultHeadId = id;
        } else {
            log.info("Head {} is being added for monitor at {}", id.name(), incoming.clientRect());
        }
        stats.created++;
    }

    private void destroy(Head head) {
        log.info("Head {} is being removed", head.getName());
        try {
            outputManager.destroyHead(head.getId());
        } catch (OutputManagerException e) {
            outputFailed(head, "destroy", e);
        }
        Output output = head.getOutput();
        if (output != null) {
            bindings.remove(output);
        }
        head.release();
        heads.remove(head.getId());
        if (head.getId().equals(defaultHeadId)) {
            defaultHeadId = null;
        }
        stats.destroyed++;
    }

    private void outputFailed(Head head, String operation, OutputManagerException e) {
        log.error("Output {} failed for head {}: {}", operation, head.getName(), e.getMessage());
        stats.outputFailures++;
    }

    private void checkFinalState() {
        if (heads.isEmpty()) {
            throw new IllegalStateException("Monitor layout change left no heads");
        }
        boolean primaryFound = false;
        for (Head head : heads.values()) {
            if (head.getState() != HeadState.ACTIVE) {
                throw new IllegalStateException("Head " + head.getName() + " left in state " + head.getState());
            }
            if (head.isPrimary()) {
                Rect client = head.getDescriptor().clientRect();
                if (client.x() != 0 || client.y() != 0) {
                    throw new IllegalStateException("Primary head " + head.getName() + " is not at client origin");
                }
                if (primaryFound) {
                    throw new IllegalStateException("More than one primary head after layout change");
                }
                primaryFound = true;
                log.debug("Client origin (0,0) is ({},{}) in local space",
                        head.getDescriptor().localRect().x(), head.getDescriptor().localRect().y());
            }
        }
        if (!primaryFound) {
            throw new IllegalStateException("No primary head after layout change");
        }
    }

    /**
     * A pass was abandoned: whatever was already applied stays, everything else
     * keeps its previous descriptor, and the tracked regions are rebuilt.
     */
    private void settleAfterAbort() {
        regions.clear();
        for (Head head : heads.values()) {
            if (head.getState() != HeadState.ACTIVE) {
                head.setState(HeadState.ACTIVE);
            }
            regions.add(head.getDescriptor());
        }
        log.error("Monitor layout change aborted; {} head(s) left as they were at the failure", heads.size());
    }

    private static final class PassStats {
        int exactMatches;
        int reused;
        int modeChanges;
        int created;
        int destroyed;
        int moved;
        int outputFailures;

        ReconciliationResult toResult() {
            return new ReconciliationResult(exactMatches, reused, modeChanges, created,
                    destroyed, moved, outputFailures, false);
        }
    }
}
