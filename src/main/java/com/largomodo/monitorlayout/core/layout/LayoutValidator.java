package com.largomodo.monitorlayout.core.layout;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Checks a client topology and decides which scale each monitor gets.
 * <p>
 * Only the primary designation (and the monitor count) can reject an update.
 * Everything else degrades: a placement that is not a single horizontal or
 * vertical chain cannot be scaled coherently, so scaling is switched off for
 * that update instead of failing it.
 */
public class LayoutValidator {

    /** Upper bound on monitors a remote client may report. */
    public static final int MAX_MONITORS = 16;

    private static final Logger log = LoggerFactory.getLogger(LayoutValidator.class);

    private static final Comparator<MonitorDescriptor> BY_X = Comparator.comparingInt(d -> d.monitor().x());
    private static final Comparator<MonitorDescriptor> BY_Y = Comparator.comparingInt(d -> d.monitor().y());

    private final ScalingConfig config;
    private final ScalingPolicy policy;

    public LayoutValidator(ScalingConfig config) {
        this.config = config;
        this.policy = config.policy();
        log.debug("Scaling policy: {} (debug factor {}%)", policy, config.debugDesktopScalingFactor());
    }

    public ScalingPolicy getPolicy() {
        return policy;
    }

    /**
     * Validates a topology and computes per-monitor scale.
     * <p>
     * The returned descriptors keep the client's order and carry
     * {@link Rect#EMPTY} as local rectangle; {@link LayoutComputer} fills it.
     *
     * @param monitors client report, in client order
     * @return validated layout with connectivity and scale decided
     * @throws InvalidTopologyException if the primary designation or monitor count is unusable
     */
    public ValidatedLayout validate(List<MonitorRecord> monitors) throws InvalidTopologyException {
        if (monitors == null || monitors.isEmpty()) {
            throw new InvalidTopologyException("Client reported no monitors");
        }
        if (monitors.size() > MAX_MONITORS) {
            throw new InvalidTopologyException("Client reported " + monitors.size()
                    + " monitors, at most " + MAX_MONITORS + " are supported");
        }

        List<MonitorDescriptor> descriptors = new ArrayList<>(monitors.size());
        for (MonitorRecord monitor : monitors) {
            checkFitsCoordinateSpace(monitor);
            descriptors.add(new MonitorDescriptor(monitor,
                    policy.outputScale(monitor, config.debugDesktopScalingFactor()),
                    policy.clientScale(monitor, config.debugDesktopScalingFactor()),
                    Rect.EMPTY));
        }
        logInput(descriptors);

        int primaryCount = 0;
        boolean scalingUsed = false;
        int upperLeftX = 0;
        int upperLeftY = 0;
        for (MonitorDescriptor d : descriptors) {
            MonitorRecord m = d.monitor();
            if (m.primary()) {
                primaryCount++;
                if (m.x() != 0 || m.y() != 0) {
                    throw new InvalidTopologyException(
                            "Client reported primary monitor at (" + m.x() + "," + m.y() + "), expected (0,0)");
                }
            }
            if (d.clientScale() != 1.0f) {
                scalingUsed = true;
            }
            upperLeftX = Math.min(upperLeftX, m.x());
            upperLeftY = Math.min(upperLeftY, m.y());
        }
        if (primaryCount != 1) {
            throw new InvalidTopologyException("Client reported unexpected primary count (" + primaryCount + ")");
        }
        for (MonitorDescriptor d : descriptors) {
            checkSpanFromUpperLeft(d.monitor(), upperLeftX, upperLeftY);
        }
        log.debug("Client desktop upper left coordinate ({},{})", upperLeftX, upperLeftY);

        Connectivity connectivity = classify(descriptors);

        boolean degraded = false;
        if (scalingUsed && !connectivity.isChain()) {
            log.warn("Scaling is used, but can't be supported in complex monitor placement; falling back to scale 1");
            degraded = true;
            descriptors.replaceAll(d -> d.withScale(1, 1.0f));
        }

        return new ValidatedLayout(descriptors, connectivity, new Point(upperLeftX, upperLeftY), degraded);
    }

    /**
     * Right and bottom edges must be representable as int.
     */
    private static void checkFitsCoordinateSpace(MonitorRecord m) {
        try {
            Math.addExact(m.x(), m.width());
            Math.addExact(m.y(), m.height());
        } catch (ArithmeticException e) {
            throw new InvalidTopologyException("Client reported monitor at (" + m.x() + "," + m.y() + ") size "
                    + m.width() + "x" + m.height() + " which exceeds the coordinate range", e);
        }
    }

    /**
     * Distance from the desktop's upper-left corner to the far edges must be
     * representable as int, since local space starts at that corner.
     */
    private static void checkSpanFromUpperLeft(MonitorRecord m, int upperLeftX, int upperLeftY) {
        try {
            Math.subtractExact(m.x() + m.width(), upperLeftX);
            Math.subtractExact(m.y() + m.height(), upperLeftY);
        } catch (ArithmeticException e) {
            throw new InvalidTopologyException("Client desktop is too large: monitor at (" + m.x() + "," + m.y()
                    + ") is out of range from upper left (" + upperLeftX + "," + upperLeftY + ")", e);
        }
    }

    /**
     * Horizontal chain first, then vertical, otherwise complex.
     */
    Connectivity classify(List<MonitorDescriptor> descriptors) {
        if (descriptors.size() == 1) {
            return Connectivity.HORIZONTAL;
        }

        List<MonitorDescriptor> sorted = new ArrayList<>(descriptors);
        sorted.sort(BY_X);
        if (isChain(sorted, true)) {
            log.debug("All monitors are horizontally placed");
            return Connectivity.HORIZONTAL;
        }

        sorted.sort(BY_Y);
        if (isChain(sorted, false)) {
            log.debug("All monitors are vertically placed");
            return Connectivity.VERTICAL;
        }

        log.debug("Monitors form neither a horizontal nor a vertical chain");
        return Connectivity.COMPLEX;
    }

    private boolean isChain(List<MonitorDescriptor> sorted, boolean horizontal) {
        for (int i = 1; i < sorted.size(); i++) {
            Rect prev = sorted.get(i - 1).clientRect();
            Rect cur = sorted.get(i).clientRect();
            if (horizontal) {
                if (prev.x2() != cur.x()) {
                    log.debug("Monitors not horizontally connected at {} (x check)", i);
                    return false;
                }
                if (!Rect.spanOverlaps(prev.y(), prev.y2(), cur.y(), cur.y2())) {
                    log.debug("Monitors not horizontally connected at {} (y check)", i);
                    return false;
                }
            } else {
                if (prev.y2() != cur.y()) {
                    log.debug("Monitors not vertically connected at {} (y check)", i);
                    return false;
                }
                if (!Rect.spanOverlaps(prev.x(), prev.x2(), cur.x(), cur.x2())) {
                    log.debug("Monitors not vertically connected at {} (x check)", i);
                    return false;
                }
            }
        }
        return true;
    }

    private void logInput(List<MonitorDescriptor> descriptors) {
        if (!log.isDebugEnabled()) {
            return;
        }
        for (int i = 0; i < descriptors.size(); i++) {
            MonitorDescriptor d = descriptors.get(i);
            MonitorRecord m = d.monitor();
            log.debug("monitor[{}]: x:{}, y:{}, width:{}, height:{}, primary:{}",
                    i, m.x(), m.y(), m.width(), m.height(), m.primary());
            log.debug("monitor[{}]: physical:{}mm, orientation:{}, desktopScale:{}%, deviceScale:{}%",
                    i, m.physicalSize(), m.orientation().getDegrees(),
                    m.desktopScaleFactor(), m.deviceScaleFactor());
            log.debug("monitor[{}]: scale:{}, clientScale:{}", i, d.outputScale(), d.clientScale());
        }
    }
}
