package com.largomodo.monitorlayout.core.head;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Size;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Translates positions between client space and local space using the
 * per-head placement kept by a {@link HeadStore}.
 * <p>
 * Scaling goes through float and truncates toward zero, so mapping a point
 * there and back may drift by up to the head's client scale.
 */
public class CoordinateMapper {

    private static final Logger log = LoggerFactory.getLogger(CoordinateMapper.class);

    private final HeadStore store;

    public CoordinateMapper(HeadStore store) {
        this.store = store;
    }

    public Optional<MappedPosition> toLocal(Point client) {
        return toLocal(client, null);
    }

    /**
     * Maps a client point (and optionally a size) into local space.
     *
     * @param client position in client space
     * @param size   client-space size to scale along with the point, may be null
     * @return the mapped position, or empty if no head contains the point or the
     * containing head has no output yet
     */
    public Optional<MappedPosition> toLocal(Point client, Size size) {
        for (Head head : store.getHeads()) {
            if (head.getState() != HeadState.ACTIVE || !head.containsClientPoint(client)) {
                continue;
            }
            Output output = head.getOutput();
            if (output == null) {
                log.debug("Point {} is on head {} which has no output yet", client, head.getName());
                return Optional.empty();
            }
            MonitorDescriptor d = head.getDescriptor();
            float scale = 1.0f / d.clientScale();
            Point local = new Point(
                    scaleOnly(client.x() - d.clientRect().x(), scale) + d.localRect().x(),
                    scaleOnly(client.y() - d.clientRect().y(), scale) + d.localRect().y());
            Size mappedSize = size == null ? null : size.scale(scale);
            log.trace("toLocal: {} -> {} at head {}", client, local, head.getName());
            return Optional.of(new MappedPosition(output, head.getId(), local, mappedSize));
        }
        return Optional.empty();
    }

    public Point toClient(Output output, Point local) {
        return toClient(output, local, null).point();
    }

    /**
     * Maps a local point and size on an output back to client space. Input is
     * returned unchanged when no head is bound to the output.
     */
    public MappedPosition toClient(Output output, Point local, Size size) {
        Optional<Head> bound = store.findByOutput(output);
        if (bound.isEmpty()) {
            return new MappedPosition(output, null, local, size);
        }
        Head head = bound.get();
        MonitorDescriptor d = head.getDescriptor();
        float scale = d.clientScale();
        Point client = new Point(
                scaleOnly(local.x() - d.localRect().x(), scale) + d.clientRect().x(),
                scaleOnly(local.y() - d.localRect().y(), scale) + d.clientRect().y());
        Size mappedSize = size == null ? null : size.scale(scale);
        log.trace("toClient: {} -> {} at head {}", local, client, head.getName());
        return new MappedPosition(output, head.getId(), client, mappedSize);
    }

    private static int scaleOnly(int value, float scale) {
        return (int) ((float) value * scale);
    }
}
