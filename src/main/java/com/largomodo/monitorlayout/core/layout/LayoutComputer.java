package com.largomodo.monitorlayout.core.layout;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.geometry.Rect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Assigns every validated monitor its rectangle in local space.
 * <p>
 * Two strategies:
 * <ul>
 *   <li>Scaled chain: each monitor shrinks by its own output scale and the
 *       rectangles are packed edge to edge along the chain axis. The cross axis
 *       keeps the monitor's offset from the desktop corner, scaled the same way.</li>
 *   <li>Unscaled: local rectangles are the client rectangles shifted so the
 *       desktop's upper-left corner lands on (0,0), and every scale is 1.</li>
 * </ul>
 * Either way every local rectangle starts at non-negative coordinates.
 */
public class LayoutComputer {

    private static final Logger log = LoggerFactory.getLogger(LayoutComputer.class);

    /**
     * Computes local rectangles, returning descriptors in the client's original order.
     *
     * @param layout output of {@link LayoutValidator#validate}
     * @return the same layout with every descriptor's local rectangle set
     * @throws IllegalStateException if a computed rectangle lands at negative coordinates
     */
    public ValidatedLayout compute(ValidatedLayout layout) {
        List<MonitorDescriptor> input = layout.descriptors();
        Rect[] placed = new Rect[input.size()];
        boolean scaled = layout.isScaled() && layout.connectivity().isChain();

        if (scaled) {
            boolean horizontal = layout.connectivity() == Connectivity.HORIZONTAL;
            Comparator<Integer> axis = horizontal
                    ? Comparator.comparingInt(i -> input.get(i).monitor().x())
                    : Comparator.comparingInt(i -> input.get(i).monitor().y());
            List<Integer> order = IntStream.range(0, input.size()).boxed()
                    .sorted(axis)
                    .collect(Collectors.toList());

            int offset = 0;
            for (int i : order) {
                MonitorDescriptor d = input.get(i);
                MonitorRecord m = d.monitor();
                int scale = d.outputScale();
                int width = m.width() / scale;
                int height = m.height() / scale;
                if (horizontal) {
                    placed[i] = new Rect(offset, Math.abs((layout.upperLeft().y() - m.y()) / scale), width, height);
                    offset += width;
                } else {
                    placed[i] = new Rect(Math.abs((layout.upperLeft().x() - m.x()) / scale), offset, width, height);
                    offset += height;
                }
            }
        } else {
            int dx = Math.abs(layout.upperLeft().x());
            int dy = Math.abs(layout.upperLeft().y());
            for (int i = 0; i < input.size(); i++) {
                placed[i] = input.get(i).clientRect().translate(dx, dy);
            }
        }

        List<MonitorDescriptor> result = new ArrayList<>(input.size());
        for (int i = 0; i < input.size(); i++) {
            Rect local = placed[i];
            if (local.x() < 0 || local.y() < 0) {
                throw new IllegalStateException("Local rectangle " + local + " for monitor " + i
                        + " has negative coordinates");
            }
            MonitorDescriptor d = input.get(i).withLocalRect(local);
            if (!scaled) {
                d = d.withScale(1, 1.0f);
            }
            result.add(d);
            log.debug("monitor[{}]: client {} -> local {}, scale:{}, clientScale:{}",
                    i, d.clientRect(), local, d.outputScale(), d.clientScale());
        }
        return layout.withDescriptors(result);
    }
}
