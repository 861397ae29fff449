package com.largomodo.monitorlayout.service;

import com.largomodo.monitorlayout.core.LayoutObserver;
import com.largomodo.monitorlayout.core.MonitorLayoutManager;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.head.ReconciliationResult;
import com.largomodo.monitorlayout.core.head.ResourceExhaustionException;
import com.largomodo.monitorlayout.core.layout.InvalidTopologyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;

/**
 * Hands topology changes from the transport thread to the display loop.
 * <p>
 * Fire-and-forget: {@link #submit} copies the report, queues it and returns.
 * Changes are applied strictly in submission order, one at a time, and never
 * merged. Outcomes are reported through a {@link LayoutObserver}.
 */
public class TopologyDispatcher {

    /** MDC key carrying the sequence number of the change being applied. */
    public static final String MDC_KEY = "topology";

    private static final Logger log = LoggerFactory.getLogger(TopologyDispatcher.class);

    private final DisplayLoop loop;
    private final MonitorLayoutManager manager;
    private final LayoutObserver observer;
    private long sequence;

    public TopologyDispatcher(DisplayLoop loop, MonitorLayoutManager manager) {
        this(loop, manager, new LayoutObserver() {});
    }

    public TopologyDispatcher(DisplayLoop loop, MonitorLayoutManager manager, LayoutObserver observer) {
        this.loop = loop;
        this.manager = manager;
        this.observer = observer;
    }

    /**
     * Queues a topology change.
     * <p>
     * Synchronized so sequence numbers follow queue order when several threads submit.
     *
     * @param monitors client report; copied before this method returns
     * @return sequence number assigned to the change
     */
    public synchronized long submit(List<MonitorRecord> monitors) {
        List<MonitorRecord> snapshot = List.copyOf(monitors);
        long seq = ++sequence;
        log.debug("Queued topology change #{} with {} monitor(s)", seq, snapshot.size());
        loop.execute(() -> apply(seq, snapshot));
        return seq;
    }

    private void apply(long seq, List<MonitorRecord> monitors) {
        loop.assertLoopThread();
        MDC.put(MDC_KEY, Long.toString(seq));
        try {
            observer.onStart(seq, monitors.size());
            ReconciliationResult result = manager.adjustMonitorLayout(monitors);
            observer.onSuccess(seq, result);
        } catch (InvalidTopologyException | ResourceExhaustionException e) {
            // already logged where it was raised
            observer.onFailure(seq, e);
        } catch (RuntimeException e) {
            log.error("Topology change #{} failed", seq, e);
            observer.onFailure(seq, e);
        } finally {
            MDC.remove(MDC_KEY);
        }
    }
}
