package com.largomodo.monitorlayout.core;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.domain.Orientation;
import com.largomodo.monitorlayout.core.geometry.Point;
import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.geometry.Size;
import com.largomodo.monitorlayout.core.head.Output;
import com.largomodo.monitorlayout.core.head.OutputConfig;
import com.largomodo.monitorlayout.core.head.OutputManager;
import com.largomodo.monitorlayout.core.head.ReconciliationResult;
import com.largomodo.monitorlayout.core.layout.InvalidTopologyException;
import com.largomodo.monitorlayout.core.layout.ScalingConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class MonitorLayoutManagerTest {

    private OutputManager outputManager;
    private MonitorLayoutManager manager;
    private ListAppender<ILoggingEvent> listAppender;
    private Logger managerLogger;

    @BeforeEach
    void setUp() {
        outputManager = mock(OutputManager.class);
        manager = new MonitorLayoutManager(ScalingConfig.hiDpi(), outputManager);

        managerLogger = (Logger) LoggerFactory.getLogger(MonitorLayoutManager.class);
        listAppender = new ListAppender<>();
        listAppender.start();
        managerLogger.addAppender(listAppender);
        managerLogger.setLevel(Level.INFO);
    }

    @AfterEach
    void tearDown() {
        managerLogger.detachAppender(listAppender);
        managerLogger.setLevel(null);
        listAppender.stop();
    }

    private static Output output(int width, int height, int scale) {
        Output output = mock(Output.class);
        when(output.name()).thenReturn("rdp-output");
        when(output.width()).thenReturn(width);
        when(output.height()).thenReturn(height);
        when(output.scale()).thenReturn(scale);
        return output;
    }

    @Test
    void testRejectedTopologyLeavesPreviousLayoutQueryable() {
        manager.adjustMonitorLayout(List.of(
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(1920, 0, 1920, 1080, false, 100)));
        Output out = output(1920, 1080, 1);
        manager.outputEnabled(new HeadId(0), out);
        clearInvocations(outputManager);

        assertThrows(InvalidTopologyException.class, () -> manager.adjustMonitorLayout(List.of(
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(0, 0, 2560, 1440, true, 100))));

        verifyNoInteractions(outputManager);
        assertEquals(2, manager.heads().size());
        assertEquals(new Rect(0, 0, 3840, 1080), manager.boundingClientExtents());
        assertEquals(new Point(10, 10), manager.mapToLocal(new Point(10, 10)).orElseThrow().point());
        assertTrue(listAppender.list.stream().anyMatch(e -> e.getLevel() == Level.ERROR
                && e.getFormattedMessage().contains("rejected")), "Rejection should be logged at ERROR");
    }

    @Test
    void testScalingDegradedReported() {
        ReconciliationResult result = manager.adjustMonitorLayout(List.of(
                MonitorRecord.of(0, 0, 1920, 1080, true, 200),
                MonitorRecord.of(1920, 1080, 1280, 1024, false, 100)));

        assertTrue(result.scalingDegraded());
        assertEquals(2, result.created());
        assertEquals(new Rect(0, 0, 3200, 2104), manager.boundingLocalExtents());
    }

    @Test
    void testPrimaryQueries() {
        manager.adjustMonitorLayout(List.of(
                new MonitorRecord(0, 0, 3840, 2160, true, 600, 340, Orientation.LANDSCAPE, 200, 100),
                MonitorRecord.of(3840, 0, 1920, 1080, false, 100)));

        assertTrue(manager.primaryOutput().isEmpty(), "No output before the compositor enables one");
        assertEquals(new Size(3840, 2160), manager.primarySize().orElseThrow());
        assertEquals(new Size(600, 340), manager.headPhysicalSize(new HeadId(0)).orElseThrow());

        Output out = output(1920, 1080, 2);
        manager.outputEnabled(new HeadId(0), out);

        assertSame(out, manager.primaryOutput().orElseThrow());
        assertEquals(new OutputConfig(3840, 2160, 2), manager.outputConfig(out).orElseThrow());
        assertTrue(manager.outputConfig(mock(Output.class)).isEmpty());
        verify(outputManager).move(out, 0, 0);
    }

    @Test
    void testMapToClient() {
        manager.adjustMonitorLayout(List.of(MonitorRecord.of(0, 0, 3840, 2160, true, 200)));
        Output out = output(1920, 1080, 2);
        manager.outputEnabled(new HeadId(0), out);

        assertEquals(new Point(200, 400), manager.mapToClient(out, new Point(100, 200)));
        assertEquals(new Size(20, 40), manager.mapToClient(out, new Point(0, 0), new Size(10, 20)).size());
        assertEquals(new Size(5, 10), manager.mapToLocal(new Point(0, 0), new Size(10, 20)).orElseThrow().size());
    }

    @Test
    void testDumpHeadsLogsAtInfo() {
        manager.adjustMonitorLayout(List.of(MonitorRecord.of(0, 0, 1920, 1080, true, 100)));

        String dump = manager.dumpHeads();

        assertTrue(dump.contains("rdp-0"));
        assertTrue(listAppender.list.stream().anyMatch(e -> e.getLevel() == Level.INFO
                && e.getFormattedMessage().contains("rdp-0")));
    }

    @Test
    void testShutdownDestroysEveryHead() {
        manager.adjustMonitorLayout(List.of(
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(0, 1080, 1920, 1080, false, 100)));

        manager.shutdown();

        verify(outputManager, times(2)).destroyHead(any());
        assertTrue(manager.heads().isEmpty());
        assertTrue(manager.primarySize().isEmpty());
        assertEquals(Rect.EMPTY, manager.boundingClientExtents());
    }
}
