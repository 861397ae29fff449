package com.largomodo.monitorlayout.service;

import com.largomodo.monitorlayout.core.domain.HeadId;
import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.domain.Orientation;
import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.head.Output;
import com.largomodo.monitorlayout.core.head.OutputManagerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests verify:
 * - Outputs come up on a later task, never inside createHead
 * - Capacity and unknown heads are refused
 * - Scale must be reset before it can change
 * - Output size is the mode divided by the scale
 */
class InMemoryOutputManagerTest {

    private Queue<Runnable> pending;
    private InMemoryOutputManager manager;
    private List<HeadId> enabled;

    @BeforeEach
    void setUp() {
        pending = new ArrayDeque<>();
        manager = new InMemoryOutputManager(pending::add, 2);
        enabled = new ArrayList<>();
        manager.setOutputEnabledListener((id, output) -> enabled.add(id));
    }

    private static MonitorDescriptor descriptor(int width, int height, int scale) {
        MonitorRecord m = new MonitorRecord(0, 0, width, height, true, 530, 300, Orientation.LANDSCAPE, 100 * scale, 100);
        return new MonitorDescriptor(m, scale, scale, new Rect(0, 0, width / scale, height / scale));
    }

    private void runPending() {
        Runnable task;
        while ((task = pending.poll()) != null) {
            task.run();
        }
    }

    @Test
    void testOutputEnabledOnLaterTask() {
        HeadId head = new HeadId(0);
        manager.createHead(head, descriptor(3840, 2160, 2));

        assertTrue(enabled.isEmpty(), "Output must not come up inside createHead");
        assertTrue(manager.outputOf(head).isEmpty());

        runPending();

        assertEquals(List.of(head), enabled);
        InMemoryOutput output = manager.outputOf(head).orElseThrow();
        assertTrue(output.isEnabled());
        assertEquals(1920, output.width());
        assertEquals(1080, output.height());
        assertEquals(2, output.scale());
        assertEquals(530, output.getPhysicalWidthMm());
        assertEquals("rdp-0", output.name());
    }

    @Test
    void testDestroyedHeadNeverEnabled() {
        HeadId head = new HeadId(0);
        manager.createHead(head, descriptor(1920, 1080, 1));
        manager.destroyHead(head);

        runPending();

        assertTrue(enabled.isEmpty());
        assertEquals(0, manager.headCount());
    }

    @Test
    void testCapacityExhausted() {
        manager.createHead(new HeadId(0), descriptor(1920, 1080, 1));
        manager.createHead(new HeadId(1), descriptor(1920, 1080, 1));

        assertThrows(OutputManagerException.class,
                () -> manager.createHead(new HeadId(2), descriptor(1920, 1080, 1)));
        assertEquals(2, manager.headCount());
    }

    @Test
    void testUnknownHeadRefused() {
        assertThrows(OutputManagerException.class, () -> manager.destroyHead(new HeadId(7)));
    }

    @Test
    void testScaleMustBeResetBeforeChange() {
        HeadId head = new HeadId(0);
        manager.createHead(head, descriptor(1920, 1080, 1));
        runPending();
        InMemoryOutput output = manager.outputOf(head).orElseThrow();

        assertThrows(OutputManagerException.class, () -> manager.setScale(output, 2));

        manager.disable(output);
        manager.resetScale(output);
        manager.setScale(output, 2);
        manager.enable(output);

        assertEquals(2, output.scale());
        assertEquals(960, output.width());
        assertTrue(output.isEnabled());
        assertThrows(OutputManagerException.class, () -> {
            manager.resetScale(output);
            manager.setScale(output, 0);
        });
    }

    @Test
    void testNativeModeAndMove() {
        HeadId head = new HeadId(0);
        manager.createHead(head, descriptor(1920, 1080, 1));
        runPending();
        InMemoryOutput output = manager.outputOf(head).orElseThrow();

        manager.setNativeMode(output, 2560, 1440, 2);
        manager.setPhysicalSize(output, 600, 340);
        manager.setTransformIdentity(output);
        manager.move(output, 100, 50);

        assertEquals(1280, output.width());
        assertEquals(720, output.height());
        assertEquals(600, output.getPhysicalWidthMm());
        assertEquals(340, output.getPhysicalHeightMm());
        assertTrue(output.isTransformIdentity());
        assertEquals(100, output.x());
        assertEquals(50, output.y());
        assertEquals(1, output.getMoveCount());
    }

    @Test
    void testForeignOutputRefused() {
        Output foreign = mock(Output.class);
        when(foreign.name()).thenReturn("elsewhere");

        OutputManagerException e = assertThrows(OutputManagerException.class, () -> manager.move(foreign, 0, 0));
        assertTrue(e.getMessage().contains("elsewhere"));
    }
}
