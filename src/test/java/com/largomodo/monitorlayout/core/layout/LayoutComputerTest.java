package com.largomodo.monitorlayout.core.layout;

import com.largomodo.monitorlayout.core.domain.MonitorDescriptor;
import com.largomodo.monitorlayout.core.domain.MonitorRecord;
import com.largomodo.monitorlayout.core.geometry.Rect;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LayoutComputerTest {

    private final LayoutComputer computer = new LayoutComputer();

    private ValidatedLayout layout(ScalingConfig config, MonitorRecord... monitors) {
        return computer.compute(new LayoutValidator(config).validate(List.of(monitors)));
    }

    private static Rect local(ValidatedLayout layout, int index) {
        return layout.descriptors().get(index).localRect();
    }

    @Test
    void testSingleMonitorAtFullScale() {
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 1920, 1080, true, 100));

        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 0));
        assertEquals(1, result.descriptors().get(0).outputScale());
        assertEquals(1.0f, result.descriptors().get(0).clientScale());
    }

    @Test
    void testSideBySideUnscaledKeepsClientRects() {
        ValidatedLayout result = layout(ScalingConfig.DISABLED,
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(1920, 0, 1920, 1080, false, 100));

        assertEquals(Connectivity.HORIZONTAL, result.connectivity());
        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 0));
        assertEquals(new Rect(1920, 0, 1920, 1080), local(result, 1));
    }

    @Test
    void testUnscaledLayoutShiftedToOrigin() {
        ValidatedLayout result = layout(ScalingConfig.DISABLED,
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(-1280, -200, 1280, 1024, false, 100));

        assertEquals(new Rect(1280, 200, 1920, 1080), local(result, 0));
        assertEquals(new Rect(0, 0, 1280, 1024), local(result, 1));
    }

    @Test
    void testScaledHorizontalChainPacksEdgeToEdge() {
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 3840, 2160, true, 200),
                MonitorRecord.of(3840, 0, 1920, 1080, false, 100));

        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 0));
        assertEquals(new Rect(1920, 0, 1920, 1080), local(result, 1));
        assertEquals(2, result.descriptors().get(0).outputScale());
    }

    @Test
    void testScaledHorizontalChainWithSecondaryOnTheLeft() {
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 3840, 2160, true, 200),
                MonitorRecord.of(-1920, 0, 1920, 1080, false, 100));

        assertEquals(new Rect(1920, 0, 1920, 1080), local(result, 0), "Primary follows the left monitor");
        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 1));
    }

    @Test
    void testScaledVerticalChain() {
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 3840, 2160, true, 200),
                MonitorRecord.of(0, 2160, 1920, 1080, false, 100));

        assertEquals(Connectivity.VERTICAL, result.connectivity());
        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 0));
        assertEquals(new Rect(0, 1080, 1920, 1080), local(result, 1));
    }

    @Test
    void testCrossAxisOffsetIsScaled() {
        // Secondary hangs 200 client pixels above the primary; the scaled
        // primary keeps that offset divided by its own scale
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 1920, 1080, true, 200),
                MonitorRecord.of(1920, -200, 1280, 1024, false, 100));

        assertEquals(Connectivity.HORIZONTAL, result.connectivity());
        assertFalse(result.scalingDegraded());
        assertEquals(new Rect(0, 100, 960, 540), local(result, 0));
        assertEquals(new Rect(960, 0, 1280, 1024), local(result, 1));
    }

    @Test
    void testComplexPlacementFallsBackToTranslatedClientRects() {
        ValidatedLayout result = layout(ScalingConfig.hiDpi(),
                MonitorRecord.of(0, 0, 1920, 1080, true, 200),
                MonitorRecord.of(1920, 1080, 1280, 1024, false, 100));

        assertEquals(Connectivity.COMPLEX, result.connectivity());
        assertTrue(result.scalingDegraded());
        assertEquals(new Rect(0, 0, 1920, 1080), local(result, 0));
        assertEquals(new Rect(1920, 1080, 1280, 1024), local(result, 1));
        for (MonitorDescriptor d : result.descriptors()) {
            assertEquals(1, d.outputScale());
        }
    }

    @Test
    void testComplexPlacementWithNegativeCorner() {
        ValidatedLayout result = layout(ScalingConfig.DISABLED,
                MonitorRecord.of(0, 0, 1920, 1080, true, 100),
                MonitorRecord.of(-1280, -1024, 1280, 1024, false, 100));

        assertEquals(Connectivity.COMPLEX, result.connectivity());
        assertEquals(new Rect(1280, 1024, 1920, 1080), local(result, 0));
        assertEquals(new Rect(0, 0, 1280, 1024), local(result, 1));
    }

    @Test
    void testFractionalScaleKeepsSizeAtOutputScaleOne() {
        ValidatedLayout result = layout(ScalingConfig.fractional(),
                MonitorRecord.of(0, 0, 1920, 1080, true, 150));

        MonitorDescriptor d = result.descriptors().get(0);
        assertEquals(1, d.outputScale());
        assertEquals(1.5f, d.clientScale());
        assertEquals(new Rect(0, 0, 1920, 1080), d.localRect());
    }

    @Property
    void scaledRowIsPackedWithoutGapsOrOverlap(@ForAll("widths") List<Integer> widths,
                                               @ForAll @IntRange(min = 0, max = 4) int primaryPick,
                                               @ForAll("scales") List<Integer> scales) {
        int primaryIndex = primaryPick % widths.size();
        int x = 0;
        for (int i = 0; i < primaryIndex; i++) {
            x -= widths.get(i);
        }
        List<MonitorRecord> monitors = new ArrayList<>();
        for (int i = 0; i < widths.size(); i++) {
            int y = i == primaryIndex ? 0 : (i % 2 == 0 ? -120 : 240);
            monitors.add(MonitorRecord.of(x, y, widths.get(i), 1200, i == primaryIndex, scales.get(i)));
            x += widths.get(i);
        }

        ValidatedLayout result = computer.compute(new LayoutValidator(ScalingConfig.hiDpi()).validate(monitors));

        assertEquals(monitors.size(), result.descriptors().size(), "One local rectangle per monitor");
        assertEquals(Connectivity.HORIZONTAL, result.connectivity());

        List<Rect> locals = new ArrayList<>();
        for (MonitorDescriptor d : result.descriptors()) {
            assertTrue(d.localRect().x() >= 0 && d.localRect().y() >= 0, "Local rect must not be negative");
            locals.add(d.localRect());
        }
        locals.sort(Comparator.comparingInt(Rect::x));
        assertEquals(0, locals.get(0).x());
        for (int i = 1; i < locals.size(); i++) {
            assertEquals(locals.get(i - 1).x2(), locals.get(i).x(), "Chain must be packed edge to edge");
        }
    }

    @Provide
    Arbitrary<List<Integer>> widths() {
        return Arbitraries.of(1280, 1600, 1920, 2560, 3840).list().ofMinSize(1).ofMaxSize(5);
    }

    @Provide
    Arbitrary<List<Integer>> scales() {
        return Arbitraries.of(100, 150, 200, 300).list().ofSize(5);
    }
}
