package com.largomodo.monitorlayout.core.domain;

import com.largomodo.monitorlayout.core.geometry.Rect;
import com.largomodo.monitorlayout.core.geometry.Size;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class MonitorRecordTest {

    @ParameterizedTest
    @CsvSource({
            "0, 1080",
            "1920, 0",
            "-1, 1080"
    })
    void testNonPositiveSizeRejected(int width, int height) {
        assertThrows(IllegalArgumentException.class,
                () -> MonitorRecord.of(0, 0, width, height, true, 100));
    }

    @Test
    void testNegativePhysicalSizeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MonitorRecord(0, 0, 1920, 1080, true,
                -1, 300, Orientation.LANDSCAPE, 100, 100));
    }

    @Test
    void testNullOrientationRejected() {
        assertThrows(IllegalArgumentException.class, () -> new MonitorRecord(0, 0, 1920, 1080, true,
                0, 0, null, 100, 100));
    }

    @Test
    void testNegativeCoordinatesAllowed() {
        MonitorRecord m = MonitorRecord.of(-1280, -200, 1280, 1024, false, 100);

        assertEquals(new Rect(-1280, -200, 1280, 1024), m.clientRect());
    }

    @Test
    void testShorthandDefaults() {
        MonitorRecord m = MonitorRecord.of(0, 0, 1920, 1080, true, 150);

        assertEquals(Orientation.LANDSCAPE, m.orientation());
        assertEquals(new Size(0, 0), m.physicalSize());
        assertEquals(150, m.desktopScaleFactor());
        assertEquals(100, m.deviceScaleFactor());
    }

    @Test
    void testOrientationFromDegrees() {
        assertEquals(Orientation.PORTRAIT, Orientation.fromDegrees(90));
        assertEquals(Orientation.PORTRAIT_FLIPPED, Orientation.fromDegrees(270));
        assertThrows(IllegalArgumentException.class, () -> Orientation.fromDegrees(45));
    }

    @Test
    void testHeadIdName() {
        assertEquals("rdp-0", new HeadId(0).name());
        assertEquals("rdp-1a", new HeadId(26).name());
        assertThrows(IllegalArgumentException.class, () -> new HeadId(-1));
    }
}
