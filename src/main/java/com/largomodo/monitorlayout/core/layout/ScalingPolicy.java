package com.largomodo.monitorlayout.core.layout;

import com.largomodo.monitorlayout.core.domain.MonitorRecord;

/**
 * How a client-reported desktop scale factor becomes the compositor scale.
 * <p>
 * Exactly one policy is active per backend instance (see {@link ScalingConfig#policy()}).
 * The integer output scale is always the client scale truncated, so FRACTIONAL
 * with 150% gives client scale 1.5 and output scale 1.
 */
public enum ScalingPolicy {
    /** Hi-DPI support off: every monitor renders at scale 1. */
    DISABLED {
        @Override
        float rawClientScale(MonitorRecord monitor, int debugScalingFactor) {
            return 1.0f;
        }
    },
    /** Fixed percentage from configuration, ignoring what the client sends. */
    DEBUG_FORCED {
        @Override
        float rawClientScale(MonitorRecord monitor, int debugScalingFactor) {
            return (float) debugScalingFactor / 100.0f;
        }
    },
    /** Client desktop scale as-is, e.g. 125% gives 1.25. */
    FRACTIONAL {
        @Override
        float rawClientScale(MonitorRecord monitor, int debugScalingFactor) {
            return (float) monitor.desktopScaleFactor() / 100.0f;
        }
    },
    /** Client desktop scale rounded to the nearest integer, e.g. 150% gives 2. */
    ROUND {
        @Override
        float rawClientScale(MonitorRecord monitor, int debugScalingFactor) {
            return (float) ((monitor.desktopScaleFactor() + 50) / 100);
        }
    },
    /** Client desktop scale truncated to an integer, e.g. 175% gives 1. */
    TRUNCATE {
        @Override
        float rawClientScale(MonitorRecord monitor, int debugScalingFactor) {
            return (float) (monitor.desktopScaleFactor() / 100);
        }
    };

    abstract float rawClientScale(MonitorRecord monitor, int debugScalingFactor);

    /**
     * Client-to-local ratio for a monitor. Values below 1 (a client that sent
     * no scale, or a sub-100% factor) are raised to 1.
     */
    public float clientScale(MonitorRecord monitor, int debugScalingFactor) {
        float scale = rawClientScale(monitor, debugScalingFactor);
        return scale < 1.0f ? 1.0f : scale;
    }

    /**
     * Integer compositor scale for a monitor, the client scale truncated.
     */
    public int outputScale(MonitorRecord monitor, int debugScalingFactor) {
        return (int) clientScale(monitor, debugScalingFactor);
    }
}
