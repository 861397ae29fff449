package com.largomodo.monitorlayout.core.layout;

/**
 * Output-handler scaling switches as the backend is configured.
 * <p>
 * Several switches may be set at once; {@link #policy()} applies the fixed
 * precedence so that exactly one {@link ScalingPolicy} is active.
 *
 * @param enableHiDpi                   master switch; when off nothing is scaled
 * @param debugDesktopScalingFactor     forced percentage for every monitor, 0 to disable
 * @param enableFractionalHiDpi         use the client's fractional desktop scale
 * @param enableFractionalHiDpiRoundup  round the client's scale to the nearest integer
 */
public record ScalingConfig(boolean enableHiDpi, int debugDesktopScalingFactor,
                            boolean enableFractionalHiDpi, boolean enableFractionalHiDpiRoundup) {

    public static final ScalingConfig DISABLED = new ScalingConfig(false, 0, false, false);

    public ScalingConfig {
        if (debugDesktopScalingFactor < 0) {
            throw new IllegalArgumentException(
                    "debugDesktopScalingFactor must not be negative, got: " + debugDesktopScalingFactor);
        }
    }

    /**
     * Integer hi-DPI (client scale truncated to whole numbers).
     */
    public static ScalingConfig hiDpi() {
        return new ScalingConfig(true, 0, false, false);
    }

    public static ScalingConfig fractional() {
        return new ScalingConfig(true, 0, true, false);
    }

    public static ScalingConfig roundup() {
        return new ScalingConfig(true, 0, false, true);
    }

    public static ScalingConfig forced(int percent) {
        return new ScalingConfig(true, percent, false, false);
    }

    public ScalingPolicy policy() {
        if (!enableHiDpi) {
            return ScalingPolicy.DISABLED;
        }
        if (debugDesktopScalingFactor != 0) {
            return ScalingPolicy.DEBUG_FORCED;
        }
        if (enableFractionalHiDpi) {
            return ScalingPolicy.FRACTIONAL;
        }
        if (enableFractionalHiDpiRoundup) {
            return ScalingPolicy.ROUND;
        }
        return ScalingPolicy.TRUNCATE;
    }
}
