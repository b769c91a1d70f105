package com.signalengine.indicator;

import com.signalengine.domain.enums.Zone;
import com.signalengine.policy.ThresholdSet;

/**
 * BuBeFSM zone rule.
 *
 * <p>BULL when either line reaches the threshold and both lines are positive; BEAR under the
 * mirrored condition; NEUTRAL otherwise. Pure and total: threshold validity is enforced by
 * {@link ThresholdSet}, not here.
 */
public final class ZoneClassifier {

    private ZoneClassifier() {}

    public static Zone classify(double fastValue, double signalValue, double threshold) {
        return classify(fastValue, signalValue, threshold, threshold);
    }

    /** Applies the fast-line threshold to the fast value and the signal-line threshold to the signal value. */
    public static Zone classify(double fastValue, double signalValue, ThresholdSet thresholds) {
        return classify(fastValue, signalValue, thresholds.fastThreshold(), thresholds.signalThreshold());
    }

    private static Zone classify(double fastValue, double signalValue, double fastThreshold, double signalThreshold) {
        if ((fastValue >= fastThreshold || signalValue >= signalThreshold) && fastValue > 0 && signalValue > 0) {
            return Zone.BULL;
        }
        if ((fastValue <= -fastThreshold || signalValue <= -signalThreshold) && fastValue < 0 && signalValue < 0) {
            return Zone.BEAR;
        }
        return Zone.NEUTRAL;
    }
}
