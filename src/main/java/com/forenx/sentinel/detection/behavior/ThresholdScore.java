package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.config.DetectionSettings;

/**
 * Confidence of a behavioral trigger from how far the observed value exceeds its threshold.
 * At the threshold the score is the base confidence; it rises linearly with the ratio and
 * reaches 1.0 at the saturation ratio.
 */
final class ThresholdScore {

    private ThresholdScore() {
    }

    static double score(double observed, double threshold, DetectionSettings settings) {
        double ratio = observed / threshold;
        double saturation = settings.getSaturationRatio();
        if (ratio >= saturation) {
            return 1.0;
        }
        double base = settings.getBehaviorBaseConfidence();
        if (ratio <= 1.0) {
            return base;
        }
        double scaled = base + (1.0 - base) * (ratio - 1.0) / (saturation - 1.0);
        return Math.min(1.0, scaled);
    }
}
