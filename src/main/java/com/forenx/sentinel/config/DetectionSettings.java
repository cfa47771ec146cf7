package com.forenx.sentinel.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Immutable snapshot of the hot-reloadable detection and alerting thresholds.
 * Components read the current snapshot from {@link DetectionSettingsHolder} per event,
 * so a reload takes effect on the next record without restarting ingestion.
 */
public final class DetectionSettings {

    @JsonProperty("auth_window")
    private final Duration authWindow;
    @JsonProperty("auth_threshold")
    private final int authThreshold;
    @JsonProperty("rate_window")
    private final Duration rateWindow;
    @JsonProperty("rate_threshold")
    private final int rateThreshold;
    @JsonProperty("endpoint_rate_threshold")
    private final int endpointRateThreshold;
    @JsonProperty("volume_window")
    private final Duration volumeWindow;
    @JsonProperty("bytes_threshold")
    private final long bytesThreshold;
    @JsonProperty("outlier_min_bytes")
    private final long outlierMinBytes;
    @JsonProperty("outlier_sigma")
    private final double outlierSigma;
    @JsonProperty("baseline_min_samples")
    private final int baselineMinSamples;
    @JsonProperty("diversity_threshold")
    private final int diversityThreshold;
    @JsonProperty("max_tracked_endpoints")
    private final int maxTrackedEndpoints;
    @JsonProperty("eviction_ttl")
    private final Duration evictionTtl;
    @JsonProperty("behavior_base_confidence")
    private final double behaviorBaseConfidence;
    @JsonProperty("saturation_ratio")
    private final double saturationRatio;
    @JsonProperty("coalescing_interval")
    private final Duration coalescingInterval;
    @JsonProperty("max_source_records")
    private final int maxSourceRecords;
    @JsonProperty("corroboration_bonus")
    private final double corroborationBonus;

    private DetectionSettings(Builder b) {
        this.authWindow = b.authWindow;
        this.authThreshold = b.authThreshold;
        this.rateWindow = b.rateWindow;
        this.rateThreshold = b.rateThreshold;
        this.endpointRateThreshold = b.endpointRateThreshold;
        this.volumeWindow = b.volumeWindow;
        this.bytesThreshold = b.bytesThreshold;
        this.outlierMinBytes = b.outlierMinBytes;
        this.outlierSigma = b.outlierSigma;
        this.baselineMinSamples = b.baselineMinSamples;
        this.diversityThreshold = b.diversityThreshold;
        this.maxTrackedEndpoints = b.maxTrackedEndpoints;
        this.behaviorBaseConfidence = b.behaviorBaseConfidence;
        this.saturationRatio = b.saturationRatio;
        this.coalescingInterval = b.coalescingInterval;
        this.maxSourceRecords = b.maxSourceRecords;
        this.corroborationBonus = b.corroborationBonus;
        this.evictionTtl = b.evictionTtl != null ? b.evictionTtl : defaultEvictionTtl(b);
    }

    private static Duration defaultEvictionTtl(Builder b) {
        Duration longest = b.authWindow;
        if (b.rateWindow != null && (longest == null || b.rateWindow.compareTo(longest) > 0)) {
            longest = b.rateWindow;
        }
        if (b.volumeWindow != null && (longest == null || b.volumeWindow.compareTo(longest) > 0)) {
            longest = b.volumeWindow;
        }
        return longest != null ? longest.multipliedBy(10) : null;
    }

    public static DetectionSettings from(SentinelProperties properties) {
        SentinelProperties.Detection d = properties.getDetection();
        SentinelProperties.Alerts a = properties.getAlerts();
        return builder()
            .authWindow(d.getAuthWindow())
            .authThreshold(d.getAuthThreshold())
            .rateWindow(d.getRateWindow())
            .rateThreshold(d.getRateThreshold())
            .endpointRateThreshold(d.getEndpointRateThreshold())
            .volumeWindow(d.getVolumeWindow())
            .bytesThreshold(d.getBytesThreshold())
            .outlierMinBytes(d.getOutlierMinBytes())
            .outlierSigma(d.getOutlierSigma())
            .baselineMinSamples(d.getBaselineMinSamples())
            .diversityThreshold(d.getDiversityThreshold())
            .maxTrackedEndpoints(d.getMaxTrackedEndpoints())
            .evictionTtl(d.getEvictionTtl())
            .behaviorBaseConfidence(d.getBehaviorBaseConfidence())
            .saturationRatio(d.getSaturationRatio())
            .coalescingInterval(a.getCoalescingInterval())
            .maxSourceRecords(a.getMaxSourceRecords())
            .corroborationBonus(a.getCorroborationBonus())
            .build();
    }

    public static DetectionSettings defaults() {
        return from(new SentinelProperties());
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .authWindow(authWindow)
            .authThreshold(authThreshold)
            .rateWindow(rateWindow)
            .rateThreshold(rateThreshold)
            .endpointRateThreshold(endpointRateThreshold)
            .volumeWindow(volumeWindow)
            .bytesThreshold(bytesThreshold)
            .outlierMinBytes(outlierMinBytes)
            .outlierSigma(outlierSigma)
            .baselineMinSamples(baselineMinSamples)
            .diversityThreshold(diversityThreshold)
            .maxTrackedEndpoints(maxTrackedEndpoints)
            .evictionTtl(evictionTtl)
            .behaviorBaseConfidence(behaviorBaseConfidence)
            .saturationRatio(saturationRatio)
            .coalescingInterval(coalescingInterval)
            .maxSourceRecords(maxSourceRecords)
            .corroborationBonus(corroborationBonus);
    }

    /**
     * @throws ClassifierConfigException naming the first invalid setting
     */
    public DetectionSettings validate() {
        requirePositive("auth_window", authWindow);
        requirePositive("rate_window", rateWindow);
        requirePositive("volume_window", volumeWindow);
        requirePositive("eviction_ttl", evictionTtl);
        requirePositive("coalescing_interval", coalescingInterval);
        requirePositive("auth_threshold", authThreshold);
        requirePositive("rate_threshold", rateThreshold);
        requirePositive("endpoint_rate_threshold", endpointRateThreshold);
        requirePositive("bytes_threshold", bytesThreshold);
        requirePositive("outlier_min_bytes", outlierMinBytes);
        requirePositive("baseline_min_samples", baselineMinSamples);
        requirePositive("diversity_threshold", diversityThreshold);
        requirePositive("max_tracked_endpoints", maxTrackedEndpoints);
        requirePositive("max_source_records", maxSourceRecords);
        if (!(outlierSigma > 0.0)) {
            throw new ClassifierConfigException("outlier_sigma must be > 0", "outlier_sigma");
        }
        if (!(behaviorBaseConfidence > 0.0 && behaviorBaseConfidence <= 1.0)) {
            throw new ClassifierConfigException("behavior_base_confidence must be within (0, 1]", "behavior_base_confidence");
        }
        if (!(saturationRatio > 1.0)) {
            throw new ClassifierConfigException("saturation_ratio must be > 1", "saturation_ratio");
        }
        if (!(corroborationBonus >= 0.0 && corroborationBonus < 1.0)) {
            throw new ClassifierConfigException("corroboration_bonus must be within [0, 1)", "corroboration_bonus");
        }
        Duration longest = authWindow.compareTo(rateWindow) > 0 ? authWindow : rateWindow;
        longest = longest.compareTo(volumeWindow) > 0 ? longest : volumeWindow;
        if (evictionTtl.compareTo(longest) < 0) {
            throw new ClassifierConfigException("eviction_ttl must not be shorter than the longest window", "eviction_ttl");
        }
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ClassifierConfigException(name + " must be a positive duration", name);
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new ClassifierConfigException(name + " must be > 0", name);
        }
    }

    public Duration getAuthWindow() {
        return authWindow;
    }

    public int getAuthThreshold() {
        return authThreshold;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public int getRateThreshold() {
        return rateThreshold;
    }

    public int getEndpointRateThreshold() {
        return endpointRateThreshold;
    }

    public Duration getVolumeWindow() {
        return volumeWindow;
    }

    public long getBytesThreshold() {
        return bytesThreshold;
    }

    public long getOutlierMinBytes() {
        return outlierMinBytes;
    }

    public double getOutlierSigma() {
        return outlierSigma;
    }

    public int getBaselineMinSamples() {
        return baselineMinSamples;
    }

    public int getDiversityThreshold() {
        return diversityThreshold;
    }

    public int getMaxTrackedEndpoints() {
        return maxTrackedEndpoints;
    }

    public Duration getEvictionTtl() {
        return evictionTtl;
    }

    public double getBehaviorBaseConfidence() {
        return behaviorBaseConfidence;
    }

    public double getSaturationRatio() {
        return saturationRatio;
    }

    public Duration getCoalescingInterval() {
        return coalescingInterval;
    }

    public int getMaxSourceRecords() {
        return maxSourceRecords;
    }

    public double getCorroborationBonus() {
        return corroborationBonus;
    }

    public static final class Builder {
        private Duration authWindow;
        private int authThreshold;
        private Duration rateWindow;
        private int rateThreshold;
        private int endpointRateThreshold;
        private Duration volumeWindow;
        private long bytesThreshold;
        private long outlierMinBytes;
        private double outlierSigma;
        private int baselineMinSamples;
        private int diversityThreshold;
        private int maxTrackedEndpoints;
        private Duration evictionTtl;
        private double behaviorBaseConfidence;
        private double saturationRatio;
        private Duration coalescingInterval;
        private int maxSourceRecords;
        private double corroborationBonus;

        private Builder() {
        }

        public Builder authWindow(Duration authWindow) {
            this.authWindow = authWindow;
            return this;
        }

        public Builder authThreshold(int authThreshold) {
            this.authThreshold = authThreshold;
            return this;
        }

        public Builder rateWindow(Duration rateWindow) {
            this.rateWindow = rateWindow;
            return this;
        }

        public Builder rateThreshold(int rateThreshold) {
            this.rateThreshold = rateThreshold;
            return this;
        }

        public Builder endpointRateThreshold(int endpointRateThreshold) {
            this.endpointRateThreshold = endpointRateThreshold;
            return this;
        }

        public Builder volumeWindow(Duration volumeWindow) {
            this.volumeWindow = volumeWindow;
            return this;
        }

        public Builder bytesThreshold(long bytesThreshold) {
            this.bytesThreshold = bytesThreshold;
            return this;
        }

        public Builder outlierMinBytes(long outlierMinBytes) {
            this.outlierMinBytes = outlierMinBytes;
            return this;
        }

        public Builder outlierSigma(double outlierSigma) {
            this.outlierSigma = outlierSigma;
            return this;
        }

        public Builder baselineMinSamples(int baselineMinSamples) {
            this.baselineMinSamples = baselineMinSamples;
            return this;
        }

        public Builder diversityThreshold(int diversityThreshold) {
            this.diversityThreshold = diversityThreshold;
            return this;
        }

        public Builder maxTrackedEndpoints(int maxTrackedEndpoints) {
            this.maxTrackedEndpoints = maxTrackedEndpoints;
            return this;
        }

        public Builder evictionTtl(Duration evictionTtl) {
            this.evictionTtl = evictionTtl;
            return this;
        }

        public Builder behaviorBaseConfidence(double behaviorBaseConfidence) {
            this.behaviorBaseConfidence = behaviorBaseConfidence;
            return this;
        }

        public Builder saturationRatio(double saturationRatio) {
            this.saturationRatio = saturationRatio;
            return this;
        }

        public Builder coalescingInterval(Duration coalescingInterval) {
            this.coalescingInterval = coalescingInterval;
            return this;
        }

        public Builder maxSourceRecords(int maxSourceRecords) {
            this.maxSourceRecords = maxSourceRecords;
            return this;
        }

        public Builder corroborationBonus(double corroborationBonus) {
            this.corroborationBonus = corroborationBonus;
            return this;
        }

        public DetectionSettings build() {
            return new DetectionSettings(this);
        }
    }
}
