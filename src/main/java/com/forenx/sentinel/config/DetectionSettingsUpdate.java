package com.forenx.sentinel.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;

/**
 * Partial update of the detection settings; absent fields keep their current value.
 */
public class DetectionSettingsUpdate {

    @JsonProperty("auth_window")
    private Duration authWindow;
    @JsonProperty("auth_threshold")
    private Integer authThreshold;
    @JsonProperty("rate_window")
    private Duration rateWindow;
    @JsonProperty("rate_threshold")
    private Integer rateThreshold;
    @JsonProperty("endpoint_rate_threshold")
    private Integer endpointRateThreshold;
    @JsonProperty("volume_window")
    private Duration volumeWindow;
    @JsonProperty("bytes_threshold")
    private Long bytesThreshold;
    @JsonProperty("eviction_ttl")
    private Duration evictionTtl;
    @JsonProperty("coalescing_interval")
    private Duration coalescingInterval;

    public DetectionSettings applyTo(DetectionSettings current) {
        DetectionSettings.Builder builder = current.toBuilder();
        if (authWindow != null) {
            builder.authWindow(authWindow);
        }
        if (authThreshold != null) {
            builder.authThreshold(authThreshold);
        }
        if (rateWindow != null) {
            builder.rateWindow(rateWindow);
        }
        if (rateThreshold != null) {
            builder.rateThreshold(rateThreshold);
        }
        if (endpointRateThreshold != null) {
            builder.endpointRateThreshold(endpointRateThreshold);
        }
        if (volumeWindow != null) {
            builder.volumeWindow(volumeWindow);
        }
        if (bytesThreshold != null) {
            builder.bytesThreshold(bytesThreshold);
        }
        if (evictionTtl != null) {
            builder.evictionTtl(evictionTtl);
        }
        if (coalescingInterval != null) {
            builder.coalescingInterval(coalescingInterval);
        }
        return builder.build();
    }

    public Duration getAuthWindow() {
        return authWindow;
    }

    public void setAuthWindow(Duration authWindow) {
        this.authWindow = authWindow;
    }

    public Integer getAuthThreshold() {
        return authThreshold;
    }

    public void setAuthThreshold(Integer authThreshold) {
        this.authThreshold = authThreshold;
    }

    public Duration getRateWindow() {
        return rateWindow;
    }

    public void setRateWindow(Duration rateWindow) {
        this.rateWindow = rateWindow;
    }

    public Integer getRateThreshold() {
        return rateThreshold;
    }

    public void setRateThreshold(Integer rateThreshold) {
        this.rateThreshold = rateThreshold;
    }

    public Integer getEndpointRateThreshold() {
        return endpointRateThreshold;
    }

    public void setEndpointRateThreshold(Integer endpointRateThreshold) {
        this.endpointRateThreshold = endpointRateThreshold;
    }

    public Duration getVolumeWindow() {
        return volumeWindow;
    }

    public void setVolumeWindow(Duration volumeWindow) {
        this.volumeWindow = volumeWindow;
    }

    public Long getBytesThreshold() {
        return bytesThreshold;
    }

    public void setBytesThreshold(Long bytesThreshold) {
        this.bytesThreshold = bytesThreshold;
    }

    public Duration getEvictionTtl() {
        return evictionTtl;
    }

    public void setEvictionTtl(Duration evictionTtl) {
        this.evictionTtl = evictionTtl;
    }

    public Duration getCoalescingInterval() {
        return coalescingInterval;
    }

    public void setCoalescingInterval(Duration coalescingInterval) {
        this.coalescingInterval = coalescingInterval;
    }
}
