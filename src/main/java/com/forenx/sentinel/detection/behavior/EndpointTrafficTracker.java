package com.forenx.sentinel.detection.behavior;

import com.forenx.sentinel.config.DetectionSettings;
import com.forenx.sentinel.domain.LogRecord;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.stereotype.Component;

/**
 * Per-endpoint state shared by all behavior shards: the request-rate window across every
 * client, and an EWMA baseline of response sizes used to spot single-record outliers.
 *
 * Records of one endpoint arrive from several shards, so each endpoint's state is guarded by
 * its own monitor. Shards never contend on the same lock for different endpoints.
 */
@Component
public class EndpointTrafficTracker {

    static final long MAX_ENDPOINTS = 50_000L;

    private final Cache<String, EndpointState> endpoints = Caffeine.newBuilder()
        .maximumSize(MAX_ENDPOINTS)
        .build();

    /**
     * Adds the record to its endpoint's window and baseline.
     */
    public Observation observe(LogRecord record, String endpoint, DetectionSettings settings, long nanoTime) {
        EndpointState state = endpoints.get(endpoint, k -> new EndpointState());
        synchronized (state) {
            state.lastObservedNanos = nanoTime;
            if (state.rate == null || !state.rate.getLength().equals(settings.getRateWindow())) {
                state.rate = new ClassifierWindow(endpoint, settings.getRateWindow(), 1);
            }
            boolean accepted = state.rate.observe(record.getTimestamp(), record.getStatusCode(),
                record.getBytesSent(), null);

            double outlierThreshold = Double.NaN;
            if (state.samples >= settings.getBaselineMinSamples()) {
                outlierThreshold = Math.max(settings.getOutlierMinBytes(),
                    state.mean + settings.getOutlierSigma() * state.stdDev);
            }
            boolean outlier = !Double.isNaN(outlierThreshold) && record.getBytesSent() > outlierThreshold;

            // Outliers are kept out of the baseline so one huge response does not mask the next
            if (!outlier) {
                state.updateBaseline(record.getBytesSent(), settings.getBaselineMinSamples());
            }
            return new Observation(accepted, state.rate.getEventCount(), outlier, outlierThreshold, state.mean);
        }
    }

    /**
     * Drops endpoints that saw no record since {@code cutoffNanos} (wall clock).
     *
     * @return number of endpoints removed
     */
    public int evictIdle(long cutoffNanos) {
        int before = endpoints.asMap().size();
        endpoints.asMap().values().removeIf(state -> {
            synchronized (state) {
                return state.lastObservedNanos - cutoffNanos < 0;
            }
        });
        return before - endpoints.asMap().size();
    }

    public long trackedEndpoints() {
        return endpoints.estimatedSize();
    }

    public static final class Observation {
        private final boolean accepted;
        private final long windowEvents;
        private final boolean outlier;
        private final double outlierThreshold;
        private final double baselineMean;

        Observation(boolean accepted, long windowEvents, boolean outlier, double outlierThreshold, double baselineMean) {
            this.accepted = accepted;
            this.windowEvents = windowEvents;
            this.outlier = outlier;
            this.outlierThreshold = outlierThreshold;
            this.baselineMean = baselineMean;
        }

        public boolean isAccepted() {
            return accepted;
        }

        public long getWindowEvents() {
            return windowEvents;
        }

        public boolean isOutlier() {
            return outlier;
        }

        public double getOutlierThreshold() {
            return outlierThreshold;
        }

        public double getBaselineMean() {
            return baselineMean;
        }
    }

    private static final class EndpointState {
        ClassifierWindow rate;
        long lastObservedNanos;
        long samples;
        double mean;
        double stdDev;

        void updateBaseline(long bytes, int span) {
            if (samples == 0) {
                mean = bytes;
                stdDev = 0.0;
            } else {
                double alpha = 2.0 / (span + 1);
                double newMean = alpha * bytes + (1 - alpha) * mean;
                double deviation = Math.pow(bytes - newMean, 2);
                stdDev = Math.sqrt(alpha * deviation + (1 - alpha) * Math.pow(stdDev, 2));
                mean = newMean;
            }
            samples++;
        }
    }
}
