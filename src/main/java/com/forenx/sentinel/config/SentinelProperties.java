package com.forenx.sentinel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalised configuration, bound from the {@code forenx.*} namespace.
 */
@ConfigurationProperties(prefix = "forenx")
public class SentinelProperties {

    private final Detection detection = new Detection();
    private final Alerts alerts = new Alerts();
    private final Ingestion ingestion = new Ingestion();
    private final Analytics analytics = new Analytics();
    private final Enrichment enrichment = new Enrichment();
    private final Rules rules = new Rules();
    private final Live live = new Live();

    public Detection getDetection() {
        return detection;
    }

    public Alerts getAlerts() {
        return alerts;
    }

    public Ingestion getIngestion() {
        return ingestion;
    }

    public Analytics getAnalytics() {
        return analytics;
    }

    public Enrichment getEnrichment() {
        return enrichment;
    }

    public Rules getRules() {
        return rules;
    }

    public Live getLive() {
        return live;
    }

    /**
     * Behavioral classifier windows and thresholds.
     */
    public static class Detection {
        private Duration authWindow = Duration.ofMinutes(5);
        private int authThreshold = 10;
        private Duration rateWindow = Duration.ofMinutes(1);
        private int rateThreshold = 300;
        private int endpointRateThreshold = 1000;
        private Duration volumeWindow = Duration.ofHours(1);
        private long bytesThreshold = 10_000_000L;
        private long outlierMinBytes = 1_000_000L;
        private double outlierSigma = 4.0;
        private int baselineMinSamples = 20;
        private int diversityThreshold = 3;
        private int maxTrackedEndpoints = 256;
        private Duration evictionTtl;
        private double behaviorBaseConfidence = 0.7;
        private double saturationRatio = 1.5;
        private Duration sweepInterval = Duration.ofSeconds(30);

        public Duration getAuthWindow() {
            return authWindow;
        }

        public void setAuthWindow(Duration authWindow) {
            this.authWindow = authWindow;
        }

        public int getAuthThreshold() {
            return authThreshold;
        }

        public void setAuthThreshold(int authThreshold) {
            this.authThreshold = authThreshold;
        }

        public Duration getRateWindow() {
            return rateWindow;
        }

        public void setRateWindow(Duration rateWindow) {
            this.rateWindow = rateWindow;
        }

        public int getRateThreshold() {
            return rateThreshold;
        }

        public void setRateThreshold(int rateThreshold) {
            this.rateThreshold = rateThreshold;
        }

        public int getEndpointRateThreshold() {
            return endpointRateThreshold;
        }

        public void setEndpointRateThreshold(int endpointRateThreshold) {
            this.endpointRateThreshold = endpointRateThreshold;
        }

        public Duration getVolumeWindow() {
            return volumeWindow;
        }

        public void setVolumeWindow(Duration volumeWindow) {
            this.volumeWindow = volumeWindow;
        }

        public long getBytesThreshold() {
            return bytesThreshold;
        }

        public void setBytesThreshold(long bytesThreshold) {
            this.bytesThreshold = bytesThreshold;
        }

        public long getOutlierMinBytes() {
            return outlierMinBytes;
        }

        public void setOutlierMinBytes(long outlierMinBytes) {
            this.outlierMinBytes = outlierMinBytes;
        }

        public double getOutlierSigma() {
            return outlierSigma;
        }

        public void setOutlierSigma(double outlierSigma) {
            this.outlierSigma = outlierSigma;
        }

        public int getBaselineMinSamples() {
            return baselineMinSamples;
        }

        public void setBaselineMinSamples(int baselineMinSamples) {
            this.baselineMinSamples = baselineMinSamples;
        }

        public int getDiversityThreshold() {
            return diversityThreshold;
        }

        public void setDiversityThreshold(int diversityThreshold) {
            this.diversityThreshold = diversityThreshold;
        }

        public int getMaxTrackedEndpoints() {
            return maxTrackedEndpoints;
        }

        public void setMaxTrackedEndpoints(int maxTrackedEndpoints) {
            this.maxTrackedEndpoints = maxTrackedEndpoints;
        }

        public Duration getEvictionTtl() {
            return evictionTtl;
        }

        public void setEvictionTtl(Duration evictionTtl) {
            this.evictionTtl = evictionTtl;
        }

        public double getBehaviorBaseConfidence() {
            return behaviorBaseConfidence;
        }

        public void setBehaviorBaseConfidence(double behaviorBaseConfidence) {
            this.behaviorBaseConfidence = behaviorBaseConfidence;
        }

        public double getSaturationRatio() {
            return saturationRatio;
        }

        public void setSaturationRatio(double saturationRatio) {
            this.saturationRatio = saturationRatio;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    /**
     * Alert coalescing.
     */
    public static class Alerts {
        private Duration coalescingInterval = Duration.ofSeconds(60);
        private int maxSourceRecords = 50;
        private double corroborationBonus = 0.05;

        public Duration getCoalescingInterval() {
            return coalescingInterval;
        }

        public void setCoalescingInterval(Duration coalescingInterval) {
            this.coalescingInterval = coalescingInterval;
        }

        public int getMaxSourceRecords() {
            return maxSourceRecords;
        }

        public void setMaxSourceRecords(int maxSourceRecords) {
            this.maxSourceRecords = maxSourceRecords;
        }

        public double getCorroborationBonus() {
            return corroborationBonus;
        }

        public void setCorroborationBonus(double corroborationBonus) {
            this.corroborationBonus = corroborationBonus;
        }
    }

    /**
     * Ingestion pipeline sizing.
     */
    public static class Ingestion {
        private int queueCapacity = 10_000;
        private int shards = 4;
        private int parserWorkers = 2;
        private Duration drainTimeout = Duration.ofSeconds(30);

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getShards() {
            return shards;
        }

        public void setShards(int shards) {
            this.shards = shards;
        }

        public int getParserWorkers() {
            return parserWorkers;
        }

        public void setParserWorkers(int parserWorkers) {
            this.parserWorkers = parserWorkers;
        }

        public Duration getDrainTimeout() {
            return drainTimeout;
        }

        public void setDrainTimeout(Duration drainTimeout) {
            this.drainTimeout = drainTimeout;
        }
    }

    /**
     * Metrics aggregation structures.
     */
    public static class Analytics {
        private int topKCapacity = 200;
        private int uniqueClientExpected = 20_000;
        private double uniqueClientFpp = 0.01;

        public int getTopKCapacity() {
            return topKCapacity;
        }

        public void setTopKCapacity(int topKCapacity) {
            this.topKCapacity = topKCapacity;
        }

        public int getUniqueClientExpected() {
            return uniqueClientExpected;
        }

        public void setUniqueClientExpected(int uniqueClientExpected) {
            this.uniqueClientExpected = uniqueClientExpected;
        }

        public double getUniqueClientFpp() {
            return uniqueClientFpp;
        }

        public void setUniqueClientFpp(double uniqueClientFpp) {
            this.uniqueClientFpp = uniqueClientFpp;
        }
    }

    /**
     * Enrichment lookups.
     */
    public static class Enrichment {
        private String geoEndpoint;
        private String geoDatabase;
        private Duration timeout = Duration.ofMillis(500);
        private long cacheSize = 100_000L;
        private Duration cacheTtl = Duration.ofMinutes(10);

        public String getGeoEndpoint() {
            return geoEndpoint;
        }

        public void setGeoEndpoint(String geoEndpoint) {
            this.geoEndpoint = geoEndpoint;
        }

        public String getGeoDatabase() {
            return geoDatabase;
        }

        public void setGeoDatabase(String geoDatabase) {
            this.geoDatabase = geoDatabase;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public long getCacheSize() {
            return cacheSize;
        }

        public void setCacheSize(long cacheSize) {
            this.cacheSize = cacheSize;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }
    }

    /**
     * Rule and format definition files.
     */
    public static class Rules {
        private String signatureLocation = "classpath:rules/signature-rules.yml";
        private String formatsLocation;
        private Duration reloadInterval = Duration.ofSeconds(30);

        public String getSignatureLocation() {
            return signatureLocation;
        }

        public void setSignatureLocation(String signatureLocation) {
            this.signatureLocation = signatureLocation;
        }

        public String getFormatsLocation() {
            return formatsLocation;
        }

        public void setFormatsLocation(String formatsLocation) {
            this.formatsLocation = formatsLocation;
        }

        public Duration getReloadInterval() {
            return reloadInterval;
        }

        public void setReloadInterval(Duration reloadInterval) {
            this.reloadInterval = reloadInterval;
        }
    }

    /**
     * Live subscriber channel.
     */
    public static class Live {
        private int subscriberBuffer = 1024;

        public int getSubscriberBuffer() {
            return subscriberBuffer;
        }

        public void setSubscriberBuffer(int subscriberBuffer) {
            this.subscriberBuffer = subscriberBuffer;
        }
    }
}
