package com.forenx.sentinel.query;

import com.forenx.sentinel.analytics.Dimension;
import com.forenx.sentinel.analytics.Granularity;
import com.forenx.sentinel.analytics.MetricsAggregator;
import com.forenx.sentinel.analytics.MetricsPoint;
import com.forenx.sentinel.analytics.MetricsSummary;
import com.forenx.sentinel.analytics.TopEntry;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.AttackType;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.storage.AlertFilter;
import com.forenx.sentinel.storage.AlertRepository;
import com.forenx.sentinel.storage.Page;
import com.forenx.sentinel.storage.RecordFilter;
import com.forenx.sentinel.storage.RecordStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.function.Supplier;

/**
 * Read-only query surface. Every query is range-bounded and size-limited; bad
 * parameters are reported as {@link QueryValidationException} before anything is read.
 */
@Service
public class QueryService {

    private static final Logger log = LoggerFactory.getLogger(QueryService.class);

    static final int MAX_SERIES_POINTS = 10_000;
    static final int MAX_TOP_LIMIT = 1_000;
    static final int MAX_ALERT_LIMIT = 5_000;
    static final int MAX_PAGE_LIMIT = 1_000;

    private final MetricsAggregator aggregator;
    private final AlertRepository alertRepository;
    private final RecordStore recordStore;
    private final MeterRegistry meterRegistry;

    public QueryService(MetricsAggregator aggregator, AlertRepository alertRepository, RecordStore recordStore,
                        MeterRegistry meterRegistry) {
        this.aggregator = aggregator;
        this.alertRepository = alertRepository;
        this.recordStore = recordStore;
        this.meterRegistry = meterRegistry;
    }

    public List<MetricsPoint> metrics(TimeRange range, Granularity granularity) {
        long points = estimatePoints(range, granularity);
        if (points > MAX_SERIES_POINTS) {
            throw new QueryValidationException("granularity", "Range " + range + " at " + granularity.getValue()
                + " granularity spans " + points + " buckets, at most " + MAX_SERIES_POINTS + " allowed");
        }
        return timed("metrics", () -> aggregator.query(range.getFrom(), range.getTo(), granularity));
    }

    public MetricsSummary summary(TimeRange range) {
        return timed("summary", () -> aggregator.summary(range.getFrom(), range.getTo()));
    }

    public List<TopEntry> top(Dimension dimension, int limit, TimeRange range) {
        checkLimit("limit", limit, MAX_TOP_LIMIT);
        return timed("top", () -> aggregator.top(dimension, limit, range.getFrom(), range.getTo()));
    }

    public List<Alert> alerts(TimeRange range, int limit, AttackType type, String clientIp, Double minConfidence) {
        checkLimit("limit", limit, MAX_ALERT_LIMIT);
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            throw new QueryValidationException("minConfidence", "minConfidence must be within [0, 1]: " + minConfidence);
        }
        AlertFilter filter = new AlertFilter(range.getFrom(), range.getTo(), type, blankToNull(clientIp), minConfidence);
        return timed("alerts", () -> alertRepository.find(filter, limit));
    }

    public Page<LogRecord> records(TimeRange range, String clientIp, String method, Integer statusCode,
                                   String pathContains, int offset, int limit) {
        checkLimit("limit", limit, MAX_PAGE_LIMIT);
        if (offset < 0) {
            throw new QueryValidationException("offset", "offset must not be negative: " + offset);
        }
        if (statusCode != null && (statusCode < 100 || statusCode > 599)) {
            throw new QueryValidationException("status", "status must be within 100-599: " + statusCode);
        }
        RecordFilter filter = RecordFilter.builder(range.getFrom(), range.getTo())
            .clientIp(blankToNull(clientIp))
            .method(method == null || method.isBlank() ? null : method.toUpperCase(Locale.ROOT))
            .statusCode(statusCode)
            .pathContains(blankToNull(pathContains))
            .build();
        return timed("records", () -> recordStore.find(filter, offset, limit));
    }

    public static Granularity parseGranularity(String value) {
        try {
            return Granularity.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("granularity", e.getMessage(), e);
        }
    }

    public static Dimension parseDimension(String value) {
        try {
            return Dimension.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("dimension", e.getMessage(), e);
        }
    }

    public static AttackType parseAttackType(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return AttackType.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new QueryValidationException("type", e.getMessage(), e);
        }
    }

    private static long estimatePoints(TimeRange range, Granularity granularity) {
        long seconds = Math.max(0, range.length().getSeconds());
        switch (granularity) {
            case HOUR:
                return seconds / 3_600 + 1;
            case DAY:
                return seconds / 86_400 + 1;
            case WEEK:
                return seconds / 604_800 + 1;
            case MONTH:
                return seconds / 2_419_200 + 1;
            default:
                throw new IllegalStateException("Unhandled granularity " + granularity);
        }
    }

    private static void checkLimit(String name, int limit, int max) {
        if (limit < 1 || limit > max) {
            throw new QueryValidationException(name, name + " must be within 1-" + max + ": " + limit);
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    private <T> T timed(String query, Supplier<T> body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return body.get();
        } finally {
            sample.stop(Timer.builder("forenx.query.duration").tag("query", query).register(meterRegistry));
            log.debug("Query {} served", query);
        }
    }
}
