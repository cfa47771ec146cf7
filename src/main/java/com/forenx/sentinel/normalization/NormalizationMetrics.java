package com.forenx.sentinel.normalization;

import com.forenx.sentinel.normalization.parsers.ParseErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics for line parsing, tagged by format and by error kind.
 */
@Component
public class NormalizationMetrics {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> parsedCounters = new ConcurrentHashMap<>();
    private final Map<ParseErrorKind, Counter> failedCounters = new ConcurrentHashMap<>();

    public NormalizationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void recordParsed(String format) {
        parsedCounters.computeIfAbsent(format, f ->
            Counter.builder("forenx.normalization.parsed")
                .tag("format", f)
                .description("Number of lines parsed by format")
                .register(meterRegistry)
        ).increment();
    }

    public void recordFailed(ParseErrorKind kind) {
        failedCounters.computeIfAbsent(kind, k ->
            Counter.builder("forenx.normalization.failed")
                .tag("kind", k.getValue())
                .description("Number of lines rejected by error kind")
                .register(meterRegistry)
        ).increment();
    }

    public double getParsedCount(String format) {
        Counter counter = parsedCounters.get(format);
        return counter != null ? counter.count() : 0.0;
    }

    public double getFailedCount(ParseErrorKind kind) {
        Counter counter = failedCounters.get(kind);
        return counter != null ? counter.count() : 0.0;
    }
}
