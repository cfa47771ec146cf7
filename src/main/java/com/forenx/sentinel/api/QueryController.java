package com.forenx.sentinel.api;

import com.forenx.sentinel.analytics.MetricsPoint;
import com.forenx.sentinel.analytics.MetricsSummary;
import com.forenx.sentinel.analytics.TopEntry;
import com.forenx.sentinel.domain.Alert;
import com.forenx.sentinel.domain.LogRecord;
import com.forenx.sentinel.query.QueryService;
import com.forenx.sentinel.query.TimeRange;
import com.forenx.sentinel.storage.Page;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Read-only query endpoints. Every call needs a {@code from}/{@code to} range.
 */
@RestController
@RequestMapping("/api")
public class QueryController {

    private final QueryService queryService;

    public QueryController(QueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping("/metrics")
    public List<MetricsPoint> metrics(@RequestParam String from, @RequestParam String to,
                                      @RequestParam(defaultValue = "hour") String granularity) {
        return queryService.metrics(TimeRange.parse(from, to), QueryService.parseGranularity(granularity));
    }

    @GetMapping("/metrics/summary")
    public MetricsSummary summary(@RequestParam String from, @RequestParam String to) {
        return queryService.summary(TimeRange.parse(from, to));
    }

    @GetMapping("/top")
    public List<TopEntry> top(@RequestParam String dimension, @RequestParam(defaultValue = "10") int limit,
                              @RequestParam String from, @RequestParam String to) {
        return queryService.top(QueryService.parseDimension(dimension), limit, TimeRange.parse(from, to));
    }

    @GetMapping("/alerts")
    public List<Alert> alerts(@RequestParam String from, @RequestParam String to,
                              @RequestParam(defaultValue = "100") int limit,
                              @RequestParam(required = false) String type,
                              @RequestParam(required = false) String ip,
                              @RequestParam(required = false) Double minConfidence) {
        return queryService.alerts(TimeRange.parse(from, to), limit, QueryService.parseAttackType(type), ip,
            minConfidence);
    }

    @GetMapping("/records")
    public Page<LogRecord> records(@RequestParam String from, @RequestParam String to,
                                   @RequestParam(required = false) String ip,
                                   @RequestParam(required = false) String method,
                                   @RequestParam(required = false) Integer status,
                                   @RequestParam(required = false) String path,
                                   @RequestParam(defaultValue = "0") int offset,
                                   @RequestParam(defaultValue = "100") int limit) {
        return queryService.records(TimeRange.parse(from, to), ip, method, status, path, offset, limit);
    }
}
