package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.LogRecord;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Record store held in a skip list ordered by event time, then record id. Appending a record
 * whose id is already stored replaces it, so re-ingesting a file does not duplicate rows.
 */
@Repository
public class InMemoryRecordStore implements RecordStore {

    private final ConcurrentSkipListMap<String, LogRecord> records = new ConcurrentSkipListMap<>();

    @Override
    public void append(LogRecord record) {
        records.put(indexKey(record.getTimestamp().toEpochMilli(), record.getId()), record);
    }

    @Override
    public Page<LogRecord> find(RecordFilter filter, int offset, int limit) {
        NavigableMap<String, LogRecord> range = records.subMap(
            indexKey(filter.getFrom().toEpochMilli(), ""), true,
            indexKey(filter.getTo().toEpochMilli(), ""), false);
        List<LogRecord> items = new ArrayList<>(Math.min(limit, 256));
        long total = 0;
        for (LogRecord record : range.values()) {
            if (!filter.matches(record)) {
                continue;
            }
            if (total >= offset && items.size() < limit) {
                items.add(record);
            }
            total++;
        }
        return new Page<>(items, offset, limit, total);
    }

    @Override
    public long count() {
        return records.size();
    }

    static String indexKey(long epochMillis, String id) {
        // Offset so negative epochs still sort before positive ones
        return String.format("%020d|%s", epochMillis - Long.MIN_VALUE / 2, id);
    }
}
