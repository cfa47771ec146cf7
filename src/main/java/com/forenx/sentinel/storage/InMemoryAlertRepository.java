package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.Alert;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Alert store indexed by id and by timestamp. An alert's timestamp never changes when it is
 * merged, so an upsert rewrites the same index entry.
 */
@Repository
public class InMemoryAlertRepository implements AlertRepository {

    private final ConcurrentHashMap<String, Alert> byId = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<String, Alert> byTime = new ConcurrentSkipListMap<>();

    @Override
    public void save(Alert alert) {
        byId.put(alert.getId(), alert);
        byTime.put(InMemoryRecordStore.indexKey(alert.getTimestamp().toEpochMilli(), alert.getId()), alert);
    }

    @Override
    public Optional<Alert> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<Alert> find(AlertFilter filter, int limit) {
        List<Alert> result = new ArrayList<>(Math.min(limit, 256));
        for (Alert alert : byTime.subMap(
                InMemoryRecordStore.indexKey(filter.getFrom().toEpochMilli(), ""), true,
                InMemoryRecordStore.indexKey(filter.getTo().toEpochMilli(), ""), false)
                .descendingMap().values()) {
            if (result.size() >= limit) {
                break;
            }
            if (filter.matches(alert)) {
                result.add(alert);
            }
        }
        return result;
    }

    @Override
    public long count() {
        return byId.size();
    }
}
