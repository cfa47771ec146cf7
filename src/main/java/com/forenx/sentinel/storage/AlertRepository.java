package com.forenx.sentinel.storage;

import com.forenx.sentinel.domain.Alert;

import java.util.List;
import java.util.Optional;

/**
 * Persisted alerts. Saving an alert whose id exists replaces the stored version.
 */
public interface AlertRepository {

    /**
     * @throws StorageWriteException if the alert could not be persisted
     */
    void save(Alert alert) throws StorageWriteException;

    Optional<Alert> findById(String id);

    /**
     * Alerts matching the filter, newest first.
     */
    List<Alert> find(AlertFilter filter, int limit);

    long count();
}
