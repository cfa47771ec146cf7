package com.forenx.sentinel.ingestion;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * Most recent ingestion summaries, newest first, capped at {@value #CAPACITY} entries.
 */
@Component
public class IngestionLedger {

    static final int CAPACITY = 1000;

    private final ConcurrentLinkedDeque<IngestionSummary> entries = new ConcurrentLinkedDeque<>();

    public void record(IngestionSummary summary) {
        entries.addFirst(summary);
        while (entries.size() > CAPACITY) {
            entries.pollLast();
        }
    }

    public List<IngestionSummary> list() {
        return new ArrayList<>(entries);
    }

    public Optional<IngestionSummary> latest(String sourceFileId) {
        Iterator<IngestionSummary> it = entries.iterator();
        while (it.hasNext()) {
            IngestionSummary s = it.next();
            if (s.getSourceFileId().equals(sourceFileId)) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }
}
