package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.ErrorKind;
import com.forenx.sentinel.domain.SentinelException;

/**
 * Raised by a {@link GeoLookup} or {@link UserAgentClassifier} that could not answer.
 * Never escapes {@link EnrichmentStage}; the record is enriched with Unknown instead.
 */
public class EnrichmentLookupException extends SentinelException {

    private final String lookup;

    public EnrichmentLookupException(String lookup, String message) {
        super(message);
        this.lookup = lookup;
    }

    public EnrichmentLookupException(String lookup, String message, Throwable cause) {
        super(message, cause);
        this.lookup = lookup;
    }

    public String getLookup() {
        return lookup;
    }

    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.ENRICHMENT_LOOKUP_FAILURE;
    }
}
