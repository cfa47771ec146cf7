package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.GeoInfo;

/**
 * Resolves a client address to a country.
 */
public interface GeoLookup {

    /**
     * @param ip textual client address as it appeared in the log line
     * @return the country, or {@link GeoInfo#UNKNOWN} if the address is not covered
     * @throws EnrichmentLookupException if the lookup backend failed
     */
    GeoInfo lookup(String ip) throws EnrichmentLookupException;

    /**
     * Lookup used when no database or endpoint is configured.
     */
    GeoLookup NONE = ip -> GeoInfo.UNKNOWN;
}
