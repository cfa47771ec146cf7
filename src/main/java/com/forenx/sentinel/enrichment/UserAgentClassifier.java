package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.UserAgentClass;

public interface UserAgentClassifier {

    UserAgentClass classify(String userAgent) throws EnrichmentLookupException;
}
