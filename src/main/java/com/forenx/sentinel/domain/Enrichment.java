package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Derived attributes attached to a {@link LogRecord} by the enrichment stage.
 */
public final class Enrichment {

    public static final Enrichment UNKNOWN = new Enrichment(GeoInfo.UNKNOWN, UserAgentClass.UNKNOWN);

    @JsonProperty("geo")
    private final GeoInfo geo;

    @JsonProperty("user_agent_class")
    private final UserAgentClass userAgentClass;

    public Enrichment(GeoInfo geo, UserAgentClass userAgentClass) {
        this.geo = geo != null ? geo : GeoInfo.UNKNOWN;
        this.userAgentClass = userAgentClass != null ? userAgentClass : UserAgentClass.UNKNOWN;
    }

    public GeoInfo getGeo() {
        return geo;
    }

    public UserAgentClass getUserAgentClass() {
        return userAgentClass;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Enrichment)) {
            return false;
        }
        Enrichment that = (Enrichment) o;
        return geo.equals(that.geo) && userAgentClass == that.userAgentClass;
    }

    @Override
    public int hashCode() {
        return Objects.hash(geo, userAgentClass);
    }
}
