package com.forenx.sentinel.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Country resolved for a client address. {@link #UNKNOWN} when no lookup could resolve it.
 */
public final class GeoInfo {

    public static final GeoInfo UNKNOWN = new GeoInfo("ZZ", "Unknown");

    @JsonProperty("country_code")
    private final String countryCode;

    @JsonProperty("country")
    private final String country;

    public GeoInfo(@JsonProperty("country_code") String countryCode, @JsonProperty("country") String country) {
        this.countryCode = countryCode;
        this.country = country;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getCountry() {
        return country;
    }

    public boolean isKnown() {
        return !UNKNOWN.equals(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GeoInfo)) {
            return false;
        }
        GeoInfo geoInfo = (GeoInfo) o;
        return Objects.equals(countryCode, geoInfo.countryCode) && Objects.equals(country, geoInfo.country);
    }

    @Override
    public int hashCode() {
        return Objects.hash(countryCode, country);
    }

    @Override
    public String toString() {
        return countryCode + "/" + country;
    }
}
