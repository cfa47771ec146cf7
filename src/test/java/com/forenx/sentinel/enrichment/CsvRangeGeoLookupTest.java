package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.GeoInfo;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CsvRangeGeoLookup Tests")
class CsvRangeGeoLookupTest {

    private static final String DATABASE = String.join("\n",
        "# start,end,code,name,region",
        "1.0.0.0,1.0.0.255,AU,Australia,Queensland",
        "\"8.8.8.0\",\"8.8.8.255\",\"US\",\"United States\"",
        "203.0.113.0,203.0.113.255,JP",
        "not-an-ip,1.2.3.4,XX",
        "2001:db8::,2001:db8::ffff,NL,Netherlands");

    private static CsvRangeGeoLookup lookup;

    @BeforeAll
    static void load() throws IOException {
        lookup = CsvRangeGeoLookup.load(new StringReader(DATABASE));
    }

    @Test
    @DisplayName("Should skip comments and malformed rows")
    void shouldLoadValidRows() {
        assertThat(lookup.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should resolve addresses inside a range")
    void shouldResolveAddresses() {
        assertThat(lookup.lookup("1.0.0.17")).isEqualTo(new GeoInfo("AU", "Australia"));
        assertThat(lookup.lookup("8.8.8.8")).isEqualTo(new GeoInfo("US", "United States"));
        assertThat(lookup.lookup("2001:db8::1")).isEqualTo(new GeoInfo("NL", "Netherlands"));
    }

    @Test
    @DisplayName("Should use the country code as name when the name column is missing")
    void shouldFallBackToCode() {
        assertThat(lookup.lookup("203.0.113.9").getCountry()).isEqualTo("JP");
    }

    @Test
    @DisplayName("Should return Unknown for gaps, private space and garbage")
    void shouldReturnUnknown() {
        assertThat(lookup.lookup("1.0.1.0")).isEqualTo(GeoInfo.UNKNOWN);
        assertThat(lookup.lookup("10.1.2.3")).isEqualTo(GeoInfo.UNKNOWN);
        assertThat(lookup.lookup("127.0.0.1")).isEqualTo(GeoInfo.UNKNOWN);
        assertThat(lookup.lookup("nonsense")).isEqualTo(GeoInfo.UNKNOWN);
        assertThat(lookup.lookup(null)).isEqualTo(GeoInfo.UNKNOWN);
    }
}
