package com.forenx.sentinel.enrichment;

import com.forenx.sentinel.domain.GeoInfo;
import com.google.common.net.InetAddresses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.math.BigInteger;
import java.net.InetAddress;
import java.util.Map;
import java.util.TreeMap;

/**
 * Geo lookup backed by a range database in CSV form:
 * {@code start_ip,end_ip,country_code[,country_name[,...]]}. Extra columns (region, city, isp)
 * are ignored. Ranges are held in a {@link TreeMap} keyed by the numeric start address, so a
 * lookup is a floor search plus an end-of-range check.
 */
public class CsvRangeGeoLookup implements GeoLookup {

    private static final Logger log = LoggerFactory.getLogger(CsvRangeGeoLookup.class);

    private final TreeMap<BigInteger, Range> ranges;

    private CsvRangeGeoLookup(TreeMap<BigInteger, Range> ranges) {
        this.ranges = ranges;
    }

    public static CsvRangeGeoLookup load(Reader source) throws IOException {
        TreeMap<BigInteger, Range> ranges = new TreeMap<>();
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(source)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank() || line.startsWith("#")) {
                    continue;
                }
                String[] cols = line.split(",");
                if (cols.length < 3 || !InetAddresses.isInetAddress(unquote(cols[0]))
                        || !InetAddresses.isInetAddress(unquote(cols[1]))) {
                    skipped++;
                    continue;
                }
                BigInteger start = toNumber(InetAddresses.forString(unquote(cols[0])));
                BigInteger end = toNumber(InetAddresses.forString(unquote(cols[1])));
                String code = unquote(cols[2]);
                String name = cols.length > 3 && !unquote(cols[3]).isEmpty() ? unquote(cols[3]) : code;
                ranges.put(start, new Range(end, new GeoInfo(code, name)));
            }
        }
        if (skipped > 0) {
            log.warn("Skipped {} malformed geo range rows", skipped);
        }
        log.info("Loaded {} geo ranges", ranges.size());
        return new CsvRangeGeoLookup(ranges);
    }

    @Override
    public GeoInfo lookup(String ip) {
        if (ip == null || !InetAddresses.isInetAddress(ip)) {
            return GeoInfo.UNKNOWN;
        }
        InetAddress address = InetAddresses.forString(ip);
        if (address.isLoopbackAddress() || address.isSiteLocalAddress() || address.isLinkLocalAddress()) {
            return GeoInfo.UNKNOWN;
        }
        BigInteger value = toNumber(address);
        Map.Entry<BigInteger, Range> entry = ranges.floorEntry(value);
        if (entry == null || entry.getValue().end.compareTo(value) < 0) {
            return GeoInfo.UNKNOWN;
        }
        return entry.getValue().geo;
    }

    public int size() {
        return ranges.size();
    }

    private static BigInteger toNumber(InetAddress address) {
        return new BigInteger(1, address.getAddress());
    }

    private static String unquote(String value) {
        String v = value.trim();
        if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
            return v.substring(1, v.length() - 1);
        }
        return v;
    }

    private static final class Range {
        final BigInteger end;
        final GeoInfo geo;

        Range(BigInteger end, GeoInfo geo) {
            this.end = end;
            this.geo = geo;
        }
    }
}
