package com.forenx.sentinel.enrichment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.zip.GZIPInputStream;

/**
 * Builds the {@link GeoLookup} for a database path and/or endpoint. A local range database
 * wins over a remote endpoint when both are set.
 */
public final class GeoLookupFactory {

    private static final Logger log = LoggerFactory.getLogger(GeoLookupFactory.class);

    private GeoLookupFactory() {
    }

    public static GeoLookup create(String database, String endpoint, Duration timeout) {
        if (database != null && !database.isBlank()) {
            Path path = Path.of(database);
            try (Reader reader = open(path)) {
                log.info("Using geo range database {}", path);
                return CsvRangeGeoLookup.load(reader);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot read geo database " + path, e);
            }
        }
        if (endpoint != null && !endpoint.isBlank()) {
            log.info("Using geo lookup endpoint {}", endpoint);
            return new RestGeoLookup(endpoint, timeout);
        }
        log.info("No geo database or endpoint configured, countries resolve to Unknown");
        return GeoLookup.NONE;
    }

    private static Reader open(Path path) throws IOException {
        if (path.getFileName().toString().endsWith(".gz")) {
            return new InputStreamReader(new GZIPInputStream(Files.newInputStream(path)), StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }
}
