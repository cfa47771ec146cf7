package com.forenx.sentinel.normalization.parsers;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.forenx.sentinel.config.ClassifierConfigException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a YAML list of {@code formats:} definitions. Types and modes are matched case-insensitively.
 */
public class FormatDefinitionLoader {

    private final YAMLMapper yamlMapper;

    public FormatDefinitionLoader() {
        this.yamlMapper = YAMLMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();
    }

    /**
     * @throws ClassifierConfigException if the file cannot be read
     */
    public List<FormatDefinition> load(InputStream in, String origin) {
        try {
            FormatFile file = yamlMapper.readValue(in, FormatFile.class);
            return file == null || file.formats == null ? List.of() : List.copyOf(file.formats);
        } catch (IOException e) {
            throw new ClassifierConfigException("Cannot read log formats from " + origin + ": "
                + e.getMessage(), origin, e);
        }
    }

    static class FormatFile {
        @JsonProperty("formats")
        List<FormatDefinition> formats = new ArrayList<>();
    }
}
