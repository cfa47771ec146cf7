package com.forenx.sentinel.detection.signature;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.forenx.sentinel.config.ClassifierConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a YAML rule file ({@code rules:} list of {@link SignatureRule}) into a compiled
 * {@link SignatureRuleSet}.
 */
public class SignatureRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(SignatureRuleLoader.class);

    private final YAMLMapper yamlMapper;

    public SignatureRuleLoader() {
        this.yamlMapper = new YAMLMapper();
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @throws ClassifierConfigException if the file cannot be read or any rule is invalid
     */
    public SignatureRuleSet load(InputStream in, String origin) {
        RuleFile file;
        try {
            file = yamlMapper.readValue(in, RuleFile.class);
        } catch (IOException e) {
            throw new ClassifierConfigException("Cannot read signature rules from " + origin + ": "
                + e.getMessage(), origin, e);
        }
        SignatureRuleSet set = SignatureRuleSet.compile(file == null ? null : file.rules, origin);
        log.info("Loaded {} signature rules from {}", set.size(), origin);
        return set;
    }

    static class RuleFile {
        @JsonProperty("rules")
        List<SignatureRule> rules = new ArrayList<>();
    }
}
