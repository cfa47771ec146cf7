package com.forenx.sentinel.config;

import com.forenx.sentinel.detection.signature.SignatureClassifier;
import com.forenx.sentinel.detection.signature.SignatureRuleLoader;
import com.forenx.sentinel.detection.signature.SignatureRuleSet;
import com.forenx.sentinel.normalization.parsers.FormatDefinition;
import com.forenx.sentinel.normalization.parsers.FormatDefinitionLoader;
import com.forenx.sentinel.normalization.parsers.ParserRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Polls the signature rule file and the optional log format file for changes and swaps
 * the new definitions in. A file that fails to load or validate is logged and the
 * definitions already active are kept. Classpath resources packed in a jar have no
 * modification time and are never reloaded.
 */
@Component
public class RuleFileWatcher {

    private static final Logger log = LoggerFactory.getLogger(RuleFileWatcher.class);

    private final ResourceLoader resourceLoader;
    private final SignatureClassifier signatureClassifier;
    private final SignatureRuleLoader ruleLoader;
    private final ParserRegistry parserRegistry;
    private final FormatDefinitionLoader formatLoader = new FormatDefinitionLoader();
    private final String signatureLocation;
    private final String formatsLocation;

    private long signatureModified;
    private long formatsModified;

    public RuleFileWatcher(ResourceLoader resourceLoader, SignatureClassifier signatureClassifier,
                           SignatureRuleLoader ruleLoader, ParserRegistry parserRegistry,
                           SentinelProperties properties) {
        this.resourceLoader = resourceLoader;
        this.signatureClassifier = signatureClassifier;
        this.ruleLoader = ruleLoader;
        this.parserRegistry = parserRegistry;
        this.signatureLocation = properties.getRules().getSignatureLocation();
        this.formatsLocation = properties.getRules().getFormatsLocation();
    }

    /**
     * Activates the configured format file, if any. An invalid file at startup is fatal.
     */
    @PostConstruct
    public synchronized void init() {
        signatureModified = lastModified(signatureLocation);
        if (formatsLocation != null && !formatsLocation.isBlank()) {
            parserRegistry.replaceFormats(readFormats());
            formatsModified = lastModified(formatsLocation);
        }
    }

    @Scheduled(fixedDelayString = "${forenx.rules.reload-interval:PT30S}")
    public synchronized void poll() {
        long modified = lastModified(signatureLocation);
        if (modified > signatureModified) {
            signatureModified = modified;
            reloadSignatures();
        }
        if (formatsLocation != null && !formatsLocation.isBlank()) {
            modified = lastModified(formatsLocation);
            if (modified > formatsModified) {
                formatsModified = modified;
                reloadFormats();
            }
        }
    }

    /**
     * @return true if the new rules are active
     */
    public boolean reloadSignatures() {
        try (InputStream in = resourceLoader.getResource(signatureLocation).getInputStream()) {
            SignatureRuleSet rules = ruleLoader.load(in, signatureLocation);
            signatureClassifier.replaceRules(rules);
            return true;
        } catch (IOException | ClassifierConfigException e) {
            log.error("Signature rule reload from {} rejected, keeping {} active rules: {}",
                signatureLocation, signatureClassifier.getRuleSet().size(), e.getMessage());
            return false;
        }
    }

    /**
     * @return true if the new formats are active
     */
    public boolean reloadFormats() {
        try {
            parserRegistry.replaceFormats(readFormats());
            return true;
        } catch (ClassifierConfigException e) {
            log.error("Log format reload from {} rejected, keeping current formats: {}",
                formatsLocation, e.getMessage());
            return false;
        }
    }

    private List<FormatDefinition> readFormats() {
        try (InputStream in = resourceLoader.getResource(formatsLocation).getInputStream()) {
            return formatLoader.load(in, formatsLocation);
        } catch (IOException e) {
            throw new ClassifierConfigException("Cannot open log formats at " + formatsLocation, formatsLocation, e);
        }
    }

    private long lastModified(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.isFile()) {
            return 0L;
        }
        try {
            return resource.lastModified();
        } catch (IOException e) {
            log.warn("Cannot stat {}: {}", location, e.getMessage());
            return 0L;
        }
    }
}
