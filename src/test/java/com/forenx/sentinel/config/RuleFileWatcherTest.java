package com.forenx.sentinel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forenx.sentinel.detection.signature.SignatureClassifier;
import com.forenx.sentinel.detection.signature.SignatureRuleLoader;
import com.forenx.sentinel.normalization.parsers.LogFormatParser;
import com.forenx.sentinel.normalization.parsers.ParserRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleFileWatcher Tests")
class RuleFileWatcherTest {

    private static final String ONE_RULE = String.join("\n",
        "rules:",
        "  - id: recon-wp-admin",
        "    attack_type: PathTraversal",
        "    pattern: 'wp-admin'",
        "    confidence: 0.5",
        "");

    private static final String TWO_RULES = ONE_RULE + String.join("\n",
        "  - id: recon-phpmyadmin",
        "    attack_type: PathTraversal",
        "    pattern: 'phpmyadmin'",
        "    confidence: 0.5",
        "");

    private static final String ONE_FORMAT = String.join("\n",
        "formats:",
        "  - name: json",
        "    type: json",
        "    priority: 10",
        "");

    @TempDir
    Path dir;

    private Path rulesFile;
    private Path formatsFile;
    private SignatureClassifier classifier;
    private ParserRegistry parserRegistry;
    private RuleFileWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        rulesFile = dir.resolve("rules.yml");
        formatsFile = dir.resolve("formats.yml");
        Files.writeString(rulesFile, ONE_RULE, StandardCharsets.UTF_8);
        Files.writeString(formatsFile, ONE_FORMAT, StandardCharsets.UTF_8);

        SignatureRuleLoader loader = new SignatureRuleLoader();
        try (InputStream in = Files.newInputStream(rulesFile)) {
            classifier = new SignatureClassifier(loader.load(in, rulesFile.toString()));
        }
        parserRegistry = new ParserRegistry(new ObjectMapper());

        SentinelProperties properties = new SentinelProperties();
        properties.getRules().setSignatureLocation(rulesFile.toUri().toString());
        properties.getRules().setFormatsLocation(formatsFile.toUri().toString());
        watcher = new RuleFileWatcher(new DefaultResourceLoader(), classifier, loader, parserRegistry, properties);
        watcher.init();
    }

    @Test
    @DisplayName("Should activate the configured formats at startup")
    void shouldLoadFormatsOnInit() {
        assertThat(parserRegistry.getParsers()).extracting(LogFormatParser::getFormatName).containsExactly("json");
    }

    @Test
    @DisplayName("Should fail startup on an invalid format file")
    void shouldFailOnInvalidFormatsAtStartup() throws IOException {
        Files.writeString(formatsFile, "formats: []\n", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> watcher.init()).isInstanceOf(ClassifierConfigException.class);
    }

    @Test
    @DisplayName("Should swap in rules from a modified file")
    void shouldReloadModifiedRules() throws IOException {
        // Given
        Files.writeString(rulesFile, TWO_RULES, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(rulesFile, FileTime.fromMillis(System.currentTimeMillis() + 60_000));

        // When
        watcher.poll();

        // Then
        assertThat(classifier.getRuleSet().size()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep the active rules when the new file is invalid")
    void shouldKeepRulesOnInvalidFile() throws IOException {
        Files.writeString(rulesFile, "rules:\n  - id: broken\n    attack_type: SQLInjection\n    pattern: '('\n"
            + "    confidence: 0.5\n", StandardCharsets.UTF_8);

        boolean reloaded = watcher.reloadSignatures();

        assertThat(reloaded).isFalse();
        assertThat(classifier.getRuleSet().size()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep the active formats when the new file is invalid")
    void shouldKeepFormatsOnInvalidFile() throws IOException {
        Files.writeString(formatsFile, "formats:\n  - name: broken\n    type: regex\n    pattern: '(?<ip>'\n",
            StandardCharsets.UTF_8);

        boolean reloaded = watcher.reloadFormats();

        assertThat(reloaded).isFalse();
        assertThat(parserRegistry.getParsers()).extracting(LogFormatParser::getFormatName).containsExactly("json");
    }
}
