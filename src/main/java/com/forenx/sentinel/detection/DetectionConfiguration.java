package com.forenx.sentinel.detection;

import com.forenx.sentinel.config.ClassifierConfigException;
import com.forenx.sentinel.config.SentinelProperties;
import com.forenx.sentinel.detection.signature.SignatureClassifier;
import com.forenx.sentinel.detection.signature.SignatureRuleLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Signature rules are loaded once at startup. A missing or invalid rule file stops the context.
 */
@Configuration
public class DetectionConfiguration {

    @Bean
    public SignatureRuleLoader signatureRuleLoader() {
        return new SignatureRuleLoader();
    }

    @Bean
    public SignatureClassifier signatureClassifier(SignatureRuleLoader loader, ResourceLoader resourceLoader,
                                                   SentinelProperties properties) {
        String location = properties.getRules().getSignatureLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return new SignatureClassifier(loader.load(in, location));
        } catch (IOException e) {
            throw new ClassifierConfigException("Signature rules not found at " + location, location, e);
        }
    }
}
