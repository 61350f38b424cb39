package com.groundgate.core.config;

import com.groundgate.core.citation.CitationValidator;
import com.groundgate.core.evidence.EvidenceStore;
import com.groundgate.core.qualitygate.GateRules;
import com.groundgate.core.qualitygate.GateSettings;
import com.groundgate.core.qualitygate.QualityGateVerifier;
import com.groundgate.core.retry.RetryPolicy;
import com.groundgate.core.retry.Sleeper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Random;

@Configuration
public class GroundgateConfig {

    @Bean
    public EvidenceStore evidenceStore(GroundgateProperties properties) {
        return new EvidenceStore(properties.getStore().getTextPrefixLength());
    }

    @Bean
    public CitationValidator citationValidator(EvidenceStore evidenceStore, GroundgateProperties properties) {
        var citation = properties.getCitation();
        return new CitationValidator(evidenceStore, citation.getRelevanceThreshold(), citation.getQuoteMaxLength());
    }

    @Bean
    public QualityGateVerifier qualityGateVerifier(GroundgateProperties properties) {
        var gate = properties.getGate();
        var settings = new GateSettings(gate.isRequireCitations(), gate.isRequireLocators(),
                gate.getMinEvidenceCoverage(), gate.getLocatorKey());
        return new QualityGateVerifier(settings, GateRules.defaults());
    }

    @Bean
    public RetryPolicy retryPolicy(GroundgateProperties properties) {
        var retry = properties.getRetry();
        return new RetryPolicy(retry.getMaxAttempts(),
                Duration.ofMillis(retry.getBaseDelayMs()),
                Duration.ofMillis(retry.getMaxDelayMs()),
                retry.isJitter(), new Random(), Sleeper.THREAD);
    }
}
