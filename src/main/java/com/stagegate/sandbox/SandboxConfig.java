package com.stagegate.sandbox;

import com.stagegate.core.collaborator.ExternalReviewer;
import com.stagegate.core.collaborator.KeyValueStore;
import com.stagegate.core.collaborator.LivenessTimer;
import com.stagegate.core.collaborator.PlanApprover;
import com.stagegate.core.collaborator.PlanSource;
import com.stagegate.core.collaborator.ReviewVerdict;
import com.stagegate.core.collaborator.TestRunner;
import com.stagegate.core.config.StageGateProperties;
import com.stagegate.core.store.RecordCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Default collaborators: file-backed memory, console interaction, a shell test runner
 * and the reviewer selected by {@code stagegate.reviewer.mode}.
 */
@Configuration
public class SandboxConfig {

    private static final Logger log = LoggerFactory.getLogger(SandboxConfig.class);

    @Bean
    @ConditionalOnMissingBean
    public ConsolePrompt consolePrompt() {
        return new ConsolePrompt(System.in, System.out);
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyValueStore keyValueStore(StageGateProperties properties, RecordCodec codec) {
        return new FileKeyValueStore(Path.of(properties.getRunRoot()).resolve("memory.json"), codec.mapper());
    }

    @Bean
    @ConditionalOnMissingBean
    public LivenessTimer livenessTimer() {
        return new ScheduledLivenessTimer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TestRunner testRunner(StageGateProperties properties) {
        return new CommandTestRunner(properties.getTestRunner().getCommand(),
                properties.getTestRunner().getTimeout(), Path.of("."));
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanSource planSource(RecordCodec codec, StageGateProperties properties) {
        return new FilePlanSource(codec, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public PlanApprover planApprover(ConsolePrompt prompt, StageGateProperties properties) {
        return new ConsolePlanApprover(prompt, properties);
    }

    @Bean
    @ConditionalOnMissingBean(ExternalReviewer.class)
    @ConditionalOnProperty(name = "stagegate.reviewer.mode", havingValue = "console", matchIfMissing = true)
    public ExternalReviewer consoleExternalReviewer(ConsolePrompt prompt) {
        return new ConsoleExternalReviewer(prompt);
    }

    @Bean
    @ConditionalOnMissingBean(ExternalReviewer.class)
    @ConditionalOnProperty(name = "stagegate.reviewer.mode", havingValue = "http")
    public ExternalReviewer httpExternalReviewer(StageGateProperties properties, RecordCodec codec) {
        return new HttpExternalReviewer(properties.getReviewer().getUrl(), codec.mapper());
    }

    @Bean
    @ConditionalOnMissingBean(ExternalReviewer.class)
    @ConditionalOnProperty(name = "stagegate.reviewer.mode", havingValue = "approve")
    public ExternalReviewer approvingExternalReviewer() {
        log.warn("External reviewer set to approve everything; DISRUPT and VALIDATE are not independently reviewed");
        return evidencePackage -> ReviewVerdict.approve();
    }
}
