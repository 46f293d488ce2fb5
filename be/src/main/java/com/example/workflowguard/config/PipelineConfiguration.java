package com.example.workflowguard.config;

import com.example.workflowguard.autofix.AutofixEngine;
import com.example.workflowguard.expression.ExpressionAnalyzer;
import com.example.workflowguard.layout.WorkflowFormatter;
import com.example.workflowguard.patch.NodeIdGenerator;
import com.example.workflowguard.patch.PatchEngine;
import com.example.workflowguard.validation.ParameterText;
import com.example.workflowguard.validation.WorkflowValidator;
import com.example.workflowguard.version.VersionStore;
import com.example.workflowguard.version.VersionStoreProperties;

import tools.jackson.databind.json.JsonMapper;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the edit pipeline engines. They are plain classes so tests can build them directly.
 */
@Configuration
@EnableConfigurationProperties(VersionStoreProperties.class)
public class PipelineConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NodeIdGenerator nodeIdGenerator() {
        return NodeIdGenerator.random();
    }

    @Bean
    public ParameterText parameterText(JsonMapper jsonMapper) {
        return new ParameterText(jsonMapper);
    }

    @Bean
    public WorkflowValidator workflowValidator(ParameterText parameterText) {
        return new WorkflowValidator(parameterText);
    }

    @Bean
    public AutofixEngine autofixEngine(ParameterText parameterText) {
        return new AutofixEngine(parameterText);
    }

    @Bean
    public ExpressionAnalyzer expressionAnalyzer() {
        return new ExpressionAnalyzer();
    }

    @Bean
    public WorkflowFormatter workflowFormatter() {
        return new WorkflowFormatter();
    }

    @Bean
    public PatchEngine patchEngine(NodeIdGenerator nodeIdGenerator) {
        return new PatchEngine(nodeIdGenerator);
    }

    @Bean
    public VersionStore versionStore(VersionStoreProperties properties, JsonMapper jsonMapper, Clock clock) {
        return new VersionStore(properties, jsonMapper, clock);
    }
}
