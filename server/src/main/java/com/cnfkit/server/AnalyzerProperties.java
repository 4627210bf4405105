package com.cnfkit.server;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Limits applied by the shared {@link com.cnfkit.analyzer.core.GrammarSession}, bound from
 * {@code cnfkit.*}. A {@code seed} makes sentence generation reproducible.
 */
@ConfigurationProperties(prefix = "cnfkit")
public record AnalyzerProperties(
        @DefaultValue("30") int maxTokens,
        @DefaultValue("15") int maxDepth,
        @DefaultValue("10") int count,
        @DefaultValue("50") int attempts,
        @DefaultValue("200") int maxGeneratedChars,
        @DefaultValue("30") int maxGeneratedTokens,
        Long seed) {}
