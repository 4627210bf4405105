package com.cnfkit.server;

import com.cnfkit.analyzer.core.GrammarSession;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class SessionConfiguration {

    @Bean
    GrammarSession grammarSession(AnalyzerProperties properties) {
        GrammarSession.Config config = new GrammarSession.Config();
        config.maxTokens = properties.maxTokens();
        config.maxDepth = properties.maxDepth();
        config.count = properties.count();
        config.attempts = properties.attempts();
        config.maxGeneratedChars = properties.maxGeneratedChars();
        config.maxGeneratedTokens = properties.maxGeneratedTokens();
        if (properties.seed() != null) {
            config.random = new Random(properties.seed());
        }
        return new GrammarSession(config);
    }
}
