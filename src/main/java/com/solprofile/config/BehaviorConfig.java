package com.solprofile.config;

import com.solprofile.bean.BehaviorAnalysisConfig;
import com.solprofile.service.BehaviorAnalyzer;
import org.springframework.amqp.core.Queue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class BehaviorConfig {

    public static final String BEHAVIOR_QUEUE = "behavior-analysis";

    @Bean
    @ConfigurationProperties(prefix = "behavior")
    public BehaviorAnalysisConfig behaviorAnalysisConfig() {
        return new BehaviorAnalysisConfig();
    }

    /** Stateless, shared by the service and the queue consumer. */
    @Bean
    public BehaviorAnalyzer behaviorAnalyzer(BehaviorAnalysisConfig behaviorAnalysisConfig) {
        return new BehaviorAnalyzer(behaviorAnalysisConfig);
    }

    @Bean
    public Queue behaviorAnalysisQueue() {
        return new Queue(BEHAVIOR_QUEUE, true);
    }
}
