package com.tradepilot.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradepilot.backend.model.Enrichment;
import com.tradepilot.backend.service.broker.BrokerPort;
import com.tradepilot.backend.service.broker.PaperBrokerPort;
import com.tradepilot.backend.service.source.InsiderConvictionSource;
import com.tradepilot.backend.service.source.JsonFileBuyEventFeed;
import com.tradepilot.backend.trading.pipeline.BuyEventFeed;
import com.tradepilot.backend.trading.pipeline.ConvictionScorer;
import com.tradepilot.backend.trading.pipeline.DecisionStage;
import com.tradepilot.backend.trading.pipeline.EnrichmentProvider;
import com.tradepilot.backend.trading.pipeline.TopCandidateDecisionStage;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneId;

/**
 * Default collaborators at the pipeline boundary. Each can be replaced by
 * declaring a bean of the same type.
 */
@Configuration
public class PipelineConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock(StrategyProperties strategyProperties) {
        return Clock.system(ZoneId.of(strategyProperties.getCycle().getTimezone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public EnrichmentProvider enrichmentProvider() {
        return ticker -> Enrichment.empty();
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionStage decisionStage(StrategyProperties strategyProperties) {
        return new TopCandidateDecisionStage(strategyProperties.getDecision().getTargetPositions());
    }

    @Bean
    @ConditionalOnMissingBean(BrokerPort.class)
    @ConditionalOnProperty(name = "broker.mode", havingValue = "paper", matchIfMissing = true)
    public PaperBrokerPort paperBrokerPort(BrokerProperties brokerProperties, Clock clock) {
        return new PaperBrokerPort(brokerProperties, clock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "sources.insider.enabled", havingValue = "true", matchIfMissing = true)
    public BuyEventFeed buyEventFeed(SourceProperties sourceProperties, ObjectMapper objectMapper) {
        return new JsonFileBuyEventFeed(Path.of(sourceProperties.getInsider().getEventsPath()), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = "sources.insider.enabled", havingValue = "true", matchIfMissing = true)
    public InsiderConvictionSource insiderConvictionSource(BuyEventFeed buyEventFeed,
                                                           ConvictionScorer convictionScorer,
                                                           StrategyProperties strategyProperties) {
        return new InsiderConvictionSource(buyEventFeed, convictionScorer, strategyProperties);
    }
}
