package com.venturegate.gate;

import com.venturegate.evidence.EvidenceStrength;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class GateEvaluatorConfiguration {

    /**
     * Experiment count, one minimum per strength bucket, then the named metric thresholds.
     * Reason order follows this list.
     */
    @Bean
    public GateEvaluator gateEvaluator() {
        return new GateEvaluator(List.of(
            new ExperimentCountCriterion(),
            new StrengthMinimumCriterion(EvidenceStrength.WEAK),
            new StrengthMinimumCriterion(EvidenceStrength.MEDIUM),
            new StrengthMinimumCriterion(EvidenceStrength.STRONG),
            new MetricThresholdCriterion()
        ));
    }
}
