package com.venturegate.gate;

import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.policy.GatePolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Checks each named threshold against the caller-supplied metric of the same name.
 * A threshold with no supplied metric is reported as unverified and does not fail the gate.
 */
public class MetricThresholdCriterion implements GateCriterion {

    public static final String BELOW_THRESHOLD_PREFIX = "metric_below_threshold:";
    public static final String UNVERIFIED_PREFIX = "metric_unverified:";

    @Override
    public String criterionId() {
        return "metric-thresholds";
    }

    @Override
    public List<Outcome> evaluate(List<UnifiedEvidenceItem> evidence, GatePolicy policy, Map<String, Double> metrics) {
        List<Outcome> outcomes = new ArrayList<>(policy.thresholds().size());
        policy.thresholds().forEach((key, minimum) -> {
            if (!metrics.containsKey(key)) {
                outcomes.add(new Outcome.Unverified(UNVERIFIED_PREFIX + key));
                return;
            }
            Double value = metrics.get(key);
            // NaN compares false, so an unusable value counts as below threshold
            if (value != null && value >= minimum) {
                outcomes.add(new Outcome.Met());
            } else {
                outcomes.add(new Outcome.Unmet(BELOW_THRESHOLD_PREFIX + key));
            }
        });
        return outcomes;
    }
}
