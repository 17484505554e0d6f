package com.venturegate.gate;

import com.venturegate.aggregation.UnifiedEvidenceItem;
import com.venturegate.policy.GatePolicy;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Counts distinct evidence-producing sources rather than items. User evidence is keyed by its
 * {@code evidenceSource} when present, otherwise by its own id; automated items are keyed by the
 * validation state that produced them, so one analysis run yielding three items counts once.
 */
public class ExperimentCountCriterion implements GateCriterion {

    public static final String INSUFFICIENT_EXPERIMENTS = "insufficient_experiments";

    @Override
    public String criterionId() {
        return "experiment-count";
    }

    @Override
    public List<Outcome> evaluate(List<UnifiedEvidenceItem> evidence, GatePolicy policy, Map<String, Double> metrics) {
        if (countExperiments(evidence) >= policy.minExperiments()) {
            return List.of(new Outcome.Met());
        }
        return List.of(new Outcome.Unmet(INSUFFICIENT_EXPERIMENTS));
    }

    public static int countExperiments(List<UnifiedEvidenceItem> evidence) {
        Set<String> sources = new HashSet<>();
        for (UnifiedEvidenceItem item : evidence) {
            sources.add(item.match(
                user -> {
                    String source = user.data().evidenceSource();
                    return source != null && !source.isBlank() ? "user-source:" + source : "user:" + user.id();
                },
                automated -> "state:" + automated.validationStateId()
            ));
        }
        return sources.size();
    }
}
