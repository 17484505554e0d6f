package com.venturegate.approval;

import java.util.Locale;
import java.util.Map;

/**
 * Maps generic decision labels onto the orchestrator's vocabulary. Labels the table does not
 * know are assumed to be orchestrator-native already and pass through unchanged.
 */
public final class DecisionVocabulary {

    private static final Map<String, String> TO_ORCHESTRATOR = Map.of(
        "approve", "approved",
        "reject", "rejected"
    );

    private DecisionVocabulary() {
    }

    public static String toOrchestrator(String label) {
        if (label == null) {
            return null;
        }
        String trimmed = label.trim();
        return TO_ORCHESTRATOR.getOrDefault(trimmed.toLowerCase(Locale.ROOT), trimmed);
    }
}
