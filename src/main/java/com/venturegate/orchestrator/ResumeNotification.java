package com.venturegate.orchestrator;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Body of the one-way resume call. {@code decision} is already in the orchestrator's vocabulary.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ResumeNotification(
    String runId,
    String checkpoint,
    String decision,
    String feedback,
    String decidedBy
) {
}
