package com.venturegate.aggregation;

import com.venturegate.boundary.BoundaryParseMemo;
import com.venturegate.boundary.BoundaryProperties;
import com.venturegate.boundary.BoundaryValidationPolicy;
import com.venturegate.boundary.EvidenceBoundaryValidator;
import com.venturegate.evidence.EvidenceRowSource;
import com.venturegate.evidence.ValidationState;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Reads a project's raw rows, validates them at the boundary and hands the normalized
 * entities to the {@link EvidenceAggregator}.
 */
@Service
public class ProjectEvidenceService {

    private final EvidenceRowSource rowSource;
    private final EvidenceBoundaryValidator validator;
    private final BoundaryProperties boundaryProperties;
    private final EvidenceAggregator aggregator;

    public ProjectEvidenceService(EvidenceRowSource rowSource, EvidenceBoundaryValidator validator,
                                  BoundaryProperties boundaryProperties, EvidenceAggregator aggregator) {
        this.rowSource = rowSource;
        this.validator = validator;
        this.boundaryProperties = boundaryProperties;
        this.aggregator = aggregator;
    }

    /** Unified timeline, most recent first. */
    public List<UnifiedEvidenceItem> unifiedEvidence(String projectId, BoundaryParseMemo memo) {
        EvidenceBoundaryValidator.ParsedSources sources = validator.parseSources(
            rowSource.evidenceRows(projectId), rowSource.validationStateRows(projectId), policy(), memo);
        return aggregator.mergeSources(sources.userEvidence(), sources.automatedStates());
    }

    /**
     * Filtered items plus a summary of the project's whole timeline, so counts stay stable while
     * the reader narrows the list.
     */
    public EvidenceTimeline timeline(String projectId, EvidenceFilters filters) {
        List<UnifiedEvidenceItem> all = unifiedEvidence(projectId, BoundaryParseMemo.create());
        List<UnifiedEvidenceItem> items = aggregator.filter(all, filters);
        return new EvidenceTimeline(items, aggregator.summarize(all), aggregator.summarize(items));
    }

    public List<TrendPoint> trend(String projectId) {
        List<Map<String, Object>> rows = rowSource.validationStateRows(projectId);
        List<ValidationState> states = validator.parseValidationStateRows(rows, policy());
        return aggregator.trend(states);
    }

    private BoundaryValidationPolicy policy() {
        return boundaryProperties.toPolicy();
    }
}
