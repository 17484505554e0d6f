package com.venturegate.boundary;

import com.venturegate.evidence.Evidence;
import com.venturegate.evidence.ValidationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Validates raw rows from the row source and normalizes them into {@link Evidence} and
 * {@link ValidationState} before anything downstream touches them.
 * <p>
 * Open mode drops malformed rows and keeps the rest; issues are logged only for a sampled
 * fraction of batches and capped at {@link BoundaryValidationPolicy#maxLoggedIssues()}.
 * Closed mode (or the strict flag) turns any issue into a {@link BoundaryValidationException}
 * for the whole batch.
 */
@Component
public class EvidenceBoundaryValidator {

    private static final Logger log = LoggerFactory.getLogger(EvidenceBoundaryValidator.class);

    private final EvidenceRowMapper evidenceMapper;
    private final ValidationStateRowMapper stateMapper;
    private final DoubleSupplier sampler;

    @Autowired
    public EvidenceBoundaryValidator(Clock clock) {
        this(clock, () -> ThreadLocalRandom.current().nextDouble());
    }

    public EvidenceBoundaryValidator(Clock clock, DoubleSupplier sampler) {
        this.evidenceMapper = new EvidenceRowMapper(clock);
        this.stateMapper = new ValidationStateRowMapper(clock);
        this.sampler = sampler;
    }

    public List<Evidence> parseEvidenceRows(List<Map<String, Object>> rows, BoundaryValidationPolicy policy) {
        return parseEvidenceRows(rows, policy, BoundaryParseMemo.disabled());
    }

    public List<Evidence> parseEvidenceRows(List<Map<String, Object>> rows, BoundaryValidationPolicy policy,
                                            BoundaryParseMemo memo) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        return memo.computeIfAbsent(EntityKind.EVIDENCE, rows, policy,
            () -> parse(EntityKind.EVIDENCE, rows, policy, evidenceMapper::read));
    }

    public List<ValidationState> parseValidationStateRows(List<Map<String, Object>> rows,
                                                          BoundaryValidationPolicy policy) {
        return parseValidationStateRows(rows, policy, BoundaryParseMemo.disabled());
    }

    public List<ValidationState> parseValidationStateRows(List<Map<String, Object>> rows,
                                                          BoundaryValidationPolicy policy,
                                                          BoundaryParseMemo memo) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        return memo.computeIfAbsent(EntityKind.VALIDATION_STATE, rows, policy,
            () -> parse(EntityKind.VALIDATION_STATE, rows, policy, stateMapper::read));
    }

    public ParsedSources parseSources(List<Map<String, Object>> userRows,
                                      List<Map<String, Object>> automatedRows,
                                      BoundaryValidationPolicy policy,
                                      BoundaryParseMemo memo) {
        return new ParsedSources(
            parseEvidenceRows(userRows, policy, memo),
            parseValidationStateRows(automatedRows, policy, memo)
        );
    }

    private <T> List<T> parse(EntityKind kind, List<Map<String, Object>> rows, BoundaryValidationPolicy policy,
                              RowParser<T> parser) {
        List<T> parsed = new ArrayList<>(rows.size());
        List<BoundaryIssue> issues = new ArrayList<>();

        for (int index = 0; index < rows.size(); index++) {
            Map<String, Object> row = rows.get(index);
            if (row == null) {
                issues.add(new BoundaryIssue(kind.getTable() + "." + index, BoundaryIssue.INVALID_TYPE,
                    "row must be an object"));
                continue;
            }
            parser.read(row, index, issues).ifPresent(parsed::add);
        }

        if (!issues.isEmpty()) {
            logIssues(kind, policy, issues);
            if (policy.failClosed()) {
                throw new BoundaryValidationException(kind, issues);
            }
        }
        return List.copyOf(parsed);
    }

    private void logIssues(EntityKind kind, BoundaryValidationPolicy policy, List<BoundaryIssue> issues) {
        if (!shouldSample(policy.sampleRate())) {
            return;
        }
        List<BoundaryIssue> sample = issues.subList(0, Math.min(issues.size(), policy.maxLoggedIssues()));
        log.warn("Boundary validation issues source={} schemaVersion={} table={} issueCount={} issues={}",
            policy.source(), kind.getSchemaVersion(), kind.getTable(), issues.size(), sample);
    }

    private boolean shouldSample(double rate) {
        if (rate <= 0) {
            return false;
        }
        if (rate >= 1) {
            return true;
        }
        return sampler.getAsDouble() < rate;
    }

    @FunctionalInterface
    private interface RowParser<T> {
        Optional<T> read(Map<String, Object> row, int index, List<BoundaryIssue> issues);
    }

    public record ParsedSources(List<Evidence> userEvidence, List<ValidationState> automatedStates) {}
}
