package com.venturegate.boundary;

import com.venturegate.evidence.DesirabilitySignal;
import com.venturegate.evidence.Evidence;
import com.venturegate.evidence.EvidenceCategory;
import com.venturegate.evidence.EvidenceStrength;
import com.venturegate.evidence.FeasibilitySignal;
import com.venturegate.evidence.FitType;
import com.venturegate.evidence.NarrativeCategory;
import com.venturegate.evidence.ValidationState;
import com.venturegate.evidence.ViabilitySignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class EvidenceBoundaryValidatorTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");

    private EvidenceBoundaryValidator validator;

    @BeforeEach
    void setUp() {
        validator = new EvidenceBoundaryValidator(Clock.fixed(NOW, ZoneOffset.UTC), () -> 0.0);
    }

    @Nested
    @DisplayName("Open mode")
    class OpenMode {

        @Test
        void malformedRowsAreDroppedAndValidRowsKept() {
            Map<String, Object> bad = evidenceRow("ev-2");
            bad.put("strength", "overwhelming");
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"), bad, evidenceRow("ev-3"));

            List<Evidence> parsed = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open());

            assertEquals(List.of("ev-1", "ev-3"), parsed.stream().map(Evidence::id).toList());
        }

        @Test
        void nullRowIsDroppedNotFatal() {
            List<Map<String, Object>> rows = new ArrayList<>();
            rows.add(null);
            rows.add(evidenceRow("ev-1"));

            List<Evidence> parsed = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open());

            assertEquals(1, parsed.size());
        }

        @Test
        void emptyOrNullBatchYieldsEmptyList() {
            assertTrue(validator.parseEvidenceRows(List.of(), BoundaryValidationPolicy.open()).isEmpty());
            assertTrue(validator.parseValidationStateRows(null, BoundaryValidationPolicy.closed()).isEmpty());
        }

        @Test
        void zeroSampleRateNeverConsultsTheSampler() {
            AtomicInteger draws = new AtomicInteger();
            EvidenceBoundaryValidator counting = new EvidenceBoundaryValidator(
                Clock.fixed(NOW, ZoneOffset.UTC), () -> {
                    draws.incrementAndGet();
                    return 0.0;
                });
            Map<String, Object> bad = evidenceRow("ev-1");
            bad.remove("id");

            counting.parseEvidenceRows(List.of(bad), BoundaryValidationPolicy.open().withSampleRate(0));
            counting.parseEvidenceRows(List.of(bad), BoundaryValidationPolicy.open().withSampleRate(1));
            assertEquals(0, draws.get());

            counting.parseEvidenceRows(List.of(bad), BoundaryValidationPolicy.open().withSampleRate(0.5));
            assertEquals(1, draws.get());
        }
    }

    @Nested
    @DisplayName("Closed mode and strict flag")
    class ClosedMode {

        @Test
        void anyMalformedRowAbortsTheBatch() {
            Map<String, Object> bad = evidenceRow("ev-2");
            bad.put("is_contradiction", "yes");
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"), bad);

            BoundaryValidationException ex = assertThrows(BoundaryValidationException.class,
                () -> validator.parseEvidenceRows(rows, BoundaryValidationPolicy.closed()));

            assertEquals(EntityKind.EVIDENCE, ex.getEntityKind());
            assertEquals(1, ex.getIssues().size());
            BoundaryIssue issue = ex.getIssues().get(0);
            assertEquals("evidence.1.is_contradiction", issue.path());
            assertEquals(BoundaryIssue.INVALID_TYPE, issue.code());
        }

        @Test
        void strictForcesClosedBehaviourInOpenMode() {
            Map<String, Object> bad = stateRow("vs-1");
            bad.put("iteration", 0);

            BoundaryValidationException ex = assertThrows(BoundaryValidationException.class,
                () -> validator.parseValidationStateRows(List.of(bad), BoundaryValidationPolicy.open().withStrict(true)));

            assertEquals("validation_states.0.iteration", ex.getIssues().get(0).path());
            assertEquals(BoundaryIssue.TOO_SMALL, ex.getIssues().get(0).code());
        }

        @Test
        void everyIssueOfTheBatchIsReported() {
            Map<String, Object> first = evidenceRow("ev-1");
            first.remove("id");
            Map<String, Object> second = evidenceRow("ev-2");
            second.put("fit_type", "Profitability");
            second.put("tags", List.of("ok", 3));

            BoundaryValidationException ex = assertThrows(BoundaryValidationException.class,
                () -> validator.parseEvidenceRows(List.of(first, second), BoundaryValidationPolicy.closed()));

            assertEquals(List.of("evidence.0.id", "evidence.1.fit_type", "evidence.1.tags"),
                ex.getIssues().stream().map(BoundaryIssue::path).toList());
        }

        @Test
        void validBatchPassesInClosedMode() {
            assertDoesNotThrow(() -> validator.parseEvidenceRows(
                List.of(evidenceRow("ev-1"), evidenceRow("ev-2")), BoundaryValidationPolicy.closed()));
        }
    }

    @Nested
    @DisplayName("Normalization")
    class Normalization {

        @Test
        void missingOrGarbageTimestampsBecomeNowInEveryMode() {
            Map<String, Object> row = evidenceRow("ev-1");
            row.remove("created_at");
            row.put("updated_at", "not-a-date");

            for (BoundaryValidationPolicy policy : List.of(BoundaryValidationPolicy.open(),
                    BoundaryValidationPolicy.closed(), BoundaryValidationPolicy.open().withStrict(true))) {
                Evidence evidence = validator.parseEvidenceRows(List.of(row), policy).get(0);
                assertEquals(NOW, evidence.createdAt());
                assertEquals(NOW, evidence.updatedAt());
            }
        }

        @Test
        void evidenceDefaultsApply() {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", "ev-min");

            Evidence evidence = validator.parseEvidenceRows(List.of(row), BoundaryValidationPolicy.closed()).get(0);

            assertEquals("", evidence.projectId());
            assertEquals("", evidence.content());
            assertFalse(evidence.contradiction());
            assertNull(evidence.strength());
            assertNull(evidence.fitType());
        }

        @Test
        void validationStateDefaultsApply() {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("id", "vs-min");
            row.put("updated_at", null);

            ValidationState state = validator.parseValidationStateRows(List.of(row), BoundaryValidationPolicy.closed()).get(0);

            assertEquals(1, state.iteration());
            assertEquals(DesirabilitySignal.NO_SIGNAL, state.desirabilitySignal());
            assertEquals(FeasibilitySignal.UNKNOWN, state.feasibilitySignal());
            assertEquals(ViabilitySignal.UNKNOWN, state.viabilitySignal());
            assertEquals(NOW, state.updatedAt());
        }

        @Test
        void columnsMapToProperties() {
            Evidence evidence = validator.parseEvidenceRows(List.of(evidenceRow("ev-1")), BoundaryValidationPolicy.closed()).get(0);

            assertEquals("proj-1", evidence.projectId());
            assertEquals(EvidenceCategory.INTERVIEW, evidence.category());
            assertEquals(EvidenceStrength.STRONG, evidence.strength());
            assertEquals(FitType.FEASIBILITY, evidence.fitType());
            assertEquals(NarrativeCategory.SAY, evidence.narrativeCategory());
            assertEquals(List.of("a-1", "a-2"), evidence.linkedAssumptions());
            assertEquals("2025-10-01", evidence.occurredOn());
            assertEquals(Instant.parse("2025-10-02T09:00:00Z"), evidence.createdAt());
        }

        @Test
        void unknownExtraColumnsAreIgnored() {
            Map<String, Object> row = evidenceRow("ev-1");
            row.put("legacy_score", 42);

            assertDoesNotThrow(() -> validator.parseEvidenceRows(List.of(row), BoundaryValidationPolicy.closed()));
        }

        @Test
        void integralDoubleIterationIsAccepted() {
            Map<String, Object> row = stateRow("vs-1");
            row.put("iteration", 4.0);

            ValidationState state = validator.parseValidationStateRows(List.of(row), BoundaryValidationPolicy.closed()).get(0);

            assertEquals(4, state.iteration());
        }
    }

    @Nested
    @DisplayName("Parse memo")
    class Memo {

        @Test
        void sameBatchIsParsedOncePerMemo() {
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"));
            BoundaryParseMemo memo = BoundaryParseMemo.create();

            List<Evidence> cold = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);
            List<Evidence> warm = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);

            assertSame(cold, warm);
            assertEquals(1, memo.hits());
        }

        @Test
        void equalContentInADifferentListIsReparsed() {
            BoundaryParseMemo memo = BoundaryParseMemo.create();

            validator.parseEvidenceRows(List.of(evidenceRow("ev-1")), BoundaryValidationPolicy.open(), memo);
            validator.parseEvidenceRows(List.of(evidenceRow("ev-1")), BoundaryValidationPolicy.open(), memo);

            assertEquals(0, memo.hits());
        }

        @Test
        void differentPolicyIsReparsed() {
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"));
            BoundaryParseMemo memo = BoundaryParseMemo.create();

            validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);
            validator.parseEvidenceRows(rows, BoundaryValidationPolicy.closed(), memo);

            assertEquals(0, memo.hits());
        }

        @Test
        void droppingTheMemoDoesNotChangeResults() {
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"), evidenceRow("ev-2"));
            BoundaryParseMemo memo = BoundaryParseMemo.create();

            List<Evidence> memoized = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);
            memo.clear();
            List<Evidence> again = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);
            List<Evidence> unmemoized = validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open());

            assertEquals(memoized, again);
            assertEquals(memoized, unmemoized);
        }

        @Test
        void disabledMemoNeverHits() {
            List<Map<String, Object>> rows = List.of(evidenceRow("ev-1"));
            BoundaryParseMemo memo = BoundaryParseMemo.disabled();

            validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);
            validator.parseEvidenceRows(rows, BoundaryValidationPolicy.open(), memo);

            assertEquals(0, memo.hits());
        }

        @Test
        void parseSourcesReturnsBothKinds() {
            EvidenceBoundaryValidator.ParsedSources sources = validator.parseSources(
                List.of(evidenceRow("ev-1")), List.of(stateRow("vs-1"), stateRow("vs-2")),
                BoundaryValidationPolicy.open(), BoundaryParseMemo.create());

            assertEquals(1, sources.userEvidence().size());
            assertEquals(2, sources.automatedStates().size());
        }
    }

    // ---- helpers ----

    static Map<String, Object> evidenceRow(String id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("project_id", "proj-1");
        row.put("title", "Customer interview " + id);
        row.put("evidence_category", "Interview");
        row.put("summary", "Summary");
        row.put("content", "Customers asked for bulk export");
        row.put("strength", "strong");
        row.put("is_contradiction", false);
        row.put("fit_type", "Feasibility");
        row.put("source_type", "interview");
        row.put("evidence_source", "interview-round-1");
        row.put("occurred_on", "2025-10-01");
        row.put("linked_assumptions", List.of("a-1", "a-2"));
        row.put("narrative_category", "SAY");
        row.put("tags", List.of("b2b"));
        row.put("created_at", "2025-10-02T09:00:00Z");
        row.put("updated_at", "2025-10-02T09:00:00Z");
        return row;
    }

    static Map<String, Object> stateRow(String id) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", id);
        row.put("project_id", "proj-1");
        row.put("iteration", 2);
        row.put("desirability_signal", "strong_commitment");
        row.put("feasibility_signal", "orange_constrained");
        row.put("viability_signal", "zombie_market");
        row.put("desirability_evidence", Map.of("signups", 120));
        row.put("feasibility_evidence", null);
        row.put("viability_evidence", Map.of("tam", "small"));
        row.put("updated_at", "2025-10-03T10:00:00Z");
        return row;
    }
}
