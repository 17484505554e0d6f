package com.venturegate.approval;

import com.venturegate.orchestrator.OrchestratorNotifier;
import com.venturegate.policy.Gate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.sql.Connection;
import java.sql.Statement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the JDBC store against an embedded H2 database created fresh for each test.
 */
class JdbcApprovalStoreTest {

    private static final Instant CREATED = Instant.parse("2026-03-15T12:00:00.123Z");
    private static final Instant DECIDED = Instant.parse("2026-03-15T13:30:00.456Z");

    private EmbeddedDatabase database;
    private JdbcApprovalStore store;

    @BeforeEach
    void setUp() throws Exception {
        database = new EmbeddedDatabaseBuilder()
            .setType(EmbeddedDatabaseType.H2)
            .generateUniqueName(true)
            .build();
        store = new JdbcApprovalStore(database);
        store.createTables();
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    @Test
    void insertedRequestReadsBackUnchanged() {
        ApprovalRequest request = pending("req-1", CREATED, new GateSnapshot(Gate.VIABILITY, false,
            List.of("insufficient_experiments", "metric_unverified:ltv_cac_ratio")));

        store.insert(request);

        assertEquals(request, store.findById("req-1").orElseThrow());
    }

    @Test
    void requestWithoutSnapshotReadsBackWithoutOne() {
        ApprovalRequest request = pending("req-2", CREATED, null);

        store.insert(request);

        ApprovalRequest loaded = store.findById("req-2").orElseThrow();
        assertNull(loaded.gateEvaluation());
        assertEquals(List.of("admin", "senior_consultant"), loaded.overrideRoles());
    }

    @Test
    void missingRequestIsEmpty() {
        assertTrue(store.findById("nope").isEmpty());
    }

    @Test
    void conditionalDecisionAppliesOnlyOnce() {
        store.insert(pending("req-3", CREATED, null));

        assertTrue(store.decideIfPending("req-3", ApprovalStatus.APPROVED, "approved", "fine", "founder-1", DECIDED,
            decisionEntry("req-3", "founder-1", "approved")));
        assertFalse(store.decideIfPending("req-3", ApprovalStatus.REJECTED, "rejected", "late", "other", Instant.now(),
            decisionEntry("req-3", "other", "rejected")));

        ApprovalRequest stored = store.findById("req-3").orElseThrow();
        assertEquals(ApprovalStatus.APPROVED, stored.status());
        assertEquals("approved", stored.decision());
        assertEquals("fine", stored.feedback());
        assertEquals("founder-1", stored.decidedBy());
        assertEquals(DECIDED, stored.decidedAt());
        assertEquals(List.of("approved"), store.history("req-3").stream().map(ApprovalHistoryEntry::action).toList());
    }

    @Test
    void decidingAMissingRequestReportsFalse() {
        assertFalse(store.decideIfPending("ghost", ApprovalStatus.APPROVED, "approved", null, "a", DECIDED,
            decisionEntry("ghost", "a", "approved")));
        assertTrue(store.history("ghost").isEmpty());
    }

    @Test
    void failedHistoryWriteLeavesTheRequestPending() throws Exception {
        store.insert(pending("req-5", CREATED, null));
        dropHistoryTable();

        assertThrows(ApprovalStoreException.class, () -> store.decideIfPending("req-5", ApprovalStatus.APPROVED,
            "approved", "fine", "founder-1", DECIDED, decisionEntry("req-5", "founder-1", "approved")));

        ApprovalRequest stored = store.findById("req-5").orElseThrow();
        assertEquals(ApprovalStatus.PENDING, stored.status());
        assertNull(stored.decision());
        assertNull(stored.decidedAt());

        // Once history can be written again the same decision goes through.
        store.createTables();
        assertTrue(store.decideIfPending("req-5", ApprovalStatus.APPROVED, "approved", "fine", "founder-1", DECIDED,
            decisionEntry("req-5", "founder-1", "approved")));
        assertEquals(List.of("approved"), store.history("req-5").stream().map(ApprovalHistoryEntry::action).toList());
    }

    @Test
    void coordinatorRetriesCleanlyAfterAFailedHistoryWrite() throws Exception {
        OrchestratorNotifier notifier = mock(OrchestratorNotifier.class);
        ApprovalCoordinator coordinator = new ApprovalCoordinator(store, new ActorDirectory(new ActorProperties()),
            notifier, Clock.fixed(DECIDED, ZoneOffset.UTC));
        ApprovalRequest request = coordinator.open(new OpenApprovalCommand(ApprovalType.GATE_PROGRESSION,
            "founder-1", "proj-1", "exec-9", "task-9", "Desirability gate progression", "All criteria met",
            new GateSnapshot(Gate.DESIRABILITY, true, List.of()), List.of("admin")));

        // 1. History is unavailable: the decision fails as a whole
        dropHistoryTable();
        assertThrows(ApprovalStoreException.class,
            () -> coordinator.decide(request.id(), "founder-1", new DecisionRequest("approve", null, "ship it")));
        assertEquals(ApprovalStatus.PENDING, store.findById(request.id()).orElseThrow().status());
        verify(notifier, never()).notifyResume(any());

        // 2. Retry is a fresh decision, not a conflict
        store.createTables();
        DecisionOutcome outcome =
            coordinator.decide(request.id(), "founder-1", new DecisionRequest("approve", null, "ship it"));

        assertEquals(ApprovalStatus.APPROVED, outcome.request().status());
        assertEquals(List.of("approved"),
            store.history(request.id()).stream().map(ApprovalHistoryEntry::action).toList());
        verify(notifier, times(1)).notifyResume(any());
    }

    @Test
    void findAllIsNewestFirstAndFiltersByStatus() {
        store.insert(pending("old", CREATED, null));
        store.insert(pending("new", CREATED.plusSeconds(60), null));
        store.decideIfPending("old", ApprovalStatus.REJECTED, "rejected", null, "founder-1", DECIDED,
            decisionEntry("old", "founder-1", "rejected"));

        assertEquals(List.of("new", "old"), store.findAll(null).stream().map(ApprovalRequest::id).toList());
        assertEquals(List.of("new"),
            store.findAll(ApprovalStatus.PENDING).stream().map(ApprovalRequest::id).toList());
        assertEquals(List.of("old"),
            store.findAll(ApprovalStatus.REJECTED).stream().map(ApprovalRequest::id).toList());
    }

    @Test
    void historyIsAppendedInOrder() {
        store.insert(pending("req-4", CREATED, null));
        store.appendHistory(new ApprovalHistoryEntry("req-4", "system", ActorType.SYSTEM,
            ApprovalHistoryEntry.CREATED, Map.of("approvalType", "gate_progression"), CREATED));
        store.appendHistory(new ApprovalHistoryEntry("req-4", "founder-1", ActorType.USER,
            "approved", Map.of("decision", "approved", "override", true), DECIDED));

        List<ApprovalHistoryEntry> history = store.history("req-4");

        assertEquals(2, history.size());
        assertEquals(ApprovalHistoryEntry.CREATED, history.get(0).action());
        assertEquals(ActorType.USER, history.get(1).actorType());
        assertEquals(Map.of("decision", "approved", "override", true), history.get(1).details());
        assertEquals(DECIDED, history.get(1).timestamp());
        assertTrue(store.history("other").isEmpty());
    }

    private void dropHistoryTable() throws Exception {
        try (Connection conn = database.getConnection(); Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE approval_history");
        }
    }

    private static ApprovalHistoryEntry decisionEntry(String approvalId, String actorId, String action) {
        return new ApprovalHistoryEntry(approvalId, actorId, ActorType.USER, action, Map.of("decision", action),
            DECIDED);
    }

    private static ApprovalRequest pending(String id, Instant createdAt, GateSnapshot snapshot) {
        return new ApprovalRequest(id, ApprovalType.GATE_PROGRESSION, "founder-1", "proj-1", "exec-1", "task-1",
            "Viability gate progression", "Automatic criteria not met", ApprovalStatus.PENDING, snapshot,
            List.of("admin", "senior_consultant"), null, null, null, createdAt, null);
    }
}
