package com.venturegate.approval;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.venturegate.policy.Gate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * JDBC-backed {@link ApprovalStore}. Decisions are a single conditional
 * {@code UPDATE ... WHERE status = 'pending'} committed together with their history row; a losing
 * concurrent writer sees zero rows updated.
 * <p>
 * Both tables are created by {@link #createTables()}. List-valued and structured columns are
 * stored as JSON text.
 */
public class JdbcApprovalStore implements ApprovalStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcApprovalStore.class);

    private static final String REQUESTS_TABLE = "approval_requests";
    private static final String HISTORY_TABLE = "approval_history";

    private static final String CREATE_REQUESTS_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id              VARCHAR(64) PRIMARY KEY,
                approval_type   VARCHAR(64) NOT NULL,
                owner_id        VARCHAR(255) NOT NULL,
                project_id      VARCHAR(255),
                execution_id    VARCHAR(255),
                task_id         VARCHAR(255),
                title           VARCHAR(512),
                description     TEXT,
                status          VARCHAR(32) NOT NULL,
                gate            VARCHAR(32),
                automatic_pass  BOOLEAN,
                gate_reasons    TEXT,
                override_roles  TEXT,
                decision        VARCHAR(255),
                feedback        TEXT,
                decided_by      VARCHAR(255),
                created_at      TIMESTAMP WITH TIME ZONE NOT NULL,
                decided_at      TIMESTAMP WITH TIME ZONE
            )
            """.formatted(REQUESTS_TABLE);

    private static final String CREATE_HISTORY_SQL = """
            CREATE TABLE IF NOT EXISTS %s (
                id           BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,
                approval_id  VARCHAR(64) NOT NULL,
                actor_id     VARCHAR(255) NOT NULL,
                actor_type   VARCHAR(32) NOT NULL,
                action       VARCHAR(64) NOT NULL,
                details      TEXT,
                created_at   TIMESTAMP WITH TIME ZONE NOT NULL
            )
            """.formatted(HISTORY_TABLE);

    private static final String INSERT_SQL = """
            INSERT INTO %s (id, approval_type, owner_id, project_id, execution_id, task_id, title, description,
                            status, gate, automatic_pass, gate_reasons, override_roles, decision, feedback,
                            decided_by, created_at, decided_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(REQUESTS_TABLE);

    private static final String SELECT_COLUMNS = """
            SELECT id, approval_type, owner_id, project_id, execution_id, task_id, title, description,
                   status, gate, automatic_pass, gate_reasons, override_roles, decision, feedback,
                   decided_by, created_at, decided_at
            FROM %s
            """.formatted(REQUESTS_TABLE);

    private static final String SELECT_BY_ID_SQL = SELECT_COLUMNS + " WHERE id = ?";
    private static final String SELECT_ALL_SQL = SELECT_COLUMNS + " ORDER BY created_at DESC";
    private static final String SELECT_BY_STATUS_SQL = SELECT_COLUMNS + " WHERE status = ? ORDER BY created_at DESC";

    private static final String DECIDE_SQL = """
            UPDATE %s
            SET status = ?, decision = ?, feedback = ?, decided_by = ?, decided_at = ?
            WHERE id = ? AND status = 'pending'
            """.formatted(REQUESTS_TABLE);

    private static final String INSERT_HISTORY_SQL = """
            INSERT INTO %s (approval_id, actor_id, actor_type, action, details, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            """.formatted(HISTORY_TABLE);

    private static final String SELECT_HISTORY_SQL = """
            SELECT approval_id, actor_id, actor_type, action, details, created_at
            FROM %s
            WHERE approval_id = ?
            ORDER BY id ASC
            """.formatted(HISTORY_TABLE);

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> DETAILS_MAP = new TypeReference<>() {};

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;

    public JdbcApprovalStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Creates the request and history tables if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement requests = conn.prepareStatement(CREATE_REQUESTS_SQL);
             PreparedStatement history = conn.prepareStatement(CREATE_HISTORY_SQL)) {
            requests.execute();
            history.execute();
            log.info("Approval tables '{}' and '{}' ensured", REQUESTS_TABLE, HISTORY_TABLE);
        }
    }

    @Override
    public ApprovalRequest insert(ApprovalRequest request) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
            GateSnapshot snapshot = request.gateEvaluation();
            stmt.setString(1, request.id());
            stmt.setString(2, request.approvalType().getValue());
            stmt.setString(3, request.ownerId());
            stmt.setString(4, request.projectId());
            stmt.setString(5, request.executionId());
            stmt.setString(6, request.taskId());
            stmt.setString(7, request.title());
            stmt.setString(8, request.description());
            stmt.setString(9, request.status().getValue());
            stmt.setString(10, snapshot == null ? null : snapshot.gate().name());
            if (snapshot == null) {
                stmt.setNull(11, Types.BOOLEAN);
            } else {
                stmt.setBoolean(11, snapshot.automaticPass());
            }
            stmt.setString(12, snapshot == null ? null : toJson(snapshot.reasons()));
            stmt.setString(13, toJson(request.overrideRoles()));
            stmt.setString(14, request.decision());
            stmt.setString(15, request.feedback());
            stmt.setString(16, request.decidedBy());
            setInstant(stmt, 17, request.createdAt());
            setInstant(stmt, 18, request.decidedAt());
            stmt.executeUpdate();
            log.debug("Inserted approval request '{}'", request.id());
            return request;
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to insert approval request " + request.id(), e);
        }
    }

    @Override
    public Optional<ApprovalRequest> findById(String id) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(fromResultSet(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to load approval request " + id, e);
        }
    }

    @Override
    public List<ApprovalRequest> findAll(ApprovalStatus status) {
        String sql = status == null ? SELECT_ALL_SQL : SELECT_BY_STATUS_SQL;
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            if (status != null) {
                stmt.setString(1, status.getValue());
            }
            List<ApprovalRequest> requests = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    requests.add(fromResultSet(rs));
                }
            }
            return requests;
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to list approval requests", e);
        }
    }

    /**
     * Runs the conditional update and the history insert on one connection in one transaction,
     * committing only when the update matched the pending row.
     */
    @Override
    public boolean decideIfPending(String id, ApprovalStatus status, String decision, String feedback,
                                   String decidedBy, Instant decidedAt, ApprovalHistoryEntry decisionEntry) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(DECIDE_SQL)) {
                    stmt.setString(1, status.getValue());
                    stmt.setString(2, decision);
                    stmt.setString(3, feedback);
                    stmt.setString(4, decidedBy);
                    setInstant(stmt, 5, decidedAt);
                    stmt.setString(6, id);
                    updated = stmt.executeUpdate();
                }
                log.debug("Conditional decision on approval request '{}' updated {} row(s)", id, updated);
                if (updated != 1) {
                    conn.rollback();
                    return false;
                }
                insertHistory(conn, decisionEntry);
                conn.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to record decision on approval request " + id, e);
        }
    }

    @Override
    public void appendHistory(ApprovalHistoryEntry entry) {
        try (Connection conn = dataSource.getConnection()) {
            insertHistory(conn, entry);
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to append history for approval request " + entry.approvalId(), e);
        }
    }

    private void insertHistory(Connection conn, ApprovalHistoryEntry entry) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_HISTORY_SQL)) {
            stmt.setString(1, entry.approvalId());
            stmt.setString(2, entry.actorId());
            stmt.setString(3, entry.actorType().getValue());
            stmt.setString(4, entry.action());
            stmt.setString(5, toJson(entry.details()));
            setInstant(stmt, 6, entry.timestamp());
            stmt.executeUpdate();
        }
    }

    @Override
    public List<ApprovalHistoryEntry> history(String approvalId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_HISTORY_SQL)) {
            stmt.setString(1, approvalId);
            List<ApprovalHistoryEntry> entries = new ArrayList<>();
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    entries.add(new ApprovalHistoryEntry(
                        rs.getString("approval_id"),
                        rs.getString("actor_id"),
                        ActorType.fromValue(rs.getString("actor_type")),
                        rs.getString("action"),
                        fromJson(rs.getString("details"), DETAILS_MAP),
                        getInstant(rs, "created_at")
                    ));
                }
            }
            return entries;
        } catch (SQLException e) {
            throw new ApprovalStoreException("Failed to load history for approval request " + approvalId, e);
        }
    }

    private ApprovalRequest fromResultSet(ResultSet rs) throws SQLException {
        String gate = rs.getString("gate");
        GateSnapshot snapshot = null;
        if (gate != null) {
            List<String> reasons = fromJson(rs.getString("gate_reasons"), STRING_LIST);
            snapshot = new GateSnapshot(Gate.parse(gate), rs.getBoolean("automatic_pass"),
                reasons == null ? List.of() : reasons);
        }
        return new ApprovalRequest(
            rs.getString("id"),
            ApprovalType.fromValue(rs.getString("approval_type")),
            rs.getString("owner_id"),
            rs.getString("project_id"),
            rs.getString("execution_id"),
            rs.getString("task_id"),
            rs.getString("title"),
            rs.getString("description"),
            ApprovalStatus.fromValue(rs.getString("status")),
            snapshot,
            fromJson(rs.getString("override_roles"), STRING_LIST),
            rs.getString("decision"),
            rs.getString("feedback"),
            rs.getString("decided_by"),
            getInstant(rs, "created_at"),
            getInstant(rs, "decided_at")
        );
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant instant) throws SQLException {
        if (instant == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, instant.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new ApprovalStoreException("Failed to serialize approval column", e);
        }
    }

    private <T> T fromJson(String json, TypeReference<T> type) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new ApprovalStoreException("Failed to deserialize approval column", e);
        }
    }
}
