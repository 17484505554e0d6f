package com.venturegate.evidence;

import java.util.List;
import java.util.Map;

/**
 * Opaque source of raw, untrusted rows keyed by the persistence layer's column names
 * ({@code project_id}, {@code created_at}, ...). Rows are only ever read here; the
 * boundary validator owns the translation into {@link Evidence} and {@link ValidationState}.
 */
public interface EvidenceRowSource {

    List<Map<String, Object>> evidenceRows(String projectId);

    List<Map<String, Object>> validationStateRows(String projectId);
}
