package com.venturegate.api;

import com.venturegate.approval.ApprovalAccessDeniedException;
import com.venturegate.approval.ApprovalConflictException;
import com.venturegate.approval.ApprovalNotFoundException;
import com.venturegate.approval.InvalidDecisionException;
import com.venturegate.boundary.BoundaryIssue;
import com.venturegate.boundary.BoundaryValidationException;
import com.venturegate.policy.GatePolicyValidationException;
import com.venturegate.policy.UnknownGateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Unified error response handler.
 *
 * All errors follow the machine-readable format:
 * {
 *   "error_code": "APPROVAL_ALREADY_DECIDED",
 *   "message": "...",
 *   "timestamp": "2026-...",
 *   "details": [...]          // only when there is something itemized to report
 * }
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    /** The rejected rows come from the row source, not from the request, so this is a server error. */
    @ExceptionHandler(BoundaryValidationException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleBoundaryValidation(BoundaryValidationException ex) {
        log.error("Boundary validation failed on stored rows: {}", ex.getMessage());
        List<Map<String, String>> details = ex.getIssues().stream()
            .map(ApiExceptionHandler::issue)
            .toList();
        return errorResponse("BOUNDARY_VALIDATION_FAILED", ex.getMessage(), details);
    }

    @ExceptionHandler(GatePolicyValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handlePolicyValidation(GatePolicyValidationException ex) {
        return errorResponse("POLICY_VALIDATION_FAILED", ex.getMessage(), ex.getViolations());
    }

    @ExceptionHandler(UnknownGateException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleUnknownGate(UnknownGateException ex) {
        return errorResponse("INVALID_GATE", ex.getMessage(), null);
    }

    @ExceptionHandler(InvalidDecisionException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidDecision(InvalidDecisionException ex) {
        return errorResponse("INVALID_DECISION", ex.getMessage(), null);
    }

    @ExceptionHandler(MissingActorException.class)
    @ResponseStatus(HttpStatus.UNAUTHORIZED)
    public Map<String, Object> handleMissingActor(MissingActorException ex) {
        return errorResponse("UNAUTHENTICATED", ex.getMessage(), null);
    }

    @ExceptionHandler(ApprovalAccessDeniedException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Map<String, Object> handleAccessDenied(ApprovalAccessDeniedException ex) {
        return errorResponse("ACCESS_DENIED", ex.getMessage(), null);
    }

    @ExceptionHandler(ApprovalNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(ApprovalNotFoundException ex) {
        return errorResponse("APPROVAL_NOT_FOUND", ex.getMessage(), null);
    }

    @ExceptionHandler(ApprovalConflictException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleConflict(ApprovalConflictException ex) {
        return errorResponse("APPROVAL_ALREADY_DECIDED", ex.getMessage(), null);
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred", null);
    }

    private static Map<String, String> issue(BoundaryIssue issue) {
        Map<String, String> detail = new LinkedHashMap<>();
        detail.put("path", issue.path());
        detail.put("code", issue.code());
        detail.put("message", issue.message());
        return detail;
    }

    private Map<String, Object> errorResponse(String errorCode, String message, Object details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        if (details != null) {
            body.put("details", details);
        }
        return body;
    }
}
