package com.ivamare.auditstore.web;

import com.ivamare.auditstore.exception.AggregationException;
import com.ivamare.auditstore.exception.PartitionMissingException;
import com.ivamare.auditstore.exception.ReferentialIntegrityException;
import com.ivamare.auditstore.exception.ValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.util.List;

/**
 * Maps audit store exceptions to RFC 7807 problem details.
 */
@RestControllerAdvice(assignableTypes = {AuditEventController.class, SuccessRateController.class})
public class AuditStoreExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AuditStoreExceptionHandler.class);

    static final String TYPE_BASE = "https://ivamare.com/problems/audit-store/";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(ValidationException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation-error", "Validation Error",
            ex.getMessage(), request);
        problem.setProperty("violations", ex.getViolations());
        return respond(problem);
    }

    @ExceptionHandler(ReferentialIntegrityException.class)
    public ResponseEntity<ProblemDetail> handleReferentialIntegrity(
            ReferentialIntegrityException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "parent-not-found", "Parent Event Not Found",
            ex.getMessage(), request);
        problem.setProperty("parent_event_id", String.valueOf(ex.getParentEventId()));
        return respond(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.debug("Malformed request body on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(problem(HttpStatus.BAD_REQUEST, "malformed-request", "Malformed Request",
            "Request body is not valid JSON for this endpoint", request));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ProblemDetail> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation-error", "Validation Error",
            ex.getParameterName() + " is required", request);
        problem.setProperty("violations", List.of(ex.getParameterName() + " is required"));
        return respond(problem);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ProblemDetail> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        String detail = String.format("Invalid value '%s' for parameter '%s'", ex.getValue(), ex.getName());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation-error", "Validation Error",
            detail, request);
        problem.setProperty("violations", List.of(detail));
        return respond(problem);
    }

    @ExceptionHandler(PartitionMissingException.class)
    public ResponseEntity<ProblemDetail> handlePartitionMissing(
            PartitionMissingException ex, HttpServletRequest request) {
        ProblemDetail problem = problem(HttpStatus.INTERNAL_SERVER_ERROR, "partition-missing", "Partition Missing",
            ex.getMessage(), request);
        problem.setProperty("partition", ex.getPartition().toString());
        return respond(problem);
    }

    @ExceptionHandler(AggregationException.class)
    public ResponseEntity<ProblemDetail> handleAggregation(AggregationException ex, HttpServletRequest request) {
        return respond(problem(HttpStatus.INTERNAL_SERVER_ERROR, "aggregation-error", "Aggregation Error",
            "Success rate could not be computed", request));
    }

    private static ProblemDetail problem(HttpStatus status, String type, String title, String detail,
                                         HttpServletRequest request) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(TYPE_BASE + type));
        problem.setTitle(title);
        problem.setInstance(URI.create(request.getRequestURI()));
        return problem;
    }

    private static ResponseEntity<ProblemDetail> respond(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus()).body(problem);
    }
}
