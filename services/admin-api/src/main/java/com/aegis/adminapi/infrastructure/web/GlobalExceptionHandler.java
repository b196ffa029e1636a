package com.aegis.adminapi.infrastructure.web;

import com.aegis.adminapi.domain.DuplicateResourceException;
import com.aegis.adminapi.domain.InactiveTenantException;
import com.aegis.observability.CorrelationContextHolder;
import com.aegis.security.AuthorizationEvaluationException;
import com.aegis.security.InvalidPermissionConfigurationException;
import com.aegis.security.PermissionDeniedException;
import com.aegis.security.PrincipalCodec;
import com.aegis.security.ResourceNotFoundException;
import com.aegis.security.TenantContextMissingException;
import com.aegis.security.TenantInactiveException;
import com.aegis.security.TenantMismatchException;
import com.aegis.security.UnauthenticatedException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://aegis.dev/errors/forbidden",
 *   "title": "Forbidden",
 *   "status": 403,
 *   "detail": "Permission denied for operation 'GET /api/v1/tenants': read on tenant:* (...)",
 *   "timestamp": "2026-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authorization configuration errors are server faults and never leak their detail to the
 * client.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_BASE = "https://aegis.dev/errors/";

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleUnreadableRequest(Exception ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "Malformed request: " + ex.getMessage());
    }

    @ExceptionHandler(TenantContextMissingException.class)
    public ProblemDetail handleTenantMissing(TenantContextMissingException ex) {
        log.warn("Tenant context missing for {}", ex.operationId());
        return problem(HttpStatus.BAD_REQUEST, "Tenant Required", "tenant-required",
                "A tenant id is required for this operation");
    }

    @ExceptionHandler(InvalidTenantIdException.class)
    public ProblemDetail handleInvalidTenantId(InvalidTenantIdException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Invalid Tenant", "invalid-tenant", ex.getMessage());
    }

    @ExceptionHandler(UnauthenticatedException.class)
    public ProblemDetail handleUnauthenticated(UnauthenticatedException ex) {
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized",
                "Authentication required");
    }

    @ExceptionHandler(PrincipalCodec.PrincipalCodecException.class)
    public ProblemDetail handleMalformedPrincipal(PrincipalCodec.PrincipalCodecException ex) {
        log.warn("Rejected malformed principal header: {}", ex.getMessage());
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized",
                "Malformed principal");
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ProblemDetail handlePermissionDenied(PermissionDeniedException ex) {
        ProblemDetail problem =
                problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
        problem.setProperty("action", ex.action());
        problem.setProperty("resource", ex.resource());
        return problem;
    }

    @ExceptionHandler(TenantMismatchException.class)
    public ProblemDetail handleTenantMismatch(TenantMismatchException ex) {
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "tenant-mismatch",
                "Principal cannot act in the requested tenant");
    }

    @ExceptionHandler(TenantInactiveException.class)
    public ProblemDetail handleTenantInactive(TenantInactiveException ex) {
        return problem(HttpStatus.FORBIDDEN, "Tenant Inactive", "tenant-inactive",
                "The requested tenant is not active");
    }

    @ExceptionHandler({ResourceNotFoundException.class, NoResourceFoundException.class})
    public ProblemDetail handleNotFound(Exception ex) {
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ProblemDetail handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        return problem(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", "method-not-allowed",
                ex.getMessage());
    }

    @ExceptionHandler({DuplicateResourceException.class, InactiveTenantException.class})
    public ProblemDetail handleConflict(RuntimeException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict", ex.getMessage());
    }

    @ExceptionHandler(DuplicateKeyException.class)
    public ProblemDetail handleDuplicateKey(DuplicateKeyException ex) {
        log.warn("Unique constraint violated: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "Conflict", "conflict",
                "A resource with the same unique value already exists");
    }

    @ExceptionHandler(InvalidPermissionConfigurationException.class)
    public ProblemDetail handleInvalidConfiguration(InvalidPermissionConfigurationException ex) {
        log.error("Authorization misconfigured", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    @ExceptionHandler(AuthorizationEvaluationException.class)
    public ProblemDetail handleEvaluationFailure(AuthorizationEvaluationException ex) {
        log.error("Authorization evaluation failed", ex);
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable",
                "authorization-unavailable", "Authorization could not be evaluated");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ProblemDetail problem(
            HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
