package com.skynet.exception;

import com.skynet.entity.User;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.NoHandlerFoundException;

import java.net.URI;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Global exception handler for REST API endpoints.
 *
 * Converts exceptions into RFC 7807 (Problem Details for HTTP APIs) responses:
 * <pre>
 * {
 *   "type": "https://api.skynet.dev/errors/invalid-code",
 *   "title": "Invalid OTP",
 *   "status": 400,
 *   "detail": "Invalid OTP",
 *   "instance": "/auth/verify-otp",
 *   "timestamp": "2024-02-26T10:30:00",
 *   "errorCode": "INVALID_CODE"
 * }
 * </pre>
 *
 * <p>Handled Exception Categories:
 * <ul>
 *   <li>Account lifecycle failures: status taken from {@link AccountError}</li>
 *   <li>Authentication errors (401): missing or invalid bearer token</li>
 *   <li>Validation errors (400): invalid request body, rejected uploads</li>
 *   <li>Not found errors (404): unknown endpoints, foreign or missing documents</li>
 *   <li>Upstream errors (503): object storage unavailable</li>
 *   <li>Server errors (500): unexpected internal errors, detail never exposed</li>
 * </ul>
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7807">RFC 7807 Specification</a>
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    private static final String BASE_ERROR_URI = "https://api.skynet.dev/errors";
    private static final DateTimeFormatter TIMESTAMP_FORMATTER = DateTimeFormatter.ISO_DATE_TIME;
    private static final Set<String> ACCOUNT_IDENTITY_CONSTRAINTS = Set.of(
            User.EMAIL_CONSTRAINT,
            User.USERNAME_CONSTRAINT
    );

    /**
     * Handles AccountException - an expected account lifecycle failure.
     *
     * The HTTP status and message come from the carried {@link AccountError}.
     *
     * @param ex the AccountException
     * @param request the web request context
     * @return RFC 7807 problem details with the error kind's status
     */
    @ExceptionHandler(AccountException.class)
    public ResponseEntity<ProblemDetail> handleAccountException(
            AccountException ex,
            WebRequest request
    ) {
        AccountError error = ex.getError();
        log.warn("Account operation rejected: {} ({})", error, error.getStatus().value());

        ProblemDetail problemDetail = createProblemDetail(
                error.getStatus(),
                error.getMessage(),
                error.getMessage(),
                request,
                error.getTypeSlug()
        );
        problemDetail.setProperty("errorCode", error.name());

        return ResponseEntity.status(error.getStatus()).body(problemDetail);
    }

    /**
     * Handles StorageException - object storage unavailable or failing.
     *
     * Mapped to HTTP 503 Service Unavailable. Object keys and causes stay in the log.
     */
    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(
            StorageException ex,
            WebRequest request
    ) {
        log.error("Storage operation failed: operation={}, key={}, message={}",
                ex.getOperation(), ex.getObjectKey(), ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.SERVICE_UNAVAILABLE,
                "Storage Unavailable",
                "The document storage service is currently unavailable. Please try again later.",
                request,
                "storage-unavailable"
        );
        problemDetail.setProperty("operation", ex.getOperation());

        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(problemDetail);
    }

    @ExceptionHandler(DocumentNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleDocumentNotFoundException(
            DocumentNotFoundException ex,
            WebRequest request
    ) {
        log.warn("Document lookup failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Document Not Found",
                "Document not found",
                request,
                "document-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    @ExceptionHandler(InvalidDocumentException.class)
    public ResponseEntity<ProblemDetail> handleInvalidDocumentException(
            InvalidDocumentException ex,
            WebRequest request
    ) {
        log.warn("Upload rejected: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Document",
                ex.getMessage(),
                request,
                "invalid-document"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles MaxUploadSizeExceededException - multipart limit hit before the controller ran.
     */
    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ProblemDetail> handleMaxUploadSizeExceededException(
            MaxUploadSizeExceededException ex,
            WebRequest request
    ) {
        log.warn("Upload exceeded multipart limit: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Document",
                "File is too large (Max 10MB)",
                request,
                "invalid-document"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ProblemDetail> handleMissingServletRequestPartException(
            MissingServletRequestPartException ex,
            WebRequest request
    ) {
        log.warn("Multipart request missing part: {}", ex.getRequestPartName());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                String.format("Required part '%s' is missing.", ex.getRequestPartName()),
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    /**
     * Handles DataIntegrityViolationException.
     *
     * A concurrent signup that lost the race on the email or username constraint is
     * reported like the explicit duplicate check. Any other violation is unexpected.
     */
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ProblemDetail> handleDataIntegrityViolationException(
            DataIntegrityViolationException ex,
            WebRequest request
    ) {
        String constraintName = violatedConstraint(ex);
        if (constraintName == null || !ACCOUNT_IDENTITY_CONSTRAINTS.contains(constraintName)) {
            return handleUnhandledException(ex, request);
        }

        log.warn("Signup lost the race on constraint {}", constraintName);

        AccountError error = AccountError.CONFLICT;
        ProblemDetail problemDetail = createProblemDetail(
                error.getStatus(),
                error.getMessage(),
                error.getMessage(),
                request,
                error.getTypeSlug()
        );
        problemDetail.setProperty("errorCode", error.name());

        return ResponseEntity.status(error.getStatus()).body(problemDetail);
    }

    /**
     * Handles AccessDeniedException - Spring Security access denial.
     *
     * Mapped to HTTP 401 Unauthorized.
     */
    @ExceptionHandler(AccessDeniedException.class)
    public ResponseEntity<ProblemDetail> handleAccessDeniedException(
            AccessDeniedException ex,
            WebRequest request
    ) {
        log.warn("Access denied: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.UNAUTHORIZED,
                "Authentication Required",
                "You must be authenticated to access this resource. Please provide a valid bearer token.",
                request,
                "authentication-required"
        );

        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(problemDetail);
    }

    /**
     * Handles MethodArgumentNotValidException - bean validation failures.
     *
     * Mapped to HTTP 400 Bad Request with a field-to-message map under {@code errors}.
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationException(
            MethodArgumentNotValidException ex,
            WebRequest request
    ) {
        log.warn("Request validation failed: {} field error(s)", ex.getBindingResult().getFieldErrorCount());

        Map<String, String> validationErrors = new HashMap<>();
        ex.getBindingResult().getFieldErrors().forEach(error ->
                validationErrors.put(error.getField(), error.getDefaultMessage()));

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Validation Failed",
                "Request validation failed. Please check the 'errors' property for details.",
                request,
                "validation-failed"
        );

        problemDetail.setProperty("errors", validationErrors);

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleHttpMessageNotReadableException(
            HttpMessageNotReadableException ex,
            WebRequest request
    ) {
        log.warn("Request body parsing failed: {}", ex.getMessage());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.BAD_REQUEST,
                "Invalid Request Body",
                "The request body is malformed or contains invalid JSON. Please check your request format.",
                request,
                "invalid-request-body"
        );

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(problemDetail);
    }

    @ExceptionHandler(NoHandlerFoundException.class)
    public ResponseEntity<ProblemDetail> handleNoHandlerFoundException(
            NoHandlerFoundException ex,
            WebRequest request
    ) {
        log.warn("Endpoint not found: {} {}", ex.getHttpMethod(), ex.getRequestURL());

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.NOT_FOUND,
                "Endpoint Not Found",
                String.format("The requested endpoint '%s %s' does not exist.",
                        ex.getHttpMethod(), ex.getRequestURL()),
                request,
                "endpoint-not-found"
        );

        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(problemDetail);
    }

    /**
     * Fallback handler for all unhandled exceptions.
     *
     * Database or other collaborator outages end up here. The full stack trace is
     * logged under a generated error id; the client only sees the id.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnhandledException(
            Exception ex,
            WebRequest request
    ) {
        String errorId = generateErrorId();
        log.error("Unexpected error occurred [{}]: {}", errorId, ex.getMessage(), ex);

        ProblemDetail problemDetail = createProblemDetail(
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "An unexpected error occurred. Please try again later or contact support if the issue persists.",
                request,
                "internal-error"
        );
        problemDetail.setProperty("errorId", errorId);

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(problemDetail);
    }

    private ProblemDetail createProblemDetail(
            HttpStatus status,
            String title,
            String detail,
            WebRequest request,
            String errorType
    ) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);

        problemDetail.setType(URI.create(String.format("%s/%s", BASE_ERROR_URI, errorType)));
        problemDetail.setTitle(title);

        String description = request.getDescription(false);
        if (description != null && description.startsWith("uri=")) {
            problemDetail.setInstance(URI.create(description.substring(4)));
        }

        problemDetail.setProperty("timestamp", LocalDateTime.now().format(TIMESTAMP_FORMATTER));

        return problemDetail;
    }

    private static String violatedConstraint(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) {
                String name = ((ConstraintViolationException) cause).getConstraintName();
                if (name != null) {
                    return name.toLowerCase(Locale.ROOT);
                }
            }
        }
        return null;
    }

    private String generateErrorId() {
        return String.format("ERR-%d", System.currentTimeMillis());
    }
}
