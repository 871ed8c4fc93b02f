package com.libris.catalog.infrastructure.web;

import com.libris.common.error.CatalogException;
import com.libris.common.error.ValidationException;
import com.libris.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <p>Domain failures are matched on their {@link com.libris.common.error.ErrorKind}:
 *
 * <pre>
 * VALIDATION      422  errors: {field: message}
 * AUTHENTICATION  401  WWW-Authenticate: Bearer
 * NOT_FOUND       404
 * CONFLICT        409
 * TIMEOUT/STORAGE 500  logged with stack trace, detail hidden from the client
 * </pre>
 *
 * <p>Every body carries {@code timestamp} and, inside a request, {@code correlationId}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String ERROR_TYPE_BASE = "https://libris.dev/errors/";

    static final String AUTHENTICATION_DETAIL = "invalid or missing authentication token";
    static final String NOT_FOUND_DETAIL = "the requested resource could not be found";
    static final String CONFLICT_DETAIL = "unable to update the record due to an edit conflict, please try again";
    static final String SERVER_ERROR_DETAIL = "the server encountered a problem and could not process your request";

    @ExceptionHandler(CatalogException.class)
    public ResponseEntity<ProblemDetail> handleCatalog(CatalogException ex) {
        return switch (ex.kind()) {
            case VALIDATION -> {
                log.debug("Validation failed: {}", ex.getMessage());
                ProblemDetail problem =
                        problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "validation",
                                "one or more fields failed validation");
                if (ex instanceof ValidationException ve) {
                    problem.setProperty("errors", ve.fieldErrors());
                }
                yield ResponseEntity.unprocessableEntity().body(problem);
            }
            case AUTHENTICATION -> {
                log.debug("Authentication failed: {}", ex.getMessage());
                yield ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                        .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                        .body(problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "authentication",
                                AUTHENTICATION_DETAIL));
            }
            case NOT_FOUND -> {
                log.debug("Not found: {}", ex.getMessage());
                yield ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", NOT_FOUND_DETAIL));
            }
            case CONFLICT -> {
                log.info("Edit conflict: {}", ex.getMessage());
                yield ResponseEntity.status(HttpStatus.CONFLICT)
                        .body(problem(HttpStatus.CONFLICT, "Conflict", "edit-conflict", CONFLICT_DETAIL));
            }
            case TIMEOUT, STORAGE -> {
                log.error("Server fault ({})", ex.kind(), ex);
                yield ResponseEntity.internalServerError().body(serverError());
            }
        };
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Malformed request body: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "the request body is malformed");
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ProblemDetail handleMediaType(HttpMediaTypeNotSupportedException ex) {
        return problem(HttpStatus.UNSUPPORTED_MEDIA_TYPE, "Unsupported Media Type", "bad-request",
                "the request body must be application/json");
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ProblemDetail handleMissingParameter(MissingServletRequestParameterException ex) {
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request",
                "missing parameter " + ex.getParameterName());
    }

    /** A non-numeric path id names no resource; any other unconvertible parameter is a bad request. */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        if (ex.getParameter().hasParameterAnnotation(PathVariable.class)) {
            return handleNotFound(ex);
        }
        log.debug("Unconvertible parameter {}: {}", ex.getName(), ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "invalid value for " + ex.getName());
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNotFound(Exception ex) {
        log.debug("No such resource: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Not Found", "not-found", NOT_FOUND_DETAIL);
    }

    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMethodNotAllowed(HttpRequestMethodNotSupportedException ex) {
        var response = ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED);
        if (ex.getSupportedHttpMethods() != null) {
            response.allow(ex.getSupportedHttpMethods().toArray(HttpMethod[]::new));
        }
        return response.body(problem(HttpStatus.METHOD_NOT_ALLOWED, "Method Not Allowed", "method-not-allowed",
                "the " + ex.getMethod() + " method is not supported for this resource"));
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return serverError();
    }

    private ProblemDetail serverError() {
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", SERVER_ERROR_DETAIL);
    }

    private static ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
