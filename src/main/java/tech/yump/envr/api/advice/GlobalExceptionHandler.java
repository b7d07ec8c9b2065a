package tech.yump.envr.api.advice;

import com.google.api.gax.rpc.ApiException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import software.amazon.awssdk.core.exception.SdkException;
import tech.yump.envr.store.BackendUnavailableException;
import tech.yump.envr.store.InvalidVersionException;
import tech.yump.envr.store.SecretStoreException;
import tech.yump.envr.store.UnknownStoreException;
import tech.yump.envr.store.WriteOnlyStoreException;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    @ExceptionHandler(InvalidVersionException.class)
    public ResponseEntity<ProblemDetail> handleInvalidVersion(InvalidVersionException ex, HttpServletRequest request) {
        log.warn("Invalid version '{}': {}. Request: {} {}", ex.getVersion(), ex.getMessage(), request.getMethod(), request.getRequestURI());
        ProblemDetail problemDetail = problem(HttpStatus.BAD_REQUEST, "Invalid Version", ex.getMessage());
        problemDetail.setProperty("version", ex.getVersion());
        return ResponseEntity.badRequest().body(problemDetail);
    }

    @ExceptionHandler(UnknownStoreException.class)
    public ResponseEntity<ProblemDetail> handleUnknownStore(UnknownStoreException ex, HttpServletRequest request) {
        log.warn("{} Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.NOT_FOUND, "Unknown Store", ex.getMessage());
    }

    @ExceptionHandler(WriteOnlyStoreException.class)
    public ResponseEntity<ProblemDetail> handleWriteOnly(WriteOnlyStoreException ex, HttpServletRequest request) {
        log.warn("{} Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.METHOD_NOT_ALLOWED, "Write-Only Store", ex.getMessage());
    }

    @ExceptionHandler(BackendUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleBackendUnavailable(BackendUnavailableException ex, HttpServletRequest request) {
        log.warn("Backend unavailable: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Backend Unavailable", ex.getMessage());
    }

    @ExceptionHandler(SecretStoreException.class)
    public ResponseEntity<ProblemDetail> handleSecretStoreException(SecretStoreException ex, HttpServletRequest request) {
        log.error("Secret store error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Secret Store Error", ex.getMessage());
    }

    @ExceptionHandler({SdkException.class, ApiException.class, RestClientException.class})
    public ResponseEntity<ProblemDetail> handleBackendFailure(RuntimeException ex, HttpServletRequest request) {
        log.error("Backend call failed: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "Backend Error", "The secret backend rejected the request: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        log.warn("Bad request: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI());
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {
        String message = "Malformed request body. Please check the JSON format.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false), ex.getMessage());
        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "An unexpected internal error occurred.");
    }

    private static ResponseEntity<ProblemDetail> respond(HttpStatus status, String title, String detail) {
        return ResponseEntity.status(status).body(problem(status, title, detail));
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, detail);
        problemDetail.setTitle(title);
        return problemDetail;
    }
}
