package com.williamcallahan.baptismdesk.web;

import com.williamcallahan.baptismdesk.manager.ProfileNotFoundException;
import com.williamcallahan.baptismdesk.pipeline.CertificateCombineException;
import com.williamcallahan.baptismdesk.queue.AdmissionRejectedException;
import com.williamcallahan.baptismdesk.storage.ObjectStorageException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Base controller providing the shared error mapping and the bridge from profile manager futures
 * to blocking request handling.
 */
public abstract class BaseController {
    private static final Logger log = LoggerFactory.getLogger(BaseController.class);

    /** Upper bound on waiting for the profile manager to answer a request. */
    protected static final Duration MANAGER_TIMEOUT = Duration.ofSeconds(30);

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Waits for a profile manager result, rethrowing the task's own failure.
     *
     * @param future pending result
     * @param <T> result type
     * @return the result
     * @throws ManagerUnavailableException when the manager does not answer in time
     */
    protected <T> T await(CompletableFuture<T> future) {
        try {
            return future.get(MANAGER_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException(cause);
        } catch (TimeoutException e) {
            throw new ManagerUnavailableException("Profile manager did not respond within " + MANAGER_TIMEOUT.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ManagerUnavailableException("Interrupted while waiting for the profile manager");
        }
    }

    protected ResponseEntity<ApiResponse> createSuccessResponse(String message) {
        return exceptionBuilder.buildSuccessResponse(message);
    }

    protected ResponseEntity<ApiResponse> createAcceptedResponse(String message) {
        return exceptionBuilder.buildAcceptedResponse(message);
    }

    @ExceptionHandler(ProfileNotFoundException.class)
    public ResponseEntity<ApiResponse> handleNotFound(ProfileNotFoundException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse> handleValidationException(IllegalArgumentException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiResponse> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST,
                message.isEmpty() ? "Invalid request body" : message);
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MissingServletRequestParameterException.class,
        MissingServletRequestPartException.class
    })
    public ResponseEntity<ApiResponse> handleMalformedRequest(Exception e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, "Malformed request", e);
    }

    @ExceptionHandler(AdmissionRejectedException.class)
    public ResponseEntity<ApiResponse> handleRejected(AdmissionRejectedException e) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(ManagerUnavailableException.class)
    public ResponseEntity<ApiResponse> handleManagerUnavailable(ManagerUnavailableException e) {
        log.warn("{}", e.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(CertificateCombineException.class)
    public ResponseEntity<ApiResponse> handleCombineFailure(CertificateCombineException e) {
        log.error("Combining certificates failed: {}", e.getMessage());
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_GATEWAY, "Failed to combine certificates", e);
    }

    @ExceptionHandler(ObjectStorageException.class)
    public ResponseEntity<ApiResponse> handleStorageFailure(ObjectStorageException e) {
        log.error("Object storage request failed: {}", e.getMessage(), e);
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_GATEWAY, "Object storage is unavailable", e);
    }

    /**
     * Signals that the profile manager did not answer a request in time.
     */
    public static class ManagerUnavailableException extends RuntimeException {
        public ManagerUnavailableException(String message) {
            super(message);
        }
    }
}
