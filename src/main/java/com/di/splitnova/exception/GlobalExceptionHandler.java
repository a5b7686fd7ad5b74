package com.di.splitnova.exception;

import com.di.splitnova.aspect.ErrorCategory;
import com.di.splitnova.sampling.CapacityExceededException;
import com.di.splitnova.sampling.SamplingException;
import com.di.splitnova.util.TransactionEventLogger;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Maps exceptions escaping the REST controllers to a uniform {@link ErrorResponse}.
 *
 * <p>Status mapping:
 * <ul>
 *   <li>{@link SamplingException} (invalid sizes, capacity exceeded, failed plan): 422</li>
 *   <li>bean validation and {@link IllegalArgumentException}: 400</li>
 *   <li>unknown run id: 404</li>
 *   <li>I/O failures reading input or writing output: 503</li>
 *   <li>anything else: 500</li>
 * </ul>
 * Every handled exception is also written as a structured event through {@link TransactionEventLogger}.
 */
@Slf4j
@ControllerAdvice
public class GlobalExceptionHandler {

    private final TransactionEventLogger eventLogger;

    public GlobalExceptionHandler(TransactionEventLogger eventLogger) {
        this.eventLogger = eventLogger;
    }

    @ExceptionHandler(SamplingException.class)
    public ResponseEntity<ErrorResponse> handleSamplingException(SamplingException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("SAMPLING_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.UNPROCESSABLE_ENTITY);
        if (e instanceof CapacityExceededException) {
            response.addDetail("requiredWidth", ((CapacityExceededException) e).getRequiredWidth());
        }
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(response);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBeanValidation(MethodArgumentNotValidException e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        logError("VALIDATION_EXCEPTION", category, e);
        ErrorResponse response = buildErrorResponse(category, e, HttpStatus.BAD_REQUEST);
        response.setMessage("Request validation failed");
        for (FieldError fieldError : e.getBindingResult().getFieldErrors()) {
            response.addDetail(fieldError.getField(), fieldError.getDefaultMessage());
        }
        return ResponseEntity.badRequest().body(response);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleValidationException(Exception e) {
        ErrorCategory category = ErrorCategory.VALIDATION_ERROR;
        logError("VALIDATION_EXCEPTION", category, e);
        return ResponseEntity.badRequest().body(buildErrorResponse(category, e, HttpStatus.BAD_REQUEST));
    }

    @ExceptionHandler(RunNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleRunNotFound(RunNotFoundException e) {
        log.debug("[CONTROLLER] Run not found: {}", e.getRunId());
        ErrorResponse response = buildErrorResponse(ErrorCategory.VALIDATION_ERROR, e, HttpStatus.NOT_FOUND);
        response.addDetail("runId", e.getRunId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }

    @ExceptionHandler({java.io.IOException.class, java.io.UncheckedIOException.class})
    public ResponseEntity<ErrorResponse> handleIoException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("IO_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(buildErrorResponse(category, e, HttpStatus.SERVICE_UNAVAILABLE));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        logError("UNHANDLED_EXCEPTION", category, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(buildErrorResponse(category, e, HttpStatus.INTERNAL_SERVER_ERROR));
    }

    private void logError(String eventType, ErrorCategory category, Throwable exception) {
        String transactionId = MDC.get("jobId");
        if (transactionId == null) {
            transactionId = MDC.get("requestId");
        }
        if (transactionId == null) {
            transactionId = "global-handler-" + UUID.randomUUID().toString().substring(0, 8);
        }

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("errorMessage", messageOf(exception));
        context.put("errorType", exception.getClass().getName());
        context.put("errorCategory", category.name());
        context.put("errorCategoryDescription", category.getDescription());
        context.put("handler", "GlobalExceptionHandler");

        Throwable rootCause = ErrorCategory.rootCause(exception);
        if (rootCause != exception) {
            context.put("rootCauseType", rootCause.getClass().getSimpleName());
            context.put("rootCauseMessage", rootCause.getMessage());
        }

        eventLogger.logEvent(eventType, context, transactionId, "global_exception_handler", exception);
        log.error("[CONTROLLER] GlobalExceptionHandler caught exception: {} [{}]",
                exception.getClass().getSimpleName(), category.getName(), exception);
    }

    private ErrorResponse buildErrorResponse(ErrorCategory category, Throwable exception, HttpStatus status) {
        ErrorResponse response = new ErrorResponse();
        response.setTimestamp(Instant.now().toString());
        response.setStatus(status.value());
        response.setError(status.getReasonPhrase());
        response.setMessage(messageOf(exception));
        response.setErrorCategory(category.name());
        response.setErrorCategoryDescription(category.getDescription());
        response.setPath(MDC.get("requestPath") != null ? MDC.get("requestPath") : "/unknown");
        response.addDetail("exceptionType", exception.getClass().getName());

        Throwable rootCause = ErrorCategory.rootCause(exception);
        if (rootCause != exception) {
            response.addDetail("rootCauseType", rootCause.getClass().getName());
            response.addDetail("rootCauseMessage", rootCause.getMessage());
        }
        return response;
    }

    private static String messageOf(Throwable exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getSimpleName();
    }

    /**
     * Structured error response for API endpoints.
     */
    @Data
    public static class ErrorResponse {
        private String timestamp;
        private int status;
        private String error;
        private String message;
        private String errorCategory;
        private String errorCategoryDescription;
        private String path;
        private Map<String, Object> details = new LinkedHashMap<>();

        public void addDetail(String key, Object value) {
            this.details.put(key, value);
        }
    }
}
