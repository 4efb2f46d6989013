package com.platform.wafoperator.error;

import com.platform.wafoperator.observability.OperatorMetrics;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Global exception handler for the operations API.
 * 
 * Converts exceptions to ErrorResponse, logs them with a severity
 * matching their category and counts them by code.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {
    
    private static final String ERRORS_METRIC = "wafoperator.api.errors";
    
    private final OperatorMetrics metrics;
    
    public GlobalExceptionHandler(OperatorMetrics metrics) {
        this.metrics = metrics;
    }
    
    // ==================== Operator Exceptions ====================
    
    @ExceptionHandler(OperatorException.class)
    public ResponseEntity<ErrorResponse> handleOperatorException(
            OperatorException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        ErrorCode errorCode = ex.getErrorCode();
        HttpStatus status = mapErrorCodeToStatus(errorCode);
        
        if (errorCode.isFatal()) {
            log.error("[{}] FATAL: {} - {}", correlationId, errorCode.getCode(), ex.getMessage(), ex);
        } else {
            log.warn("[{}] {} - {}", correlationId, errorCode.getCode(), ex.getMessage());
        }
        recordMetric(errorCode);
        
        return ResponseEntity.status(status).body(baseResponse(errorCode, ex.getMessage(), status, request, correlationId)
            .recoverable(errorCode.isRecoverable())
            .build());
    }
    
    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleResourceNotFound(
            ResourceNotFoundException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Resource not found: {} ({})", correlationId, ex.getResourceType(), ex.getResourceId());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.NOT_FOUND, request, correlationId)
            .involvedObject(ErrorResponse.InvolvedObject.of(ex.getResourceType(), ex.getResourceId()))
            .build();
        
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(response);
    }
    
    @ExceptionHandler(ResourceConflictException.class)
    public ResponseEntity<ErrorResponse> handleResourceConflict(
            ResourceConflictException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Conflict on {} {}: {}", correlationId, ex.getResourceType(), ex.getResourceId(), ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse response = baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.CONFLICT, request, correlationId)
            .recoverable(ex.getErrorCode().isRecoverable())
            .involvedObject(ErrorResponse.InvolvedObject.of(ex.getResourceType(), ex.getResourceId()))
            .build();
        
        return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
    }
    
    @ExceptionHandler(AdmissionRejectedException.class)
    public ResponseEntity<ErrorResponse> handleAdmissionRejected(
            AdmissionRejectedException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Admission rejected: {}", correlationId, ex.getMessage());
        recordMetric(ex.getErrorCode());
        
        ErrorResponse.ErrorResponseBuilder builder = 
            baseResponse(ex.getErrorCode(), ex.getMessage(), HttpStatus.BAD_REQUEST, request, correlationId);
        if (ex.getField() != null) {
            builder.violations(List.of(
                ErrorResponse.Violation.builder()
                    .field(ex.getField())
                    .message(ex.getMessage())
                    .rejectedValue(ex.getRejectedValue())
                    .build()
            ));
        }
        
        return ResponseEntity.badRequest().body(builder.build());
    }
    
    // ==================== Request Errors ====================
    
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(
            MissingServletRequestParameterException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Missing parameter: {}", correlationId, ex.getParameterName());
        recordMetric(ErrorCode.MISSING_REQUIRED_FIELD);
        
        return ResponseEntity.badRequest().body(baseResponse(ErrorCode.MISSING_REQUIRED_FIELD,
            String.format("Missing required parameter: %s", ex.getParameterName()),
            HttpStatus.BAD_REQUEST, request, correlationId).build());
    }
    
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Type mismatch: {} = {}", correlationId, ex.getName(), ex.getValue());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.badRequest().body(baseResponse(ErrorCode.INVALID_REQUEST,
            String.format("Invalid value for parameter '%s': %s", ex.getName(), ex.getValue()),
            HttpStatus.BAD_REQUEST, request, correlationId).build());
    }
    
    @ExceptionHandler(HttpRequestMethodNotSupportedException.class)
    public ResponseEntity<ErrorResponse> handleMethodNotSupported(
            HttpRequestMethodNotSupportedException ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.warn("[{}] Method not supported: {} on {}", correlationId, ex.getMethod(), request.getRequestURI());
        recordMetric(ErrorCode.INVALID_REQUEST);
        
        return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED).body(baseResponse(ErrorCode.INVALID_REQUEST,
            String.format("Method %s not supported for this endpoint", ex.getMethod()),
            HttpStatus.METHOD_NOT_ALLOWED, request, correlationId).build());
    }
    
    // ==================== Catch-All ====================
    
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(
            Exception ex, HttpServletRequest request) {
        
        String correlationId = getOrCreateCorrelationId();
        
        log.error("[{}] FATAL: Unexpected error: {}", correlationId, ex.getMessage(), ex);
        recordMetric(ErrorCode.INTERNAL_ERROR);
        
        ErrorResponse response = baseResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred",
                HttpStatus.INTERNAL_SERVER_ERROR, request, correlationId)
            .detail(ex.getClass().getSimpleName() + ": " + ex.getMessage())
            .build();
        
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(response);
    }
    
    // ==================== Helpers ====================
    
    private ErrorResponse.ErrorResponseBuilder baseResponse(ErrorCode errorCode, String message,
            HttpStatus status, HttpServletRequest request, String correlationId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message)
            .recoverable(false)
            .status(status.value())
            .timestamp(Instant.now())
            .path(request.getRequestURI())
            .correlationId(correlationId);
    }
    
    private String getOrCreateCorrelationId() {
        String correlationId = MDC.get("correlationId");
        if (correlationId == null) {
            correlationId = UUID.randomUUID().toString().substring(0, 8);
            MDC.put("correlationId", correlationId);
        }
        return correlationId;
    }
    
    private void recordMetric(ErrorCode errorCode) {
        metrics.incrementCounter(ERRORS_METRIC,
            "code", errorCode.getCode(),
            "fatal", String.valueOf(errorCode.isFatal()));
    }
    
    private HttpStatus mapErrorCodeToStatus(ErrorCode errorCode) {
        return switch (errorCode) {
            case RESOURCE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case RESOURCE_CONFLICT, ALREADY_EXISTS -> HttpStatus.CONFLICT;
            case ADMISSION_REJECTED, MISSING_IDENTITY, INVALID_REQUEST, MISSING_REQUIRED_FIELD -> 
                HttpStatus.BAD_REQUEST;
            case STORE_UNAVAILABLE, STORE_REQUEST_FAILED -> HttpStatus.SERVICE_UNAVAILABLE;
            case RECONCILE_DEADLINE_EXCEEDED -> HttpStatus.GATEWAY_TIMEOUT;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
