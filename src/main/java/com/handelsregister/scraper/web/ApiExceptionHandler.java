package com.handelsregister.scraper.web;

import com.handelsregister.scraper.dto.ErrorResponse;
import com.handelsregister.scraper.exception.AuthenticationException;
import com.handelsregister.scraper.exception.PortalException;
import com.handelsregister.scraper.exception.RateLimitExceededException;
import com.handelsregister.scraper.exception.RequestValidationException;
import com.handelsregister.scraper.exception.SearchTimeoutException;
import com.handelsregister.scraper.exception.StateNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Translates the exception taxonomy into HTTP statuses and {@link ErrorResponse} bodies.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    static final String STATE_HINT =
            "Try German names (e.g., \"Berlin\", \"Bayern\") or English names "
                    + "(e.g., \"Bavaria\", \"North Rhine-Westphalia\")";

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<ErrorResponse> onValidation(final RequestValidationException ex) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse(ex.getMessage(), null, ex.getOptions(), null));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> onInvalidBody(final MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .findFirst()
                .orElse("Invalid request body");
        return ResponseEntity.badRequest().body(ErrorResponse.of(message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> onUnreadableBody(final HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorResponse.of("Request body must be valid JSON"));
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> onMediaType(final HttpMediaTypeNotSupportedException ex) {
        return ResponseEntity.status(HttpStatus.UNSUPPORTED_MEDIA_TYPE)
                .body(ErrorResponse.of("Request body must be JSON"));
    }

    @ExceptionHandler(AuthenticationException.class)
    public ResponseEntity<ErrorResponse> onAuthentication(final AuthenticationException ex) {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> onRateLimit(final RateLimitExceededException ex) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .body(new ErrorResponse("Rate limit exceeded", ex.getMessage(), null, null));
    }

    @ExceptionHandler(StateNotFoundException.class)
    public ResponseEntity<ErrorResponse> onUnknownState(final StateNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse(ex.getMessage(), null, null, STATE_HINT));
    }

    @ExceptionHandler(SearchTimeoutException.class)
    public ResponseEntity<ErrorResponse> onTimeout(final SearchTimeoutException ex) {
        log.warn(ex.getMessage());
        return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(PortalException.class)
    public ResponseEntity<ErrorResponse> onPortal(final PortalException ex) {
        log.error("Portal search failed: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.of(ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> onUnexpected(final Exception ex) {
        // framework errors (unknown path, wrong method, missing parameter) keep their own status
        if (ex instanceof org.springframework.web.ErrorResponse framework) {
            String detail = framework.getBody().getDetail();
            return ResponseEntity.status(framework.getStatusCode())
                    .body(ErrorResponse.of(detail != null ? detail : framework.getStatusCode().toString()));
        }
        log.error("Unhandled error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of("Internal server error: " + ex.getMessage()));
    }
}
