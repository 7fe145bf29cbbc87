package uk.gegc.billingrecon.features.billing.api;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.exception.CheckoutAuthenticationRequiredException;
import uk.gegc.billingrecon.features.billing.domain.exception.CheckoutOwnershipException;
import uk.gegc.billingrecon.features.billing.domain.exception.PayloadTooLargeException;
import uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException;
import uk.gegc.billingrecon.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedCheckoutException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedMediaTypeException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.shared.api.problem.ErrorTypes;
import uk.gegc.billingrecon.shared.api.problem.ProblemDetailBuilder;
import uk.gegc.billingrecon.shared.exception.RateLimitExceededException;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Error handler for billing API endpoints.
 * Maps domain exceptions to RFC 7807 Problem Detail responses.
 */
@Slf4j
@RestControllerAdvice(basePackages = "uk.gegc.billingrecon.features.billing.api")
public class BillingErrorHandler {

    @ExceptionHandler(BillingValidationException.class)
    public ResponseEntity<ProblemDetail> handleValidation(BillingValidationException ex, HttpServletRequest request) {
        log.warn("Billing validation failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.VALIDATION_FAILED, "Validation Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(WebhookAuthorizationException.class)
    public ResponseEntity<ProblemDetail> handleWebhookAuthorization(WebhookAuthorizationException ex, HttpServletRequest request) {
        log.warn("Webhook authorization failed: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.WEBHOOK_AUTHORIZATION_FAILED,
                "Webhook Authorization Failed", ex.getMessage(), request);
    }

    @ExceptionHandler(UnsupportedCheckoutException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedCheckout(UnsupportedCheckoutException ex, HttpServletRequest request) {
        log.warn("Unsupported checkout: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.UNSUPPORTED_CHECKOUT, "Unsupported Checkout", ex.getMessage(), request);
    }

    @ExceptionHandler(CheckoutAuthenticationRequiredException.class)
    public ResponseEntity<ProblemDetail> handleAuthenticationRequired(CheckoutAuthenticationRequiredException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNAUTHORIZED, ErrorTypes.UNAUTHORIZED, "Unauthorized", ex.getMessage(), request);
    }

    @ExceptionHandler(CheckoutOwnershipException.class)
    public ResponseEntity<ProblemDetail> handleOwnership(CheckoutOwnershipException ex, HttpServletRequest request) {
        log.warn("Checkout ownership mismatch on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.FORBIDDEN, ErrorTypes.ACCESS_DENIED, "Access Denied", ex.getMessage(), request);
    }

    @ExceptionHandler(SubscriptionNotFoundException.class)
    public ResponseEntity<ProblemDetail> handleSubscriptionNotFound(SubscriptionNotFoundException ex, HttpServletRequest request) {
        log.warn("{}", ex.getMessage());
        return respond(HttpStatus.NOT_FOUND, ErrorTypes.SUBSCRIPTION_NOT_FOUND, "Subscription Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(PayloadTooLargeException.class)
    public ResponseEntity<ProblemDetail> handlePayloadTooLarge(PayloadTooLargeException ex, HttpServletRequest request) {
        log.warn("Rejected oversized payload on {}: {}", request.getRequestURI(), ex.getMessage());
        return respond(HttpStatus.PAYLOAD_TOO_LARGE, ErrorTypes.PAYLOAD_TOO_LARGE, "Payload Too Large", ex.getMessage(), request);
    }

    @ExceptionHandler(UnsupportedMediaTypeException.class)
    public ResponseEntity<ProblemDetail> handleUnsupportedMediaType(UnsupportedMediaTypeException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorTypes.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported Media Type", ex.getMessage(), request);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ProblemDetail> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNSUPPORTED_MEDIA_TYPE, ErrorTypes.UNSUPPORTED_MEDIA_TYPE,
                "Unsupported Media Type", ex.getMessage(), request);
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimit(RateLimitExceededException ex, HttpServletRequest request) {
        log.warn("Rate limit exceeded on {}: {}", request.getRequestURI(), ex.getMessage());
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.TOO_MANY_REQUESTS,
                ErrorTypes.RATE_LIMIT_EXCEEDED,
                "Rate Limit Exceeded",
                ex.getMessage(),
                request
        );
        problem.setProperty("retryAfterSeconds", ex.getRetryAfterSeconds());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(ex.getRetryAfterSeconds()))
                .body(problem);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ProblemDetail> handleValidationErrors(MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, String> errors = new LinkedHashMap<>();
        ex.getBindingResult().getAllErrors().forEach(error -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });
        log.warn("Request validation failed: {}", errors);
        ProblemDetail problem = ProblemDetailBuilder.create(
                HttpStatus.BAD_REQUEST,
                ErrorTypes.VALIDATION_FAILED,
                "Validation Failed",
                "Request validation failed",
                request
        );
        problem.setProperty("errors", errors);
        return ResponseEntity.badRequest().body(problem);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ProblemDetail> handleMalformedJson(HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn("Malformed request body: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ErrorTypes.MALFORMED_JSON, "Malformed JSON",
                "Request body is missing or malformed", request);
    }

    @ExceptionHandler(BillingConfigurationException.class)
    public ResponseEntity<ProblemDetail> handleConfiguration(BillingConfigurationException ex, HttpServletRequest request) {
        log.error("Billing configuration error: {}", ex.getMessage());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.BILLING_CONFIGURATION_ERROR,
                "Billing Configuration Error", ex.getMessage(), request);
    }

    @ExceptionHandler(ProviderUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleProviderUnavailable(ProviderUnavailableException ex, HttpServletRequest request) {
        log.error("Payment provider call failed: {}", ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.PROVIDER_UNAVAILABLE,
                "Payment Provider Unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleUnexpected(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            return respondWithOwnStatus(errorResponse, request);
        }
        log.error("Unexpected error handling {}", request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ErrorTypes.INTERNAL_SERVER_ERROR,
                "Internal Server Error", "An unexpected error occurred", request);
    }

    /**
     * Spring MVC exceptions such as an unsupported method or a missing parameter carry their own
     * status and headers ({@code Allow} on a 405), which are kept.
     */
    private static ResponseEntity<ProblemDetail> respondWithOwnStatus(ErrorResponse errorResponse,
                                                                      HttpServletRequest request) {
        HttpStatus status = HttpStatus.resolve(errorResponse.getStatusCode().value());
        if (status == null) {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        String detail = errorResponse.getBody().getDetail() != null
                ? errorResponse.getBody().getDetail()
                : status.getReasonPhrase();
        if (status.is5xxServerError()) {
            log.error("Request to {} failed: {}", request.getRequestURI(), detail);
        } else {
            log.warn("Request to {} rejected with {}: {}", request.getRequestURI(), status.value(), detail);
        }
        URI type = status.is5xxServerError() ? ErrorTypes.INTERNAL_SERVER_ERROR : ErrorTypes.BAD_REQUEST;
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, status.getReasonPhrase(), detail, request);
        return ResponseEntity.status(status)
                .headers(errorResponse.getHeaders())
                .body(problem);
    }

    private static ResponseEntity<ProblemDetail> respond(HttpStatus status, URI type, String title,
                                                         String detail, HttpServletRequest request) {
        ProblemDetail problem = ProblemDetailBuilder.create(status, type, title, detail, request);
        return ResponseEntity.status(status).body(problem);
    }
}
