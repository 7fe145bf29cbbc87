package uk.gegc.billingrecon.features.billing.domain.exception;

/**
 * Signature verification or provider re-verification failed. The event must be treated as
 * forged or stale and nothing in it may be acted on.
 */
public class WebhookAuthorizationException extends RuntimeException {

    public WebhookAuthorizationException(String message) {
        super(message);
    }

    public WebhookAuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
