package uk.gegc.billingrecon.features.billing.application;

/**
 * Signature taken from a webhook's headers, tagged with the header it came from so that header
 * contents can never select how they are checked.
 *
 * @param scheme how {@code value} is checked
 * @param value  header value, trimmed
 */
public record WebhookSignature(Scheme scheme, String value) {

    public enum Scheme {
        /** Keyed hash computed over the raw body. */
        BODY_HMAC,
        /** The shared secret itself, echoed back by the provider. */
        SHARED_SECRET
    }

    public static WebhookSignature bodyHmac(String value) {
        return new WebhookSignature(Scheme.BODY_HMAC, value.trim());
    }

    public static WebhookSignature sharedSecret(String value) {
        return new WebhookSignature(Scheme.SHARED_SECRET, value.trim());
    }
}
