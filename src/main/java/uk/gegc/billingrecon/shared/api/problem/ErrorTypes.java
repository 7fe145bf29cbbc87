package uk.gegc.billingrecon.shared.api.problem;

import java.net.URI;

/**
 * Catalog of RFC 7807 problem type URIs.
 *
 * @see ProblemDetailBuilder
 */
public final class ErrorTypes {

    private static final String BASE_URL = "https://billing.gegc.uk/docs/errors";

    // ==================== Validation Errors ====================
    public static final URI VALIDATION_FAILED = URI.create(BASE_URL + "/validation-failed");
    public static final URI MALFORMED_JSON = URI.create(BASE_URL + "/malformed-json");
    public static final URI PAYLOAD_TOO_LARGE = URI.create(BASE_URL + "/payload-too-large");
    public static final URI UNSUPPORTED_MEDIA_TYPE = URI.create(BASE_URL + "/unsupported-media-type");
    public static final URI UNSUPPORTED_CHECKOUT = URI.create(BASE_URL + "/unsupported-checkout");
    public static final URI BAD_REQUEST = URI.create(BASE_URL + "/bad-request");

    // ==================== Security Errors ====================
    public static final URI UNAUTHORIZED = URI.create(BASE_URL + "/unauthorized");
    public static final URI ACCESS_DENIED = URI.create(BASE_URL + "/access-denied");
    public static final URI WEBHOOK_AUTHORIZATION_FAILED = URI.create(BASE_URL + "/webhook-authorization-failed");

    // ==================== Resource Errors ====================
    public static final URI SUBSCRIPTION_NOT_FOUND = URI.create(BASE_URL + "/subscription-not-found");

    // ==================== Rate Limiting ====================
    public static final URI RATE_LIMIT_EXCEEDED = URI.create(BASE_URL + "/rate-limit-exceeded");

    // ==================== Server Errors ====================
    public static final URI BILLING_CONFIGURATION_ERROR = URI.create(BASE_URL + "/billing-configuration-error");
    public static final URI PROVIDER_UNAVAILABLE = URI.create(BASE_URL + "/provider-unavailable");
    public static final URI INTERNAL_SERVER_ERROR = URI.create(BASE_URL + "/internal-server-error");

    private ErrorTypes() {
        throw new AssertionError("Utility class - do not instantiate");
    }
}
