package uk.gegc.billingrecon.features.billing.application;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Billing configuration. Provider secrets are not stored here, see {@link CredentialResolver}.
 */
@Configuration
@ConfigurationProperties(prefix = "billing")
@Validated
@Data
public class BillingProperties {

    /**
     * Reported back to checkout callers so the UI can flag sandbox payments.
     */
    private boolean testMode = true;

    /**
     * Multiplier applied to the monthly price for yearly billing.
     */
    @Positive
    private double yearlyMultiplier = 10d;

    private PaidTrial paidTrial = new PaidTrial();

    private Webhook webhook = new Webhook();

    private Verification verification = new Verification();

    private Stripe stripe = new Stripe();

    private Provider paystack = new Provider("https://api.paystack.co");

    private Provider flutterwave = new Provider("https://api.flutterwave.com");

    /**
     * Overrides for named provider credentials, e.g. {@code billing.credentials.PAYSTACK_SECRET_KEY}.
     */
    private Map<String, String> credentials = new HashMap<>();

    @Data
    public static class PaidTrial {
        /**
         * Trial length in days. Invalid values fall back to 7, the result is clamped to 1..31.
         */
        private Double days;

        /**
         * Fraction of the monthly price charged for a trial, clamped to 0.05..1.
         */
        private Double multiplier;
    }

    @Data
    public static class Webhook {
        @Positive
        private int maxPayloadBytes = 1_000_000;

        @Positive
        private int rateLimitPerMinute = 100;
    }

    @Data
    public static class Verification {
        private Duration timeout = Duration.ofSeconds(15);
        private Duration connectTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Stripe {
        /**
         * Accepted clock skew for signed webhook timestamps, in seconds.
         */
        @Positive
        private long signatureTolerance = 300;
    }

    @Data
    public static class Provider {
        private String baseUrl;

        public Provider() {
        }

        public Provider(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
