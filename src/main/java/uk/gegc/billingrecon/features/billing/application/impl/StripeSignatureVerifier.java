package uk.gegc.billingrecon.features.billing.application.impl;

import com.stripe.exception.SignatureVerificationException;
import com.stripe.net.Webhook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.SignatureVerifier;
import uk.gegc.billingrecon.features.billing.application.WebhookSignature;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;

/**
 * Stripe signs {@code t=<timestamp>,v1=<hmac>}; the SDK checks the HMAC and the timestamp tolerance.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeSignatureVerifier implements SignatureVerifier {

    static final String HEADER = "Stripe-Signature";

    private final BillingProperties billingProperties;

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.STRIPE;
    }

    @Override
    public List<String> secretNames() {
        return List.of(CredentialNames.STRIPE_WEBHOOK_SECRET);
    }

    @Override
    public Optional<WebhookSignature> extractSignature(HttpHeaders headers) {
        return Optional.ofNullable(headers.getFirst(HEADER))
                .filter(value -> !value.isBlank())
                .map(WebhookSignature::bodyHmac);
    }

    @Override
    public boolean isValid(byte[] body, WebhookSignature signature, String secret) {
        String payload = new String(body, StandardCharsets.UTF_8);
        try {
            return Webhook.Signature.verifyHeader(payload, signature.value(), secret,
                    billingProperties.getStripe().getSignatureTolerance());
        } catch (SignatureVerificationException e) {
            log.warn("Stripe signature rejected: {}", e.getMessage());
            return false;
        }
    }
}
