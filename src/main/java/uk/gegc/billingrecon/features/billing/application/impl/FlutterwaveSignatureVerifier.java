package uk.gegc.billingrecon.features.billing.application.impl;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.SignatureVerifier;
import uk.gegc.billingrecon.features.billing.application.WebhookSignature;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Flutterwave sends either {@code flutterwave-signature} (base64 HMAC-SHA256 of the body keyed by
 * the secret hash) or, on older integrations, {@code verif-hash} carrying the secret hash itself.
 * The HMAC header wins when both are present.
 */
@Component
public class FlutterwaveSignatureVerifier implements SignatureVerifier {

    static final String SIGNATURE_HEADER = "flutterwave-signature";
    static final String LEGACY_HEADER = "verif-hash";

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.FLUTTERWAVE;
    }

    @Override
    public List<String> secretNames() {
        return CredentialNames.FLUTTERWAVE_WEBHOOK_HASH;
    }

    @Override
    public Optional<WebhookSignature> extractSignature(HttpHeaders headers) {
        String signature = headers.getFirst(SIGNATURE_HEADER);
        if (signature != null && !signature.isBlank()) {
            return Optional.of(WebhookSignature.bodyHmac(signature));
        }
        String legacy = headers.getFirst(LEGACY_HEADER);
        if (legacy != null && !legacy.isBlank()) {
            return Optional.of(WebhookSignature.sharedSecret(legacy));
        }
        return Optional.empty();
    }

    @Override
    public boolean isValid(byte[] body, WebhookSignature signature, String secret) {
        return switch (signature.scheme()) {
            case SHARED_SECRET -> HmacSupport.constantTimeEquals(secret, signature.value());
            case BODY_HMAC -> HmacSupport.constantTimeEquals(
                    Base64.getEncoder().encodeToString(HmacSupport.hmac("HmacSHA256", secret, body)),
                    signature.value());
        };
    }
}
