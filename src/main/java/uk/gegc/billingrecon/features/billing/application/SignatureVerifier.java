package uk.gegc.billingrecon.features.billing.application;

import org.springframework.http.HttpHeaders;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.List;
import java.util.Optional;

/**
 * Authenticates a raw webhook body against the provider's signature header.
 * Verification must run over the exact bytes received, before any parsing.
 */
public interface SignatureVerifier {

    PaymentProvider provider();

    /**
     * Credential names holding the webhook secret, in lookup order.
     */
    List<String> secretNames();

    /**
     * Signature from the provider's headers, if it sent one.
     */
    Optional<WebhookSignature> extractSignature(HttpHeaders headers);

    /**
     * Constant-time check of {@code signature} over {@code body}.
     */
    boolean isValid(byte[] body, WebhookSignature signature, String secret);
}
