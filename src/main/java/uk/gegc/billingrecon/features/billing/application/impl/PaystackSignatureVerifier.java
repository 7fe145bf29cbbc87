package uk.gegc.billingrecon.features.billing.application.impl;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.SignatureVerifier;
import uk.gegc.billingrecon.features.billing.application.WebhookSignature;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Paystack signs the body with HMAC-SHA512 keyed by the account secret key, hex encoded.
 */
@Component
public class PaystackSignatureVerifier implements SignatureVerifier {

    static final String HEADER = "x-paystack-signature";

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.PAYSTACK;
    }

    @Override
    public List<String> secretNames() {
        return List.of(CredentialNames.PAYSTACK_SECRET_KEY);
    }

    @Override
    public Optional<WebhookSignature> extractSignature(HttpHeaders headers) {
        return Optional.ofNullable(headers.getFirst(HEADER))
                .filter(value -> !value.isBlank())
                .map(WebhookSignature::bodyHmac);
    }

    @Override
    public boolean isValid(byte[] body, WebhookSignature signature, String secret) {
        String expected = HexFormat.of().formatHex(HmacSupport.hmac("HmacSHA512", secret, body));
        return HmacSupport.constantTimeEquals(expected, signature.value().toLowerCase(Locale.ROOT));
    }
}
