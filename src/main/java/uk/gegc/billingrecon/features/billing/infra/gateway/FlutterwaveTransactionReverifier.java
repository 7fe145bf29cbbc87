package uk.gegc.billingrecon.features.billing.infra.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.CredentialResolver;
import uk.gegc.billingrecon.features.billing.application.TransactionReverifier;
import uk.gegc.billingrecon.features.billing.application.VerifiedTransaction;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.event.FlutterwaveCharge;
import uk.gegc.billingrecon.features.billing.domain.event.ProviderApiEnvelope;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Looks a charge up with {@code GET /v3/transactions/{id}/verify}. Flutterwave verifies by
 * transaction id, so the reference is checked against the returned {@code tx_ref}.
 */
@Slf4j
@Component
public class FlutterwaveTransactionReverifier implements TransactionReverifier {

    private static final ParameterizedTypeReference<ProviderApiEnvelope<FlutterwaveCharge>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final CredentialResolver credentialResolver;

    public FlutterwaveTransactionReverifier(@Qualifier("flutterwaveRestClient") RestClient restClient,
                                            CredentialResolver credentialResolver) {
        this.restClient = restClient;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.FLUTTERWAVE;
    }

    @Override
    public VerifiedTransaction verify(String lookupKey, String expectedReference) {
        String secret = credentialResolver.resolve(CredentialNames.FLUTTERWAVE_SECRET_KEY)
                .orElseThrow(() -> new BillingConfigurationException("FLUTTERWAVE_SECRET_KEY is not configured"));

        ProviderApiEnvelope<FlutterwaveCharge> response = ProviderCalls.verifyCall(provider(), "transaction " + lookupKey,
                () -> restClient.get()
                        .uri("/v3/transactions/{id}/verify", lookupKey)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + secret)
                        .retrieve()
                        .body(RESPONSE_TYPE));

        if (response == null || !response.isOk() || response.data() == null) {
            throw new WebhookAuthorizationException("Flutterwave could not verify transaction " + lookupKey);
        }
        FlutterwaveCharge charge = response.data();
        if (!expectedReference.equals(charge.txRef())) {
            log.warn("Flutterwave verify returned tx_ref {} for {}", charge.txRef(), expectedReference);
            throw new WebhookAuthorizationException("Verified reference does not match " + expectedReference);
        }
        if (!charge.isSuccessful()) {
            throw new WebhookAuthorizationException(
                    "Flutterwave reports status '" + charge.status() + "' for " + expectedReference);
        }

        return VerifiedTransaction.builder()
                .provider(provider())
                .reference(charge.txRef())
                .transactionId(charge.id())
                .amount(charge.amount())
                .currency(charge.currency())
                .metadata(ChargeMetadata.from(charge.meta()))
                .planCode(charge.paymentPlanCode())
                .build();
    }
}
