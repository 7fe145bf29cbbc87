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
import uk.gegc.billingrecon.features.billing.domain.event.PaystackCharge;
import uk.gegc.billingrecon.features.billing.domain.event.ProviderApiEnvelope;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

/**
 * Looks a charge up with {@code GET /transaction/verify/{reference}}.
 */
@Slf4j
@Component
public class PaystackTransactionReverifier implements TransactionReverifier {

    private static final ParameterizedTypeReference<ProviderApiEnvelope<PaystackCharge>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final CredentialResolver credentialResolver;

    public PaystackTransactionReverifier(@Qualifier("paystackRestClient") RestClient restClient,
                                         CredentialResolver credentialResolver) {
        this.restClient = restClient;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.PAYSTACK;
    }

    @Override
    public VerifiedTransaction verify(String lookupKey, String expectedReference) {
        String secret = credentialResolver.resolve(CredentialNames.PAYSTACK_SECRET_KEY)
                .orElseThrow(() -> new BillingConfigurationException("PAYSTACK_SECRET_KEY is not configured"));

        ProviderApiEnvelope<PaystackCharge> response = ProviderCalls.verifyCall(provider(), "reference " + expectedReference,
                () -> restClient.get()
                        .uri("/transaction/verify/{reference}", lookupKey)
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + secret)
                        .retrieve()
                        .body(RESPONSE_TYPE));

        if (response == null || !response.isOk() || response.data() == null) {
            throw new WebhookAuthorizationException("Paystack could not verify reference " + expectedReference);
        }
        PaystackCharge charge = response.data();
        if (!expectedReference.equals(charge.reference())) {
            log.warn("Paystack verify returned reference {} for {}", charge.reference(), expectedReference);
            throw new WebhookAuthorizationException("Verified reference does not match " + expectedReference);
        }
        if (!charge.isSuccessful()) {
            throw new WebhookAuthorizationException(
                    "Paystack reports status '" + charge.status() + "' for " + expectedReference);
        }

        return VerifiedTransaction.builder()
                .provider(provider())
                .reference(charge.reference())
                .transactionId(charge.id())
                .amount(charge.majorAmount())
                .currency(charge.currency())
                .metadata(ChargeMetadata.from(charge.metadata()))
                .planCode(charge.planCode())
                .subscriptionCode(charge.explicitSubscriptionCode())
                .customerCode(charge.customerCode())
                .authorizationCode(charge.authorizationCode())
                .build();
    }
}
