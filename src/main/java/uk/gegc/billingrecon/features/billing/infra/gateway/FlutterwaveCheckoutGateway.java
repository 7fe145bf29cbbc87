package uk.gegc.billingrecon.features.billing.infra.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import uk.gegc.billingrecon.features.billing.application.CheckoutGateway;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.CredentialResolver;
import uk.gegc.billingrecon.features.billing.application.GatewayCheckoutRequest;
import uk.gegc.billingrecon.features.billing.domain.event.ProviderApiEnvelope;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code POST /v3/payments} (Flutterwave Standard). Returns a hosted payment link.
 */
@Component
public class FlutterwaveCheckoutGateway implements CheckoutGateway {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record PaymentLink(String link) {
    }

    private static final ParameterizedTypeReference<ProviderApiEnvelope<PaymentLink>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final CredentialResolver credentialResolver;

    public FlutterwaveCheckoutGateway(@Qualifier("flutterwaveRestClient") RestClient restClient,
                                      CredentialResolver credentialResolver) {
        this.restClient = restClient;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.FLUTTERWAVE;
    }

    @Override
    public boolean isConfigured() {
        return credentialResolver.isPresent(CredentialNames.FLUTTERWAVE_SECRET_KEY);
    }

    @Override
    public String createSession(GatewayCheckoutRequest request) {
        String secret = credentialResolver.resolve(CredentialNames.FLUTTERWAVE_SECRET_KEY)
                .orElseThrow(() -> new BillingConfigurationException("FLUTTERWAVE_SECRET_KEY is not configured"));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("tx_ref", request.reference());
        body.put("amount", request.amount().toPlainString());
        body.put("currency", request.currency().name());
        body.put("payment_options", request.paymentMethod() == PaymentMethod.MOBILE_MONEY
                ? "mobilemoney,mpesa,ussd,account,banktransfer"
                : "card");
        body.put("redirect_url", request.successUrl());
        body.put("customer", Map.of(
                "email", request.email(),
                "name", request.email().split("@")[0]));
        body.put("customizations", Map.of(
                "title", request.plan().displayName(),
                "description", request.plan().displayName() + " (" + request.interval().getCode() + ")"));
        body.put("meta", request.metadata());

        ProviderApiEnvelope<PaymentLink> response = ProviderCalls.checkoutCall(provider(), () -> restClient.post()
                .uri("/v3/payments")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + secret)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(RESPONSE_TYPE));

        if (response == null || !response.isOk() || response.data() == null || response.data().link() == null) {
            throw new ProviderUnavailableException("Flutterwave did not return a payment link: "
                    + (response != null ? response.message() : "empty response"));
        }
        return response.data().link();
    }
}
