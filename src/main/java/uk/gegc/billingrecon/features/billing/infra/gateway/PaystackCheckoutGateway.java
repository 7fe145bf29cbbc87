package uk.gegc.billingrecon.features.billing.infra.gateway;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.extern.slf4j.Slf4j;
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
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code POST /transaction/initialize}. Monthly and yearly purchases are tied to the Paystack
 * plan so Paystack creates the subscription; trials are a plain charge.
 */
@Slf4j
@Component
public class PaystackCheckoutGateway implements CheckoutGateway {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record InitializeData(@JsonProperty("authorization_url") String authorizationUrl,
                          @JsonProperty("access_code") String accessCode,
                          String reference) {
    }

    private static final ParameterizedTypeReference<ProviderApiEnvelope<InitializeData>> RESPONSE_TYPE =
            new ParameterizedTypeReference<>() {
            };

    private final RestClient restClient;
    private final CredentialResolver credentialResolver;

    public PaystackCheckoutGateway(@Qualifier("paystackRestClient") RestClient restClient,
                                   CredentialResolver credentialResolver) {
        this.restClient = restClient;
        this.credentialResolver = credentialResolver;
    }

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.PAYSTACK;
    }

    @Override
    public boolean isConfigured() {
        return credentialResolver.isPresent(CredentialNames.PAYSTACK_SECRET_KEY)
                && credentialResolver.isPresent(CredentialNames.PAYSTACK_PLAN_CODE_PRO)
                && credentialResolver.isPresent(CredentialNames.PAYSTACK_PLAN_CODE_BUSINESS);
    }

    @Override
    public String createSession(GatewayCheckoutRequest request) {
        String secret = credentialResolver.resolve(CredentialNames.PAYSTACK_SECRET_KEY)
                .orElseThrow(() -> new BillingConfigurationException("PAYSTACK_SECRET_KEY is not configured"));

        Map<String, Object> metadata = new LinkedHashMap<>(request.metadata());
        metadata.put("custom_fields", List.of(Map.of(
                "display_name", "Plan",
                "variable_name", "plan",
                "value", request.plan().getCode())));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("email", request.email());
        body.put("amount", request.minorAmount());
        body.put("currency", request.currency().name());
        body.put("reference", request.reference());
        body.put("callback_url", request.successUrl());
        body.put("metadata", metadata);
        body.put("channels", request.paymentMethod() == PaymentMethod.MOBILE_MONEY
                ? List.of("mobile_money", "ussd", "bank_transfer")
                : List.of("card"));
        if (request.interval() != BillingInterval.TRIAL) {
            body.put("plan", planCode(request.plan()));
        }

        ProviderApiEnvelope<InitializeData> response = ProviderCalls.checkoutCall(provider(), () -> restClient.post()
                .uri("/transaction/initialize")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + secret)
                .contentType(MediaType.APPLICATION_JSON)
                .body(body)
                .retrieve()
                .body(RESPONSE_TYPE));

        if (response == null || !response.isOk() || response.data() == null || response.data().authorizationUrl() == null) {
            throw new ProviderUnavailableException("Paystack did not return an authorization URL: "
                    + (response != null ? response.message() : "empty response"));
        }
        return response.data().authorizationUrl();
    }

    private String planCode(PlanTier plan) {
        String name = plan == PlanTier.BUSINESS
                ? CredentialNames.PAYSTACK_PLAN_CODE_BUSINESS
                : CredentialNames.PAYSTACK_PLAN_CODE_PRO;
        return credentialResolver.resolve(name)
                .orElseThrow(() -> new BillingConfigurationException(name + " is not configured"));
    }
}
