package uk.gegc.billingrecon.features.billing.infra.gateway;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.GatewayCheckoutRequest;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Flutterwave checkout gateway")
class FlutterwaveCheckoutGatewayTest {

    private WireMockServer wireMockServer;
    private FlutterwaveCheckoutGateway gateway;

    @BeforeEach
    void setUp() {
        wireMockServer = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        wireMockServer.start();

        BillingProperties properties = new BillingProperties();
        properties.getFlutterwave().setBaseUrl(wireMockServer.baseUrl());
        gateway = new FlutterwaveCheckoutGateway(new ProviderHttpConfig(properties).flutterwaveRestClient(),
                name -> name.equals("FLUTTERWAVE_SECRET_KEY") ? Optional.of("FLWSECK_TEST-1") : Optional.empty());
    }

    @AfterEach
    void tearDown() {
        wireMockServer.stop();
    }

    @Test
    @DisplayName("Creates a payment link carrying tx_ref and purchase metadata")
    void createsPaymentLink() {
        wireMockServer.stubFor(post(urlEqualTo("/v3/payments"))
                .willReturn(okJson("{\"status\":\"success\",\"message\":\"Hosted Link\","
                        + "\"data\":{\"link\":\"https://checkout.flutterwave.com/v3/hosted/pay/abc\"}}")));

        String url = gateway.createSession(GatewayCheckoutRequest.builder()
                .plan(PlanTier.BUSINESS)
                .interval(BillingInterval.MONTHLY)
                .currency(CurrencyCode.KES)
                .amount(new BigDecimal("3600.00"))
                .reference("business_u2_1700000000000")
                .email("buyer@example.com")
                .successUrl("https://app.example.com/billing/success?reference=business_u2_1700000000000")
                .cancelUrl("https://app.example.com/billing")
                .paymentMethod(PaymentMethod.MOBILE_MONEY)
                .metadata(Map.of("userId", "u2", "planId", "business", "billingInterval", "monthly"))
                .build());

        assertThat(url).isEqualTo("https://checkout.flutterwave.com/v3/hosted/pay/abc");
        wireMockServer.verify(postRequestedFor(urlEqualTo("/v3/payments"))
                .withHeader("Authorization", equalTo("Bearer FLWSECK_TEST-1"))
                .withRequestBody(matchingJsonPath("$.tx_ref", equalTo("business_u2_1700000000000")))
                .withRequestBody(matchingJsonPath("$.amount", equalTo("3600.00")))
                .withRequestBody(matchingJsonPath("$.currency", equalTo("KES")))
                .withRequestBody(matchingJsonPath("$.meta.planId", equalTo("business")))
                .withRequestBody(matchingJsonPath("$.customer.email", equalTo("buyer@example.com"))));
    }
}
