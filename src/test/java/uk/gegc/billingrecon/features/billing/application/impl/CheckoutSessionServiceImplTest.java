package uk.gegc.billingrecon.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.CheckoutGateway;
import uk.gegc.billingrecon.features.billing.application.CheckoutSessionCommand;
import uk.gegc.billingrecon.features.billing.application.CurrencyCountryDetector;
import uk.gegc.billingrecon.features.billing.application.GatewayCheckoutRequest;
import uk.gegc.billingrecon.features.billing.application.IssuedCheckoutSession;
import uk.gegc.billingrecon.features.billing.application.PlanPricing;
import uk.gegc.billingrecon.features.billing.application.ProviderRecommender;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedCheckoutException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckoutSessionServiceImplTest {

    private static final Instant NOW = Instant.parse("2024-11-14T22:13:20Z");

    private RecordingGateway stripe;
    private RecordingGateway paystack;
    private RecordingGateway flutterwave;
    private CheckoutSessionServiceImpl service;

    @BeforeEach
    void setUp() {
        stripe = new RecordingGateway(PaymentProvider.STRIPE);
        paystack = new RecordingGateway(PaymentProvider.PAYSTACK);
        flutterwave = new RecordingGateway(PaymentProvider.FLUTTERWAVE);
        service = new CheckoutSessionServiceImpl(
                List.of(stripe, paystack, flutterwave),
                new CurrencyCountryDetector(),
                new ProviderRecommender(),
                new PlanPricing(10d, null),
                new BillingProperties(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static CheckoutSessionCommand.CheckoutSessionCommandBuilder command() {
        return CheckoutSessionCommand.builder()
                .userId(UUID.fromString("6f1c1b1e-1f55-4c7a-9a0e-0d6c1e2f3a4b"))
                .email("buyer@example.com")
                .planId("pro")
                .billingInterval("monthly")
                .successUrl("https://app.example.com/billing/success?session=1")
                .cancelUrl("https://app.example.com/billing")
                .headers(new HttpHeaders());
    }

    @Nested
    @DisplayName("Provider and currency selection")
    class SelectionTests {

        @Test
        @DisplayName("Nigerian buyer goes to Paystack in NGN")
        void nigerianBuyer_paystack() {
            IssuedCheckoutSession session = service.createSession(command().countryCode("NG").build());

            assertThat(session.provider()).isEqualTo(PaymentProvider.PAYSTACK);
            GatewayCheckoutRequest request = paystack.lastRequest;
            assertThat(request.currency()).isEqualTo(CurrencyCode.NGN);
            assertThat(request.amount()).isEqualByComparingTo(new BigDecimal("15000"));
        }

        @Test
        @DisplayName("Recommended provider that is not configured falls back to a configured one")
        void recommendedNotConfigured_fallsBack() {
            paystack.configured = false;

            IssuedCheckoutSession session = service.createSession(command().countryCode("NG").build());

            assertThat(session.provider()).isNotEqualTo(PaymentProvider.PAYSTACK);
        }

        @Test
        @DisplayName("Explicit provider is honoured when configured")
        void explicitProvider_used() {
            IssuedCheckoutSession session = service.createSession(command().provider("stripe").currency("USD").build());

            assertThat(session.provider()).isEqualTo(PaymentProvider.STRIPE);
            assertThat(stripe.lastRequest.amount()).isEqualByComparingTo(new BigDecimal("9.99"));
        }

        @Test
        @DisplayName("Explicit provider that is not configured is rejected with the allowed list")
        void explicitProvider_notConfigured() {
            stripe.configured = false;

            assertThatThrownBy(() -> service.createSession(command().provider("stripe").build()))
                    .isInstanceOf(UnsupportedCheckoutException.class)
                    .hasMessageContaining("Allowed: paystack, flutterwave");
        }

        @Test
        @DisplayName("No configured provider is an internal configuration error")
        void noProviders_configurationError() {
            stripe.configured = false;
            paystack.configured = false;
            flutterwave.configured = false;

            assertThatThrownBy(() -> service.createSession(command().build()))
                    .isInstanceOf(BillingConfigurationException.class);
        }

        @Test
        @DisplayName("Mobile money on a card-only provider is rejected")
        void mobileMoneyOnStripe_rejected() {
            assertThatThrownBy(() -> service.createSession(command().provider("stripe").paymentMethod("mobile_money").build()))
                    .isInstanceOf(UnsupportedCheckoutException.class)
                    .hasMessageContaining("mobile_money");
        }
    }

    @Nested
    @DisplayName("Session content")
    class ContentTests {

        @Test
        @DisplayName("Metadata carries userId, planId and billingInterval for reconciliation")
        void metadata_staged() {
            service.createSession(command().billingInterval("yearly").countryCode("KE").build());

            GatewayCheckoutRequest request = flutterwave.lastRequest;
            assertThat(request.metadata())
                    .containsEntry("userId", "6f1c1b1e-1f55-4c7a-9a0e-0d6c1e2f3a4b")
                    .containsEntry("planId", "pro")
                    .containsEntry("billingInterval", "yearly")
                    .containsEntry("currency", "KES")
                    .containsEntry("countryCode", "KE");
            assertThat(request.interval()).isEqualTo(BillingInterval.YEARLY);
            assertThat(request.amount()).isEqualByComparingTo(new BigDecimal("12000"));
        }

        @Test
        @DisplayName("Reference is plan_user_millis and is added to the success URL")
        void reference_format() {
            IssuedCheckoutSession session = service.createSession(command().countryCode("NG").build());

            String expected = "pro_6f1c1b1e-1f55-4c7a-9a0e-0d6c1e2f3a4b_" + NOW.toEpochMilli();
            assertThat(session.reference()).isEqualTo(expected);
            assertThat(paystack.lastRequest.successUrl())
                    .isEqualTo("https://app.example.com/billing/success?session=1&reference=" + expected);
            assertThat(session.url()).isEqualTo("https://pay.example/paystack/" + expected);
            assertThat(session.testMode()).isTrue();
        }

        @Test
        @DisplayName("Guest checkout stages a guest key")
        void guest_stagesGuestKey() {
            service.createSession(command().userId(null).countryCode("NG").build());

            assertThat(paystack.lastRequest.metadata().get("userId")).isEqualTo("guest_" + NOW.toEpochMilli());
        }

        @Test
        @DisplayName("Unknown billing interval is treated as monthly")
        void unknownInterval_monthly() {
            service.createSession(command().billingInterval("weekly").countryCode("NG").build());

            assertThat(paystack.lastRequest.interval()).isEqualTo(BillingInterval.MONTHLY);
        }

        @Test
        @DisplayName("Payment method defaults to card")
        void paymentMethod_defaultsToCard() {
            service.createSession(command().countryCode("NG").build());

            assertThat(paystack.lastRequest.paymentMethod()).isEqualTo(PaymentMethod.CARD);
        }
    }

    @Nested
    @DisplayName("Validation")
    class ValidationTests {

        @Test
        @DisplayName("Free plan is rejected")
        void freePlan_rejected() {
            assertThatThrownBy(() -> service.createSession(command().planId("free").build()))
                    .isInstanceOf(UnsupportedCheckoutException.class)
                    .hasMessage("Invalid plan ID or free plan selected");
        }

        @Test
        @DisplayName("Missing email is rejected")
        void missingEmail_rejected() {
            assertThatThrownBy(() -> service.createSession(command().email(" ").build()))
                    .isInstanceOf(BillingValidationException.class);
        }

        @Test
        @DisplayName("Missing URLs are rejected")
        void missingUrls_rejected() {
            assertThatThrownBy(() -> service.createSession(command().cancelUrl(null).build()))
                    .isInstanceOf(BillingValidationException.class);
        }

        @Test
        @DisplayName("Unknown payment method is rejected")
        void unknownMethod_rejected() {
            assertThatThrownBy(() -> service.createSession(command().paymentMethod("crypto").build()))
                    .isInstanceOf(UnsupportedCheckoutException.class);
        }
    }

    @Test
    @DisplayName("Success URL keeps existing parameters and replaces a stale reference")
    void appendReference_replaces() {
        assertThat(CheckoutSessionServiceImpl.appendReference("https://a.example/s?x=1&reference=old", "new"))
                .isEqualTo("https://a.example/s?x=1&reference=new");
    }

    private static final class RecordingGateway implements CheckoutGateway {

        private final PaymentProvider provider;
        private boolean configured = true;
        private GatewayCheckoutRequest lastRequest;

        private RecordingGateway(PaymentProvider provider) {
            this.provider = provider;
        }

        @Override
        public PaymentProvider provider() {
            return provider;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public String createSession(GatewayCheckoutRequest request) {
            lastRequest = request;
            return "https://pay.example/" + provider.getCode() + "/" + request.reference();
        }
    }
}
