package uk.gegc.billingrecon.features.billing.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.WebhookDelivery;
import uk.gegc.billingrecon.features.billing.application.WebhookEventRouter;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException;
import uk.gegc.billingrecon.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.shared.config.SecurityConfig;
import uk.gegc.billingrecon.shared.exception.RateLimitExceededException;
import uk.gegc.billingrecon.shared.ratelimit.RateLimitService;
import uk.gegc.billingrecon.shared.security.JwtTokenService;
import uk.gegc.billingrecon.shared.util.TrustedProxyUtil;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = PaymentWebhookController.class)
@Import({SecurityConfig.class, TrustedProxyUtil.class})
@ActiveProfiles("test")
class PaymentWebhookControllerWebMvcTest {

    private static final String PAYSTACK_BODY = "{\"event\":\"charge.success\",\"data\":{\"reference\":\"pro_ref_1\"}}";

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WebhookEventRouter webhookEventRouter;

    @MockitoBean
    private RateLimitService rateLimitService;

    @MockitoBean
    private BillingProperties billingProperties;

    @MockitoBean
    private JwtTokenService jwtTokenService;

    @BeforeEach
    void setUp() {
        BillingProperties.Webhook webhook = new BillingProperties.Webhook();
        webhook.setMaxPayloadBytes(256);
        webhook.setRateLimitPerMinute(100);
        when(billingProperties.getWebhook()).thenReturn(webhook);
    }

    @Test
    @DisplayName("Authentic delivery is acknowledged with the raw body passed through unchanged")
    void validDelivery_returns200() throws Exception {
        when(webhookEventRouter.route(any(), any())).thenReturn(WebhookEventRouter.Result.PROCESSED);

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .header("x-paystack-signature", "abc")
                        .content(PAYSTACK_BODY))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.received").value(true));

        ArgumentCaptor<WebhookDelivery> captor = ArgumentCaptor.forClass(WebhookDelivery.class);
        verify(webhookEventRouter).route(eq(PaymentProvider.PAYSTACK), captor.capture());
        assertThat(new String(captor.getValue().body(), StandardCharsets.UTF_8)).isEqualTo(PAYSTACK_BODY);
        assertThat(captor.getValue().headers().getFirst("x-paystack-signature")).isEqualTo("abc");
    }

    @Test
    @DisplayName("Ignored event is still acknowledged")
    void ignoredEvent_returns200() throws Exception {
        when(webhookEventRouter.route(any(), any())).thenReturn(WebhookEventRouter.Result.IGNORED);

        mockMvc.perform(post("/api/v1/billing/webhooks/flutterwave")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"event\":\"transfer.completed\"}"))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("Signature failure returns 400 problem detail")
    void signatureFailure_returns400() throws Exception {
        when(webhookEventRouter.route(any(), any())).thenThrow(new WebhookAuthorizationException("Invalid signature"));

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYSTACK_BODY))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.type").value("https://billing.gegc.uk/docs/errors/webhook-authorization-failed"))
                .andExpect(jsonPath("$.error").value("Invalid signature"));
    }

    @Test
    @DisplayName("Unknown subscription code returns 404")
    void unknownSubscription_returns404() throws Exception {
        when(webhookEventRouter.route(any(), any())).thenThrow(new SubscriptionNotFoundException("SUB_missing"));

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYSTACK_BODY))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Missing secret and provider outage both return 500 so the provider retries")
    void serverSideFailures_return500() throws Exception {
        when(webhookEventRouter.route(any(), any()))
                .thenThrow(new BillingConfigurationException("PAYSTACK_SECRET_KEY is not configured"))
                .thenThrow(new ProviderUnavailableException("Paystack verify timed out"));

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYSTACK_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://billing.gegc.uk/docs/errors/billing-configuration-error"));

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYSTACK_BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.type").value("https://billing.gegc.uk/docs/errors/provider-unavailable"));
    }

    @Test
    @DisplayName("Oversized body is rejected before routing")
    void oversizedBody_returns413() throws Exception {
        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("x".repeat(257)))
                .andExpect(status().isPayloadTooLarge());

        verifyNoInteractions(webhookEventRouter);
    }

    @Test
    @DisplayName("Stripe delivery that is not JSON returns 415")
    void stripeNonJson_returns415() throws Exception {
        mockMvc.perform(post("/api/v1/billing/webhooks/stripe")
                        .contentType(MediaType.TEXT_PLAIN)
                        .header("Stripe-Signature", "t=1,v1=abc")
                        .content("{}"))
                .andExpect(status().isUnsupportedMediaType());

        verifyNoInteractions(webhookEventRouter);
    }

    @Test
    @DisplayName("Rate limited caller gets 429 with Retry-After")
    void rateLimited_returns429() throws Exception {
        doThrow(new RateLimitExceededException("Too many requests for webhook", 42))
                .when(rateLimitService).checkRateLimit(eq("webhook"), anyString(), anyInt());

        mockMvc.perform(post("/api/v1/billing/webhooks/paystack")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(PAYSTACK_BODY))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "42"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(42));

        verifyNoInteractions(webhookEventRouter);
    }
}
