package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.billingrecon.features.billing.application.BillingMetricsService;
import uk.gegc.billingrecon.features.billing.application.CredentialResolver;
import uk.gegc.billingrecon.features.billing.application.ProviderWebhookHandler;
import uk.gegc.billingrecon.features.billing.application.SignatureVerifier;
import uk.gegc.billingrecon.features.billing.application.WebhookDelivery;
import uk.gegc.billingrecon.features.billing.application.WebhookEventRouter;
import uk.gegc.billingrecon.features.billing.application.WebhookLoggingContext;
import uk.gegc.billingrecon.features.billing.application.WebhookSignature;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
public class WebhookEventRouterImpl implements WebhookEventRouter {

    private final Map<PaymentProvider, SignatureVerifier> verifiers = new EnumMap<>(PaymentProvider.class);
    private final Map<PaymentProvider, ProviderWebhookHandler> handlers = new EnumMap<>(PaymentProvider.class);
    private final CredentialResolver credentialResolver;
    private final BillingMetricsService metricsService;

    public WebhookEventRouterImpl(List<SignatureVerifier> verifiers,
                                  List<ProviderWebhookHandler> handlers,
                                  CredentialResolver credentialResolver,
                                  BillingMetricsService metricsService) {
        verifiers.forEach(verifier -> this.verifiers.put(verifier.provider(), verifier));
        handlers.forEach(handler -> this.handlers.put(handler.provider(), handler));
        this.credentialResolver = credentialResolver;
        this.metricsService = metricsService;
    }

    @Override
    public Result route(PaymentProvider provider, WebhookDelivery delivery) {
        long startTime = System.currentTimeMillis();
        WebhookLoggingContext context = WebhookLoggingContext.builder()
                .provider(provider.getCode())
                .build();
        metricsService.incrementWebhookReceived(provider);

        try {
            authenticate(provider, delivery);

            ProviderWebhookHandler handler = handlers.get(provider);
            if (handler == null) {
                throw new BillingConfigurationException("No webhook handler registered for " + provider.getCode());
            }
            Result result = handler.handle(delivery.body(), context);

            if (result == Result.IGNORED) {
                metricsService.incrementWebhookIgnored(provider, context.eventTypeOrUnknown());
                context.logInfo(log, "Acknowledged {} webhook without changes", provider.getCode());
            } else {
                metricsService.incrementWebhookOk(provider, context.eventTypeOrUnknown());
                context.logInfo(log, "Processed {} webhook", provider.getCode());
            }
            return result;
        } catch (RuntimeException e) {
            metricsService.incrementWebhookFailed(provider, context.eventTypeOrUnknown(), e.getClass().getSimpleName());
            if (e instanceof BillingValidationException || e instanceof WebhookAuthorizationException) {
                context.logWarn(log, "Rejected {} webhook: {}", provider.getCode(), e.getMessage());
            } else {
                context.logError(log, "Failed to process " + provider.getCode() + " webhook", e);
            }
            throw e;
        } finally {
            metricsService.recordWebhookLatency(provider, context.eventTypeOrUnknown(), System.currentTimeMillis() - startTime);
        }
    }

    private void authenticate(PaymentProvider provider, WebhookDelivery delivery) {
        if (delivery.body() == null || delivery.body().length == 0) {
            throw new BillingValidationException("Missing body");
        }
        SignatureVerifier verifier = verifiers.get(provider);
        if (verifier == null) {
            throw new BillingConfigurationException("No signature verifier registered for " + provider.getCode());
        }
        String secret = credentialResolver.resolveFirst(verifier.secretNames())
                .orElseThrow(() -> new BillingConfigurationException(
                        "Webhook secret not configured for " + provider.getCode()));
        WebhookSignature signature = verifier.extractSignature(delivery.headers())
                .orElseThrow(() -> new BillingValidationException("Missing signature"));
        if (!verifier.isValid(delivery.body(), signature, secret)) {
            throw new WebhookAuthorizationException("Invalid signature");
        }
    }
}
