package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.CheckoutGateway;
import uk.gegc.billingrecon.features.billing.application.CheckoutSessionCommand;
import uk.gegc.billingrecon.features.billing.application.CheckoutSessionService;
import uk.gegc.billingrecon.features.billing.application.CurrencyCountryDetector;
import uk.gegc.billingrecon.features.billing.application.GatewayCheckoutRequest;
import uk.gegc.billingrecon.features.billing.application.IssuedCheckoutSession;
import uk.gegc.billingrecon.features.billing.application.PlanPricing;
import uk.gegc.billingrecon.features.billing.application.ProviderRecommender;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedCheckoutException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CheckoutSessionServiceImpl implements CheckoutSessionService {

    private final Map<PaymentProvider, CheckoutGateway> gateways = new EnumMap<>(PaymentProvider.class);
    private final CurrencyCountryDetector currencyCountryDetector;
    private final ProviderRecommender providerRecommender;
    private final PlanPricing planPricing;
    private final BillingProperties billingProperties;
    private final Clock clock;

    public CheckoutSessionServiceImpl(List<CheckoutGateway> gateways,
                                      CurrencyCountryDetector currencyCountryDetector,
                                      ProviderRecommender providerRecommender,
                                      PlanPricing planPricing,
                                      BillingProperties billingProperties,
                                      Clock clock) {
        gateways.forEach(gateway -> this.gateways.put(gateway.provider(), gateway));
        this.currencyCountryDetector = currencyCountryDetector;
        this.providerRecommender = providerRecommender;
        this.planPricing = planPricing;
        this.billingProperties = billingProperties;
        this.clock = clock;
    }

    @Override
    public IssuedCheckoutSession createSession(CheckoutSessionCommand command) {
        PlanTier plan = PlanTier.paidFromCode(command.planId())
                .orElseThrow(() -> new UnsupportedCheckoutException("Invalid plan ID or free plan selected"));
        if (!StringUtils.hasText(command.email())) {
            throw new BillingValidationException("Email is required");
        }
        if (!StringUtils.hasText(command.successUrl()) || !StringUtils.hasText(command.cancelUrl())) {
            throw new BillingValidationException("successUrl and cancelUrl are required");
        }
        BillingInterval interval = BillingInterval.normalize(command.billingInterval());
        PaymentMethod method = StringUtils.hasText(command.paymentMethod())
                ? PaymentMethod.fromCode(command.paymentMethod()).orElseThrow(() ->
                        new UnsupportedCheckoutException("Unsupported payment method: " + command.paymentMethod()))
                : PaymentMethod.CARD;

        CurrencyCountryDetector.Detection detection =
                currencyCountryDetector.detect(command.headers(), command.countryCode(), command.currency());

        CheckoutGateway gateway = selectGateway(command.provider(), detection);
        PaymentProvider provider = gateway.provider();
        if (!provider.supports(method)) {
            throw new UnsupportedCheckoutException(
                    "Selected provider does not support payment method: " + method.getCode());
        }

        BigDecimal amount = planPricing.priceFor(plan, interval, detection.currency());
        String userKey = command.userId() != null
                ? command.userId().toString()
                : "guest_" + clock.millis();
        String reference = plan.getCode() + "_" + userKey + "_" + clock.millis();

        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("userId", userKey);
        metadata.put("planId", plan.getCode());
        metadata.put("billingInterval", interval.getCode());
        metadata.put("userEmail", command.email().trim());
        metadata.put("provider", provider.getCode());
        metadata.put("paymentMethod", method.getCode());
        metadata.put("currency", detection.currency().name());
        metadata.put("countryCode", detection.countryCode());

        GatewayCheckoutRequest request = GatewayCheckoutRequest.builder()
                .plan(plan)
                .interval(interval)
                .currency(detection.currency())
                .amount(amount)
                .reference(reference)
                .email(command.email().trim())
                .successUrl(appendReference(command.successUrl(), reference))
                .cancelUrl(command.cancelUrl())
                .paymentMethod(method)
                .metadata(metadata)
                .idempotencyKey(StringUtils.hasText(command.idempotencyKey()) ? command.idempotencyKey().trim() : null)
                .build();

        String url = gateway.createSession(request);
        log.info("Issued {} checkout {} for plan {} ({}) in {} {}", provider.getCode(), reference,
                plan.getCode(), interval.getCode(), amount, detection.currency());
        return new IssuedCheckoutSession(provider, reference, url, billingProperties.isTestMode());
    }

    private CheckoutGateway selectGateway(String requestedProvider, CurrencyCountryDetector.Detection detection) {
        List<CheckoutGateway> available = gateways.values().stream()
                .filter(CheckoutGateway::isConfigured)
                .toList();

        if (StringUtils.hasText(requestedProvider)) {
            PaymentProvider requested = PaymentProvider.fromCode(requestedProvider).orElse(null);
            return available.stream()
                    .filter(gateway -> gateway.provider() == requested)
                    .findFirst()
                    .orElseThrow(() -> new UnsupportedCheckoutException("Unsupported provider. Allowed: "
                            + available.stream().map(g -> g.provider().getCode()).collect(Collectors.joining(", "))));
        }

        if (available.isEmpty()) {
            throw new BillingConfigurationException("No payment provider is configured");
        }
        PaymentProvider recommended = providerRecommender.recommend(detection.currency());
        return available.stream()
                .filter(gateway -> gateway.provider() == recommended)
                .findFirst()
                .orElse(available.get(0));
    }

    static String appendReference(String url, String reference) {
        return UriComponentsBuilder.fromUriString(url)
                .replaceQueryParam("reference", reference)
                .build()
                .toUriString();
    }
}
