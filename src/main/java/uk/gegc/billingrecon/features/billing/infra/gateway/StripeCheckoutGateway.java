package uk.gegc.billingrecon.features.billing.infra.gateway;

import com.stripe.exception.StripeException;
import com.stripe.model.checkout.Session;
import com.stripe.net.RequestOptions;
import com.stripe.param.checkout.SessionCreateParams;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.CheckoutGateway;
import uk.gegc.billingrecon.features.billing.application.CredentialNames;
import uk.gegc.billingrecon.features.billing.application.CredentialResolver;
import uk.gegc.billingrecon.features.billing.application.GatewayCheckoutRequest;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.Locale;

/**
 * Stripe Checkout with an inline price: subscription mode for monthly and yearly, a one-off
 * payment for trials. Metadata is copied onto the subscription or payment intent as well so
 * later subscription events carry it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StripeCheckoutGateway implements CheckoutGateway {

    private final CredentialResolver credentialResolver;
    private final StripeClientFactory stripeClientFactory;

    @Override
    public PaymentProvider provider() {
        return PaymentProvider.STRIPE;
    }

    @Override
    public boolean isConfigured() {
        return credentialResolver.isPresent(CredentialNames.STRIPE_SECRET_KEY);
    }

    @Override
    public String createSession(GatewayCheckoutRequest request) {
        String secret = credentialResolver.resolve(CredentialNames.STRIPE_SECRET_KEY)
                .orElseThrow(() -> new BillingConfigurationException("STRIPE_SECRET_KEY is not configured"));

        SessionCreateParams params = buildParams(request);
        RequestOptions options = request.idempotencyKey() != null
                ? RequestOptions.builder().setIdempotencyKey(request.idempotencyKey()).build()
                : RequestOptions.getDefault();

        try {
            Session session = stripeClientFactory.forKey(secret).checkout().sessions().create(params, options);
            log.info("Created Stripe Checkout session id={} for reference={}", session.getId(), request.reference());
            return session.getUrl();
        } catch (StripeException e) {
            log.error("Failed to create Stripe Checkout session for reference={}: {}", request.reference(), e.getMessage());
            throw new ProviderUnavailableException("Stripe session creation failed", e);
        }
    }

    SessionCreateParams buildParams(GatewayCheckoutRequest request) {
        boolean recurring = request.interval() != BillingInterval.TRIAL;

        SessionCreateParams.LineItem.PriceData.Builder price = SessionCreateParams.LineItem.PriceData.builder()
                .setCurrency(request.currency().name().toLowerCase(Locale.ROOT))
                .setUnitAmount(request.minorAmount())
                .setProductData(SessionCreateParams.LineItem.PriceData.ProductData.builder()
                        .setName(request.plan().displayName())
                        .build());
        if (recurring) {
            price.setRecurring(SessionCreateParams.LineItem.PriceData.Recurring.builder()
                    .setInterval(request.interval() == BillingInterval.YEARLY
                            ? SessionCreateParams.LineItem.PriceData.Recurring.Interval.YEAR
                            : SessionCreateParams.LineItem.PriceData.Recurring.Interval.MONTH)
                    .build());
        }

        SessionCreateParams.Builder params = SessionCreateParams.builder()
                .setMode(recurring ? SessionCreateParams.Mode.SUBSCRIPTION : SessionCreateParams.Mode.PAYMENT)
                .setSuccessUrl(request.successUrl())
                .setCancelUrl(request.cancelUrl())
                .setCustomerEmail(request.email())
                .setClientReferenceId(request.reference())
                .putAllMetadata(request.metadata())
                .addLineItem(SessionCreateParams.LineItem.builder()
                        .setQuantity(1L)
                        .setPriceData(price.build())
                        .build());

        if (recurring) {
            params.setSubscriptionData(SessionCreateParams.SubscriptionData.builder()
                    .putAllMetadata(request.metadata())
                    .build());
        } else {
            params.setPaymentIntentData(SessionCreateParams.PaymentIntentData.builder()
                    .putAllMetadata(request.metadata())
                    .build());
        }
        return params.build();
    }
}
