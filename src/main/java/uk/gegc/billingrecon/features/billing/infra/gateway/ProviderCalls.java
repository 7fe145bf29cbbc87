package uk.gegc.billingrecon.features.billing.infra.gateway;

import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import uk.gegc.billingrecon.features.billing.domain.exception.ProviderUnavailableException;
import uk.gegc.billingrecon.features.billing.domain.exception.WebhookAuthorizationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.function.Supplier;

/**
 * Maps HTTP client failures of a provider call to billing exceptions.
 * Transport failures and 5xx are retryable, 4xx means the provider does not vouch for the transaction.
 */
final class ProviderCalls {

    private ProviderCalls() {
    }

    static <T> T verifyCall(PaymentProvider provider, String what, Supplier<T> call) {
        try {
            return call.get();
        } catch (ResourceAccessException | HttpServerErrorException e) {
            throw new ProviderUnavailableException(provider.getCode() + " unavailable while verifying " + what, e);
        } catch (HttpClientErrorException e) {
            throw new WebhookAuthorizationException(
                    provider.getCode() + " did not confirm " + what + " (HTTP " + e.getStatusCode().value() + ")", e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(provider.getCode() + " returned an unreadable response for " + what, e);
        }
    }

    static <T> T checkoutCall(PaymentProvider provider, Supplier<T> call) {
        try {
            return call.get();
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(provider.getCode() + " unavailable while creating checkout", e);
        }
    }
}
