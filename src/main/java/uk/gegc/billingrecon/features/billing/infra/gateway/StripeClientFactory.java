package uk.gegc.billingrecon.features.billing.infra.gateway;

import com.stripe.StripeClient;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Typed Stripe clients per secret key. The key comes from the credential resolver at call
 * time, so rotating it does not need a restart.
 */
@Component
public class StripeClientFactory {

    private final Map<String, StripeClient> clients = new ConcurrentHashMap<>();

    public StripeClient forKey(String secretKey) {
        return clients.computeIfAbsent(secretKey, StripeClient::new);
    }
}
