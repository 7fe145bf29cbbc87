package uk.gegc.billingrecon.features.billing.application;

import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingConfigurationException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class TransactionReverifierRegistry {

    private final Map<PaymentProvider, TransactionReverifier> reverifiers = new EnumMap<>(PaymentProvider.class);

    public TransactionReverifierRegistry(List<TransactionReverifier> reverifiers) {
        reverifiers.forEach(reverifier -> this.reverifiers.put(reverifier.provider(), reverifier));
    }

    public Optional<TransactionReverifier> find(PaymentProvider provider) {
        return Optional.ofNullable(reverifiers.get(provider));
    }

    public TransactionReverifier require(PaymentProvider provider) {
        return find(provider).orElseThrow(() -> new BillingConfigurationException(
                "No transaction verifier registered for " + provider.getCode()));
    }
}
