package uk.gegc.billingrecon.features.billing.application;

import lombok.Builder;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import java.math.BigDecimal;

/**
 * A transaction as reported by the provider's own API, after the status and reference checks.
 * Amounts are in the major unit.
 */
@Builder
public record VerifiedTransaction(
        PaymentProvider provider,
        String reference,
        String transactionId,
        BigDecimal amount,
        String currency,
        ChargeMetadata metadata,
        String planCode,
        String subscriptionCode,
        String customerCode,
        String authorizationCode
) {
}
