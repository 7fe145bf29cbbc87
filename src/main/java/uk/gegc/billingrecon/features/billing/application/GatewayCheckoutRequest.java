package uk.gegc.billingrecon.features.billing.application;

import lombok.Builder;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentMethod;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * @param amount     major units
 * @param successUrl already carries the {@code reference} query parameter
 * @param metadata   echoed back by the provider on the charge
 */
@Builder
public record GatewayCheckoutRequest(
        PlanTier plan,
        BillingInterval interval,
        CurrencyCode currency,
        BigDecimal amount,
        String reference,
        String email,
        String successUrl,
        String cancelUrl,
        PaymentMethod paymentMethod,
        Map<String, String> metadata,
        String idempotencyKey
) {

    public long minorAmount() {
        return amount.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }
}
