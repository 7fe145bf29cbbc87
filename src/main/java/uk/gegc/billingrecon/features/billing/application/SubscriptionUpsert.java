package uk.gegc.billingrecon.features.billing.application;

import lombok.Builder;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Field set a successful charge owns on its subscription row.
 *
 * @param id              row id used only when the upsert inserts
 * @param chargeReference provider reference of the charge; a repeat of the last applied one changes nothing
 */
@Builder
public record SubscriptionUpsert(
        UUID id,
        UUID userId,
        PaymentProvider provider,
        PlanTier plan,
        SubscriptionStatus status,
        String subscriptionCode,
        String customerCode,
        String authorizationCode,
        Instant periodStart,
        Instant periodEnd,
        boolean cancelAtPeriodEnd,
        String chargeReference,
        Instant now
) {
}
