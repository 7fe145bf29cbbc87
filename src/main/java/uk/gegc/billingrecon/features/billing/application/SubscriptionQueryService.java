package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;

import java.util.Optional;
import java.util.UUID;

public interface SubscriptionQueryService {

    record SubscriptionOverview(PlanTier tier, Optional<Subscription> latest) {
    }

    SubscriptionOverview getOverview(UUID userId);
}
