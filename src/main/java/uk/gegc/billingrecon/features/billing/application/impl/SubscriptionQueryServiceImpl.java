package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.billingrecon.features.billing.application.EntitlementStore;
import uk.gegc.billingrecon.features.billing.application.SubscriptionQueryService;
import uk.gegc.billingrecon.features.billing.application.SubscriptionStore;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class SubscriptionQueryServiceImpl implements SubscriptionQueryService {

    private final EntitlementStore entitlementStore;
    private final SubscriptionStore subscriptionStore;

    @Override
    @Transactional(readOnly = true)
    public SubscriptionOverview getOverview(UUID userId) {
        PlanTier tier = entitlementStore.findTier(userId).orElse(PlanTier.FREE);
        return new SubscriptionOverview(tier, subscriptionStore.findLatestForUser(userId));
    }
}
