package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.billingrecon.features.billing.application.EntitlementStore;
import uk.gegc.billingrecon.features.billing.application.EntitlementUpdater;
import uk.gegc.billingrecon.features.billing.application.SubscriptionStore;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EntitlementUpdaterImpl implements EntitlementUpdater {

    private final EntitlementStore entitlementStore;
    private final SubscriptionStore subscriptionStore;

    @Override
    public void grant(UUID userId, PlanTier plan, Instant now) {
        entitlementStore.upsertTier(userId, plan, now);
        log.info("User {} entitled to {}", userId, plan.getCode());
    }

    @Override
    public PlanTier recompute(UUID userId, Instant now) {
        PlanTier tier = subscriptionStore.findLatestLivePlan(userId, now).orElse(PlanTier.FREE);
        entitlementStore.upsertTier(userId, tier, now);
        log.info("User {} entitlement recomputed to {}", userId, tier.getCode());
        return tier;
    }
}
