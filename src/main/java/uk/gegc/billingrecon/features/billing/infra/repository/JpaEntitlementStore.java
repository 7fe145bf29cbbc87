package uk.gegc.billingrecon.features.billing.infra.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.EntitlementStore;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.UserEntitlement;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaEntitlementStore implements EntitlementStore {

    private final UserEntitlementRepository userEntitlementRepository;

    @Override
    public void upsertTier(UUID userId, PlanTier tier, Instant now) {
        userEntitlementRepository.upsertTier(userId.toString(), tier.name(), now);
    }

    @Override
    public Optional<PlanTier> findTier(UUID userId) {
        return userEntitlementRepository.findById(userId).map(UserEntitlement::getSubscriptionTier);
    }
}
