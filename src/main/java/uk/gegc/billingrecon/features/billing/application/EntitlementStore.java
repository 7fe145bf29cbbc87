package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface EntitlementStore {

    void upsertTier(UUID userId, PlanTier tier, Instant now);

    Optional<PlanTier> findTier(UUID userId);
}
