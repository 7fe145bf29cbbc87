package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.time.Instant;
import java.util.UUID;

public interface EntitlementUpdater {

    void grant(UUID userId, PlanTier plan, Instant now);

    /**
     * Sets the tier from the user's remaining live subscriptions, falling back to free.
     *
     * @return the tier now in effect
     */
    PlanTier recompute(UUID userId, Instant now);
}
