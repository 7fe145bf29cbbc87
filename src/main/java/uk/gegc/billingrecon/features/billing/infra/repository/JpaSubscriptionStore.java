package uk.gegc.billingrecon.features.billing.infra.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.application.SubscriptionStore;
import uk.gegc.billingrecon.features.billing.application.SubscriptionUpsert;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class JpaSubscriptionStore implements SubscriptionStore {

    private static final EnumSet<SubscriptionStatus> LIVE = EnumSet.of(SubscriptionStatus.TRIALING, SubscriptionStatus.ACTIVE);

    private final SubscriptionRepository subscriptionRepository;

    @Override
    public void upsertFromCharge(SubscriptionUpsert upsert) {
        subscriptionRepository.upsertFromCharge(
                upsert.id().toString(),
                upsert.userId().toString(),
                upsert.provider().name(),
                upsert.plan().name(),
                upsert.status().name(),
                upsert.subscriptionCode(),
                upsert.customerCode(),
                upsert.authorizationCode(),
                upsert.periodStart(),
                upsert.periodEnd(),
                upsert.cancelAtPeriodEnd(),
                upsert.chargeReference(),
                upsert.now());
    }

    @Override
    public Optional<Subscription> findByCode(String subscriptionCode) {
        return subscriptionRepository.findByProviderSubscriptionCode(subscriptionCode);
    }

    @Override
    public int updateStatus(String subscriptionCode, SubscriptionStatus status, Instant now) {
        return subscriptionRepository.updateStatus(subscriptionCode, status, now);
    }

    @Override
    public int markPastDue(String subscriptionCode, Instant now) {
        return subscriptionRepository.markPastDue(subscriptionCode, now);
    }

    @Override
    public int markCancelAtPeriodEnd(String subscriptionCode, Instant now) {
        return subscriptionRepository.markCancelAtPeriodEnd(subscriptionCode, now);
    }

    @Override
    public Optional<PlanTier> findLatestLivePlan(UUID userId, Instant now) {
        return subscriptionRepository
                .findFirstByUserIdAndStatusInAndCurrentPeriodEndAfterOrderByUpdatedAtDesc(userId, LIVE, now)
                .map(Subscription::getPlan);
    }

    @Override
    public Optional<Subscription> findLatestForUser(UUID userId) {
        return subscriptionRepository.findFirstByUserIdOrderByUpdatedAtDesc(userId);
    }
}
