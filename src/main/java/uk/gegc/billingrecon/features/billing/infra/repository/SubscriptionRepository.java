package uk.gegc.billingrecon.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

public interface SubscriptionRepository extends JpaRepository<Subscription, UUID> {

    Optional<Subscription> findByProviderSubscriptionCode(String providerSubscriptionCode);

    Optional<Subscription> findFirstByUserIdAndStatusInAndCurrentPeriodEndAfterOrderByUpdatedAtDesc(
            UUID userId, Collection<SubscriptionStatus> statuses, Instant periodEndAfter);

    Optional<Subscription> findFirstByUserIdOrderByUpdatedAtDesc(UUID userId);

    /**
     * Single-statement upsert. MySQL applies the assignments left to right: {@code status} is
     * assigned after every data column and {@code last_charge_reference} last, so each data
     * column still sees the stored status and reference. A canceled row, or a row whose last
     * applied charge carries the same reference, keeps all of its values.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            INSERT INTO subscriptions (id, user_id, provider, plan, status, provider_subscription_code,
                                       provider_customer_code, provider_authorization_code,
                                       current_period_start, current_period_end, cancel_at_period_end,
                                       last_charge_reference, created_at, updated_at)
            VALUES (:id, :userId, :provider, :plan, :status, :code,
                    :customerCode, :authorizationCode,
                    :periodStart, :periodEnd, :cancelAtPeriodEnd,
                    :chargeReference, :now, :now)
            ON DUPLICATE KEY UPDATE
                user_id = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(user_id), user_id),
                provider = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(provider), provider),
                plan = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(plan), plan),
                provider_customer_code = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    COALESCE(VALUES(provider_customer_code), provider_customer_code), provider_customer_code),
                provider_authorization_code = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    COALESCE(VALUES(provider_authorization_code), provider_authorization_code), provider_authorization_code),
                current_period_start = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(current_period_start), current_period_start),
                current_period_end = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    GREATEST(current_period_end, VALUES(current_period_end)), current_period_end),
                cancel_at_period_end = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(cancel_at_period_end), cancel_at_period_end),
                updated_at = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(updated_at), updated_at),
                status = IF(status <> 'CANCELED' AND NOT (last_charge_reference <=> VALUES(last_charge_reference)),
                    VALUES(status), status),
                last_charge_reference = IF(status = 'CANCELED', last_charge_reference, VALUES(last_charge_reference))
            """, nativeQuery = true)
    int upsertFromCharge(@Param("id") String id,
                         @Param("userId") String userId,
                         @Param("provider") String provider,
                         @Param("plan") String plan,
                         @Param("status") String status,
                         @Param("code") String code,
                         @Param("customerCode") String customerCode,
                         @Param("authorizationCode") String authorizationCode,
                         @Param("periodStart") Instant periodStart,
                         @Param("periodEnd") Instant periodEnd,
                         @Param("cancelAtPeriodEnd") boolean cancelAtPeriodEnd,
                         @Param("chargeReference") String chargeReference,
                         @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Subscription s set s.status = :status, s.updatedAt = :now " +
            "where s.providerSubscriptionCode = :code")
    int updateStatus(@Param("code") String code, @Param("status") SubscriptionStatus status, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Subscription s set s.status = uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus.PAST_DUE, " +
            "s.updatedAt = :now " +
            "where s.providerSubscriptionCode = :code " +
            "and s.status <> uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus.CANCELED")
    int markPastDue(@Param("code") String code, @Param("now") Instant now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("update Subscription s set s.cancelAtPeriodEnd = true, s.updatedAt = :now " +
            "where s.providerSubscriptionCode = :code")
    int markCancelAtPeriodEnd(@Param("code") String code, @Param("now") Instant now);
}
