package uk.gegc.billingrecon.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.billingrecon.features.billing.domain.model.UserEntitlement;

import java.time.Instant;
import java.util.UUID;

public interface UserEntitlementRepository extends JpaRepository<UserEntitlement, UUID> {

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query(value = """
            INSERT INTO user_entitlements (user_id, subscription_tier, updated_at)
            VALUES (:userId, :tier, :now)
            ON DUPLICATE KEY UPDATE
                subscription_tier = VALUES(subscription_tier),
                updated_at = VALUES(updated_at)
            """, nativeQuery = true)
    int upsertTier(@Param("userId") String userId, @Param("tier") String tier, @Param("now") Instant now);
}
