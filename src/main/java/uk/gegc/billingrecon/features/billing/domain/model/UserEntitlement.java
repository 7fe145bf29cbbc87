package uk.gegc.billingrecon.features.billing.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

/**
 * Denormalized plan tier per user, read by the feature gate.
 */
@Entity
@Table(name = "user_entitlements")
@Getter
@Setter
public class UserEntitlement {

    @Id
    @JdbcTypeCode(SqlTypes.CHAR)
    @Column(name = "user_id", nullable = false, updatable = false, length = 36)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 16)
    private PlanTier subscriptionTier;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
