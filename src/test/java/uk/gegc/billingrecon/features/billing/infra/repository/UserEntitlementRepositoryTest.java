package uk.gegc.billingrecon.features.billing.infra.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.UserEntitlement;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("UserEntitlementRepository against MySQL")
class UserEntitlementRepositoryTest extends MySqlRepositoryTestSupport {

    @Autowired
    private UserEntitlementRepository repository;

    @Test
    @DisplayName("upsertTier inserts once and then overwrites the tier in place")
    void upsertTier_overwritesInPlace() {
        UUID userId = UUID.randomUUID();
        Instant first = Instant.parse("2025-03-01T00:00:00Z");
        Instant second = Instant.parse("2025-03-02T00:00:00Z");

        repository.upsertTier(userId.toString(), PlanTier.PRO.name(), first);
        repository.upsertTier(userId.toString(), PlanTier.FREE.name(), second);

        UserEntitlement stored = repository.findById(userId).orElseThrow();
        assertThat(stored.getSubscriptionTier()).isEqualTo(PlanTier.FREE);
        assertThat(stored.getUpdatedAt()).isEqualTo(second);
        assertThat(repository.count()).isEqualTo(1);
    }
}
