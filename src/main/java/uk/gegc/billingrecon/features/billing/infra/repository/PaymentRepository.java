package uk.gegc.billingrecon.features.billing.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.billingrecon.features.billing.domain.model.Payment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

public interface PaymentRepository extends JpaRepository<Payment, UUID> {

    Optional<Payment> findByProviderReference(String providerReference);

    /**
     * Insert that leaves an existing row with the same provider reference unchanged. The driver
     * reports matched rather than changed rows, so a no-op {@code ON DUPLICATE KEY UPDATE} would
     * still count 1; an ignored row counts 0.
     *
     * @return 1 when inserted, 0 when the reference was already recorded
     */
    @Modifying
    @Query(value = """
            INSERT IGNORE INTO payments (id, user_id, provider, amount, currency, status, provider_reference,
                                         provider_transaction_id, description, created_at)
            VALUES (:id, :userId, :provider, :amount, :currency, :status, :reference,
                    :transactionId, :description, :createdAt)
            """, nativeQuery = true)
    int insertIgnoringDuplicate(@Param("id") String id,
                                @Param("userId") String userId,
                                @Param("provider") String provider,
                                @Param("amount") BigDecimal amount,
                                @Param("currency") String currency,
                                @Param("status") String status,
                                @Param("reference") String reference,
                                @Param("transactionId") String transactionId,
                                @Param("description") String description,
                                @Param("createdAt") Instant createdAt);
}
