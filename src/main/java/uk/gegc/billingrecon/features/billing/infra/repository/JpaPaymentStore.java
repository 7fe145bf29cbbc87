package uk.gegc.billingrecon.features.billing.infra.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.billingrecon.features.billing.application.PaymentStore;
import uk.gegc.billingrecon.features.billing.domain.model.Payment;

@Component
@RequiredArgsConstructor
public class JpaPaymentStore implements PaymentStore {

    private final PaymentRepository paymentRepository;

    /**
     * Runs in its own transaction so a failed insert cannot mark the caller's transaction rollback-only.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean insertIfAbsent(Payment payment) {
        int inserted = paymentRepository.insertIgnoringDuplicate(
                payment.getId().toString(),
                payment.getUserId().toString(),
                payment.getProvider().name(),
                payment.getAmount(),
                payment.getCurrency(),
                payment.getStatus().name(),
                payment.getProviderReference(),
                payment.getProviderTransactionId(),
                payment.getDescription(),
                payment.getCreatedAt());
        return inserted == 1;
    }
}
