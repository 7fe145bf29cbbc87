package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import uk.gegc.billingrecon.features.billing.application.PaymentLedgerWriter;
import uk.gegc.billingrecon.features.billing.application.PaymentStore;
import uk.gegc.billingrecon.features.billing.domain.model.Payment;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentStatus;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentLedgerWriterImpl implements PaymentLedgerWriter {

    private final PaymentStore paymentStore;

    @Override
    public boolean record(VerifiedCharge charge, Instant now) {
        Payment payment = toPayment(charge, now);
        try {
            boolean inserted = paymentStore.insertIfAbsent(payment);
            if (inserted) {
                log.info("Recorded {} payment {} of {} {} for user {}", charge.provider().getCode(),
                        charge.reference(), payment.getAmount(), payment.getCurrency(), charge.userId());
            } else {
                log.debug("Payment {} already recorded", charge.reference());
            }
            return inserted;
        } catch (DataAccessException | TransactionException e) {
            log.warn("Payment ledger write failed for reference {}; continuing without payment history: {}",
                    charge.reference(), e.getMessage());
            return false;
        }
    }

    private Payment toPayment(VerifiedCharge charge, Instant now) {
        Payment payment = new Payment();
        payment.setId(UUID.randomUUID());
        payment.setUserId(charge.userId());
        payment.setProvider(charge.provider());
        payment.setAmount(charge.amount() != null ? charge.amount() : BigDecimal.ZERO);
        payment.setCurrency(charge.currency() != null ? charge.currency().toUpperCase(Locale.ROOT) : "USD");
        payment.setStatus(PaymentStatus.SUCCEEDED);
        payment.setProviderReference(charge.reference());
        payment.setProviderTransactionId(charge.transactionId());
        payment.setDescription(charge.plan().displayName() + " (" + charge.interval().getCode() + ")");
        payment.setCreatedAt(now);
        return payment;
    }
}
