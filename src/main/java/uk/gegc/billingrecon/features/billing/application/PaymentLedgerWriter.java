package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.time.Instant;

/**
 * Appends verified charges to the payment history. Failures are logged, never thrown.
 */
public interface PaymentLedgerWriter {

    /**
     * @return {@code true} when a new payment row was written
     */
    boolean record(VerifiedCharge charge, Instant now);
}
