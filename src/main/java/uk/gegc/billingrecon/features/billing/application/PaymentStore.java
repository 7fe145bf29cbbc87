package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.Payment;

public interface PaymentStore {

    /**
     * Inserts the payment unless one with the same provider reference exists.
     *
     * @return {@code true} when a row was inserted
     */
    boolean insertIfAbsent(Payment payment);
}
