package uk.gegc.billingrecon.features.billing.domain.model;

public enum PaymentStatus {
    PENDING,
    SUCCEEDED,
    FAILED,
    REFUNDED
}
