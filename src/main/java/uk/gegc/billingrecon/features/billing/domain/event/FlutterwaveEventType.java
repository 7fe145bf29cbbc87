package uk.gegc.billingrecon.features.billing.domain.event;

public enum FlutterwaveEventType {
    CHARGE_COMPLETED,
    UNKNOWN;

    public static FlutterwaveEventType from(String eventType) {
        return "charge.completed".equals(eventType) ? CHARGE_COMPLETED : UNKNOWN;
    }
}
