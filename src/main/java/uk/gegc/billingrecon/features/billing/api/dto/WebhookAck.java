package uk.gegc.billingrecon.features.billing.api.dto;

public record WebhookAck(boolean received) {

    public static WebhookAck accepted() {
        return new WebhookAck(true);
    }
}
