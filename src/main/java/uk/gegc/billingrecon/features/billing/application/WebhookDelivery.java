package uk.gegc.billingrecon.features.billing.application;

import org.springframework.http.HttpHeaders;

/**
 * A webhook request as received: the exact body bytes and the request headers.
 */
public record WebhookDelivery(byte[] body, HttpHeaders headers) {
}
