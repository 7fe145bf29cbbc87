package uk.gegc.billingrecon.features.billing.application;

import lombok.Builder;
import org.springframework.http.HttpHeaders;

import java.util.UUID;

/**
 * Raw checkout input after authentication has been applied.
 *
 * @param userId  {@code null} for guest checkout
 * @param email   the authenticated user's email when there is one, otherwise the body email
 * @param headers request headers used for country detection
 */
@Builder
public record CheckoutSessionCommand(
        UUID userId,
        String email,
        String planId,
        String billingInterval,
        String currency,
        String countryCode,
        String successUrl,
        String cancelUrl,
        String paymentMethod,
        String provider,
        String idempotencyKey,
        HttpHeaders headers
) {
}
