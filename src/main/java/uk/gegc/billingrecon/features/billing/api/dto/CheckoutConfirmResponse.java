package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CheckoutConfirmResponse", description = "Result of applying a confirmed checkout")
public record CheckoutConfirmResponse(
        boolean ok,
        String provider,
        String reference,
        String planId,
        @Schema(description = "Subscription code, absent for one-off payments")
        String subscriptionCode
) {
}
