package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "CheckoutSessionResponse", description = "Hosted checkout page and the reference used to reconcile it")
public record CheckoutSessionResponse(
        @Schema(description = "Provider that issued the session", example = "paystack")
        String provider,

        @Schema(description = "Reference the provider will report on the charge", example = "pro_8b0c..._1718000000000")
        String reference,

        @Schema(description = "Hosted payment page URL")
        String url,

        @Schema(description = "Whether the session was issued against sandbox credentials")
        boolean testMode
) {
}
