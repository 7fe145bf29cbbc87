package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(name = "CheckoutConfirmRequest", description = "Confirms a completed hosted checkout")
public record CheckoutConfirmRequest(
        @Schema(description = "Provider that processed the payment", example = "paystack")
        @NotBlank(message = "provider is required")
        String provider,

        @Schema(description = "Checkout reference returned when the session was issued")
        @NotBlank(message = "reference is required")
        String reference,

        @Schema(description = "Provider transaction id (required for flutterwave)")
        String transactionId
) {
}
