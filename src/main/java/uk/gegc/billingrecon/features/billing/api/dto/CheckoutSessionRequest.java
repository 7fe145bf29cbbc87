package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

@Schema(name = "CheckoutSessionRequest", description = "Request to open a provider-hosted checkout page for a plan")
public record CheckoutSessionRequest(
        @Schema(description = "Plan to purchase", example = "pro", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "planId is required")
        String planId,

        @Schema(description = "monthly, yearly or trial; anything else is treated as monthly", example = "monthly")
        String billingInterval,

        @Schema(description = "ISO currency code; detected from the country when absent", example = "NGN")
        String currency,

        @Schema(description = "ISO 3166 alpha-2 country code; detected from request headers when absent", example = "NG")
        String countryCode,

        @Schema(description = "Where the provider redirects after payment", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "successUrl is required")
        String successUrl,

        @Schema(description = "Where the provider redirects when the buyer abandons", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "cancelUrl is required")
        String cancelUrl,

        @Schema(description = "Buyer email; ignored when the caller is signed in", example = "buyer@example.com")
        @Email(message = "email must be a valid address")
        String email,

        @Schema(description = "card or mobile_money", example = "card")
        @Pattern(regexp = "(?i)card|mobile_money", message = "paymentMethod must be card or mobile_money")
        String paymentMethod,

        @Schema(description = "Explicit provider; recommended from the currency when absent", example = "paystack")
        String provider,

        @Schema(description = "Forwarded to providers that support idempotent session creation")
        @Size(max = 255)
        String idempotencyKey
) {
}
