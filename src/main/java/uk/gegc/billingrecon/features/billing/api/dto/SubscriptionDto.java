package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "SubscriptionDto", description = "Most recent subscription of the caller")
public record SubscriptionDto(
        @Schema(example = "pro") String plan,
        @Schema(example = "active") String status,
        @Schema(example = "paystack") String provider,
        String subscriptionCode,
        Instant currentPeriodStart,
        Instant currentPeriodEnd,
        boolean cancelAtPeriodEnd
) {
}
