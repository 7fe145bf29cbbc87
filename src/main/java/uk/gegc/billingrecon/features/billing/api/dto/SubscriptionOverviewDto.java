package uk.gegc.billingrecon.features.billing.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "SubscriptionOverviewDto", description = "Entitlement tier and latest subscription")
public record SubscriptionOverviewDto(
        @Schema(description = "Tier the feature gate applies", example = "pro")
        String tier,

        @Schema(description = "Latest subscription, null when the user never subscribed")
        SubscriptionDto subscription
) {
}
