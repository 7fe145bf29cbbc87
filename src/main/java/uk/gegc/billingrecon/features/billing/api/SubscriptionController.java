package uk.gegc.billingrecon.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.billingrecon.features.billing.api.dto.SubscriptionOverviewDto;
import uk.gegc.billingrecon.features.billing.application.SubscriptionQueryService;
import uk.gegc.billingrecon.features.billing.infra.mapping.SubscriptionMapper;
import uk.gegc.billingrecon.shared.security.AuthenticatedUser;

@RestController
@RequestMapping("/api/v1/billing")
@RequiredArgsConstructor
@Tag(name = "Subscription", description = "Caller's plan and subscription state")
public class SubscriptionController {

    private final SubscriptionQueryService subscriptionQueryService;
    private final SubscriptionMapper subscriptionMapper;

    @Operation(summary = "Get my subscription", security = @SecurityRequirement(name = "bearerAuth"))
    @GetMapping("/subscription")
    public ResponseEntity<SubscriptionOverviewDto> getSubscription() {
        AuthenticatedUser user = BillingSecurityUtils.requireCurrentUser();
        SubscriptionQueryService.SubscriptionOverview overview = subscriptionQueryService.getOverview(user.id());
        return ResponseEntity.ok(new SubscriptionOverviewDto(
                overview.tier().getCode(),
                overview.latest().map(subscriptionMapper::toDto).orElse(null)));
    }
}
