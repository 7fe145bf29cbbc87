package uk.gegc.billingrecon.features.billing.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.billingrecon.features.billing.api.dto.CheckoutConfirmRequest;
import uk.gegc.billingrecon.features.billing.api.dto.CheckoutConfirmResponse;
import uk.gegc.billingrecon.features.billing.api.dto.CheckoutSessionRequest;
import uk.gegc.billingrecon.features.billing.api.dto.CheckoutSessionResponse;
import uk.gegc.billingrecon.features.billing.application.CheckoutConfirmationService;
import uk.gegc.billingrecon.features.billing.application.CheckoutSessionCommand;
import uk.gegc.billingrecon.features.billing.application.CheckoutSessionService;
import uk.gegc.billingrecon.features.billing.application.IssuedCheckoutSession;
import uk.gegc.billingrecon.features.billing.domain.exception.CheckoutAuthenticationRequiredException;
import uk.gegc.billingrecon.shared.security.AuthenticatedUser;

import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing/checkout")
@RequiredArgsConstructor
@Tag(name = "Checkout", description = "Hosted checkout sessions for plan purchases")
public class BillingCheckoutController {

    private final CheckoutSessionService checkoutSessionService;
    private final CheckoutConfirmationService checkoutConfirmationService;

    @Operation(
            summary = "Create a checkout session",
            description = "Chooses provider and currency for the buyer and returns the hosted payment page. "
                    + "Guests must supply an email; a signed-in user's own email always wins."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session created"),
            @ApiResponse(responseCode = "400", description = "Invalid plan, provider or payment method",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Neither signed in nor an email supplied",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Provider not configured or unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/sessions")
    public ResponseEntity<CheckoutSessionResponse> createSession(
            @Valid @RequestBody CheckoutSessionRequest request,
            @RequestHeader HttpHeaders headers
    ) {
        Optional<AuthenticatedUser> user = BillingSecurityUtils.currentUser();
        if (user.isEmpty() && !StringUtils.hasText(request.email())) {
            throw new CheckoutAuthenticationRequiredException("Sign in or provide an email to check out");
        }
        String email = user.map(AuthenticatedUser::email)
                .filter(StringUtils::hasText)
                .orElse(request.email());

        CheckoutSessionCommand command = CheckoutSessionCommand.builder()
                .userId(user.map(AuthenticatedUser::id).orElse(null))
                .email(email)
                .planId(request.planId())
                .billingInterval(request.billingInterval())
                .currency(request.currency())
                .countryCode(request.countryCode())
                .successUrl(request.successUrl())
                .cancelUrl(request.cancelUrl())
                .paymentMethod(request.paymentMethod())
                .provider(request.provider())
                .idempotencyKey(request.idempotencyKey())
                .headers(headers)
                .build();

        IssuedCheckoutSession session = checkoutSessionService.createSession(command);
        return ResponseEntity.ok(new CheckoutSessionResponse(
                session.provider().getCode(), session.reference(), session.url(), session.testMode()));
    }

    @Operation(
            summary = "Confirm a completed checkout",
            description = "Re-verifies the payment with the provider and applies it to the caller's subscription.",
            security = @SecurityRequirement(name = "bearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Payment applied"),
            @ApiResponse(responseCode = "400", description = "Payment not confirmed by the provider",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "401", description = "Not signed in",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "403", description = "Payment belongs to another account",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/confirm")
    public ResponseEntity<CheckoutConfirmResponse> confirm(@Valid @RequestBody CheckoutConfirmRequest request) {
        AuthenticatedUser user = BillingSecurityUtils.requireCurrentUser();
        CheckoutConfirmationService.Confirmation confirmation = checkoutConfirmationService.confirm(
                user.id(), request.provider(), request.reference(), request.transactionId());
        return ResponseEntity.ok(new CheckoutConfirmResponse(true, confirmation.provider(),
                confirmation.reference(), confirmation.planId(), confirmation.subscriptionCode()));
    }
}
