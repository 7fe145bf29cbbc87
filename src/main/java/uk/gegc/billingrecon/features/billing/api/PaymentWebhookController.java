package uk.gegc.billingrecon.features.billing.api;

import io.swagger.v3.oas.annotations.Hidden;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.billingrecon.features.billing.api.dto.WebhookAck;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.WebhookDelivery;
import uk.gegc.billingrecon.features.billing.application.WebhookEventRouter;
import uk.gegc.billingrecon.features.billing.domain.exception.PayloadTooLargeException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedMediaTypeException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.shared.ratelimit.RateLimitService;
import uk.gegc.billingrecon.shared.util.TrustedProxyUtil;

import java.io.IOException;
import java.io.InputStream;

@Slf4j
@RestController
@RequestMapping("/api/v1/billing/webhooks")
@RequiredArgsConstructor
@Tag(name = "Payment Webhooks", description = "Endpoints the payment providers deliver events to (not for public use)")
public class PaymentWebhookController {

    private final WebhookEventRouter webhookEventRouter;
    private final RateLimitService rateLimitService;
    private final TrustedProxyUtil trustedProxyUtil;
    private final BillingProperties billingProperties;

    @Operation(
            summary = "Receive a provider webhook",
            description = "Verifies the provider signature over the raw body and applies the event. Unrecognized events are acknowledged."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Event accepted or ignored"),
            @ApiResponse(responseCode = "400", description = "Missing or invalid signature, or invalid payload",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Event references an unknown subscription",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Rate limit exceeded",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "500", description = "Webhook secret not configured or provider unavailable",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @Hidden
    @PostMapping("/{provider:stripe|paystack|flutterwave}")
    public ResponseEntity<WebhookAck> receive(
            @Parameter(description = "Provider name") @PathVariable("provider") String provider,
            @Parameter(hidden = true) @RequestHeader HttpHeaders headers,
            HttpServletRequest request
    ) throws IOException {
        PaymentProvider paymentProvider = PaymentProvider.fromCode(provider)
                .orElseThrow(() -> new IllegalStateException("Unmapped provider " + provider));

        rateLimitService.checkRateLimit("webhook", trustedProxyUtil.getClientIp(request),
                billingProperties.getWebhook().getRateLimitPerMinute());

        int maxBytes = billingProperties.getWebhook().getMaxPayloadBytes();
        if (request.getContentLengthLong() > maxBytes) {
            throw new PayloadTooLargeException("Payload exceeds " + maxBytes + " bytes");
        }
        if (paymentProvider == PaymentProvider.STRIPE && !isJson(headers)) {
            throw new UnsupportedMediaTypeException("Stripe webhooks must be sent as application/json");
        }
        byte[] body = readBounded(request, maxBytes);

        WebhookEventRouter.Result result = webhookEventRouter.route(paymentProvider, new WebhookDelivery(body, headers));
        log.debug("{} webhook result: {}", paymentProvider.getCode(), result);
        return ResponseEntity.ok(WebhookAck.accepted());
    }

    /**
     * Reads at most {@code maxBytes + 1} bytes, so a chunked body without a Content-Length is
     * still bounded.
     */
    private static byte[] readBounded(HttpServletRequest request, int maxBytes) throws IOException {
        try (InputStream in = request.getInputStream()) {
            byte[] body = in.readNBytes(maxBytes + 1);
            if (body.length > maxBytes) {
                throw new PayloadTooLargeException("Payload exceeds " + maxBytes + " bytes");
            }
            return body;
        }
    }

    private static boolean isJson(HttpHeaders headers) {
        MediaType contentType = headers.getContentType();
        return contentType != null && MediaType.APPLICATION_JSON.isCompatibleWith(contentType);
    }
}
