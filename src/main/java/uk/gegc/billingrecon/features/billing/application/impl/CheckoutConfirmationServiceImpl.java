package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.billingrecon.features.billing.application.CheckoutConfirmationService;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.application.SubscriptionReconciler;
import uk.gegc.billingrecon.features.billing.application.TransactionReverifier;
import uk.gegc.billingrecon.features.billing.application.TransactionReverifierRegistry;
import uk.gegc.billingrecon.features.billing.application.VerifiedTransaction;
import uk.gegc.billingrecon.features.billing.domain.event.ChargeMetadata;
import uk.gegc.billingrecon.features.billing.domain.exception.BillingValidationException;
import uk.gegc.billingrecon.features.billing.domain.exception.CheckoutOwnershipException;
import uk.gegc.billingrecon.features.billing.domain.exception.UnsupportedCheckoutException;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class CheckoutConfirmationServiceImpl implements CheckoutConfirmationService {

    private final TransactionReverifierRegistry reverifiers;
    private final VerifiedChargeAssembler chargeAssembler;
    private final SubscriptionReconciler subscriptionReconciler;

    @Override
    public Confirmation confirm(UUID callerId, String provider, String reference, String transactionId) {
        PaymentProvider paymentProvider = PaymentProvider.fromCode(provider)
                .orElseThrow(() -> new UnsupportedCheckoutException("Unsupported provider: " + provider));
        TransactionReverifier reverifier = reverifiers.find(paymentProvider)
                .orElseThrow(() -> new UnsupportedCheckoutException(
                        "Checkout confirmation is not available for " + paymentProvider.getCode()));
        if (!StringUtils.hasText(reference)) {
            throw new BillingValidationException("reference is required");
        }

        String lookupKey = reference.trim();
        if (paymentProvider == PaymentProvider.FLUTTERWAVE) {
            if (!StringUtils.hasText(transactionId)) {
                throw new BillingValidationException("transactionId is required for flutterwave");
            }
            lookupKey = transactionId.trim();
        }

        VerifiedTransaction verified = reverifier.verify(lookupKey, reference.trim());
        VerifiedCharge charge = chargeAssembler.assemble(verified, ChargeMetadata.empty());
        if (!charge.userId().equals(callerId)) {
            log.warn("User {} tried to confirm {} charge {} owned by {}", callerId, paymentProvider.getCode(),
                    reference, charge.userId());
            throw new CheckoutOwnershipException("This payment belongs to a different account");
        }

        ReconciliationResult result = subscriptionReconciler.reconcileSuccessfulCharge(charge);
        log.info("Confirmed {} checkout {} for user {}", paymentProvider.getCode(), reference, callerId);
        return new Confirmation(paymentProvider.getCode(), charge.reference(), charge.plan().getCode(),
                result.subscriptionCode());
    }
}
