package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.billingrecon.features.billing.application.BillingPeriodCalculator;
import uk.gegc.billingrecon.features.billing.application.EntitlementUpdater;
import uk.gegc.billingrecon.features.billing.application.PaymentLedgerWriter;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult.Flow;
import uk.gegc.billingrecon.features.billing.application.SubscriptionReconciler;
import uk.gegc.billingrecon.features.billing.application.SubscriptionStore;
import uk.gegc.billingrecon.features.billing.application.SubscriptionUpsert;
import uk.gegc.billingrecon.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionReconcilerImpl implements SubscriptionReconciler {

    static final String TRIAL_CODE_PREFIX = "trial_";

    private final SubscriptionStore subscriptionStore;
    private final PaymentLedgerWriter paymentLedgerWriter;
    private final EntitlementUpdater entitlementUpdater;
    private final BillingPeriodCalculator billingPeriodCalculator;
    private final Clock clock;

    @Override
    @Transactional
    public ReconciliationResult reconcileSuccessfulCharge(VerifiedCharge charge) {
        Instant now = clock.instant();

        Flow flow;
        String code;
        if (charge.hasRecurringPlan()) {
            flow = Flow.SUBSCRIPTION;
            code = charge.subscriptionCode() != null ? charge.subscriptionCode() : charge.reference();
            // a trial interval on a plan charge still bills a full month
            BillingInterval interval = charge.interval() == BillingInterval.YEARLY ? BillingInterval.YEARLY : BillingInterval.MONTHLY;
            subscriptionStore.upsertFromCharge(upsert(charge, code, SubscriptionStatus.ACTIVE, false,
                    now, billingPeriodCalculator.computePeriodEnd(interval, now)));
        } else if (charge.interval() == BillingInterval.TRIAL) {
            flow = Flow.PAID_TRIAL;
            code = TRIAL_CODE_PREFIX + charge.reference();
            subscriptionStore.upsertFromCharge(upsert(charge, code, SubscriptionStatus.TRIALING, true,
                    now, billingPeriodCalculator.computePeriodEnd(BillingInterval.TRIAL, now)));
        } else {
            flow = Flow.ONE_OFF;
            code = null;
        }

        paymentLedgerWriter.record(charge, now);

        if (code == null) {
            log.info("One-off {} charge {} recorded without subscription", charge.provider().getCode(), charge.reference());
            return new ReconciliationResult(flow, null, charge.plan(), false);
        }

        // A stale retry after cancellation leaves the row canceled; the tier must not follow it.
        boolean live = subscriptionStore.findByCode(code)
                .map(Subscription::getStatus)
                .map(SubscriptionStatus::isLive)
                .orElse(false);
        if (live) {
            entitlementUpdater.grant(charge.userId(), charge.plan(), now);
        } else {
            log.warn("Subscription {} is not live after charge {}; entitlement unchanged", code, charge.reference());
        }

        log.info("Reconciled {} charge {} as {} for subscription {}", charge.provider().getCode(),
                charge.reference(), flow, code);
        return new ReconciliationResult(flow, code, charge.plan(), live);
    }

    @Override
    @Transactional
    public void cancel(String subscriptionCode) {
        Subscription subscription = require(subscriptionCode);
        Instant now = clock.instant();
        subscriptionStore.updateStatus(subscriptionCode, SubscriptionStatus.CANCELED, now);
        entitlementUpdater.recompute(subscription.getUserId(), now);
        log.info("Subscription {} canceled", subscriptionCode);
    }

    @Override
    @Transactional
    public void markNonRenewing(String subscriptionCode) {
        require(subscriptionCode);
        subscriptionStore.markCancelAtPeriodEnd(subscriptionCode, clock.instant());
        log.info("Subscription {} will not renew", subscriptionCode);
    }

    @Override
    @Transactional
    public void markPastDue(String subscriptionCode) {
        require(subscriptionCode);
        int changed = subscriptionStore.markPastDue(subscriptionCode, clock.instant());
        if (changed == 0) {
            log.info("Subscription {} already canceled; past_due ignored", subscriptionCode);
        } else {
            log.info("Subscription {} marked past_due", subscriptionCode);
        }
    }

    private Subscription require(String subscriptionCode) {
        return subscriptionStore.findByCode(subscriptionCode)
                .orElseThrow(() -> new SubscriptionNotFoundException("Subscription not found: " + subscriptionCode));
    }

    private SubscriptionUpsert upsert(VerifiedCharge charge, String code, SubscriptionStatus status,
                                      boolean cancelAtPeriodEnd, Instant now, Instant periodEnd) {
        return SubscriptionUpsert.builder()
                .id(UUID.randomUUID())
                .userId(charge.userId())
                .provider(charge.provider())
                .plan(charge.plan())
                .status(status)
                .subscriptionCode(code)
                .customerCode(charge.customerCode())
                .authorizationCode(charge.authorizationCode())
                .periodStart(now)
                .periodEnd(periodEnd)
                .cancelAtPeriodEnd(cancelAtPeriodEnd)
                .chargeReference(charge.reference())
                .now(now)
                .build();
    }
}
