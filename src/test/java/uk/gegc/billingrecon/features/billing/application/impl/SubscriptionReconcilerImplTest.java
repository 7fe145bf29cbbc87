package uk.gegc.billingrecon.features.billing.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import uk.gegc.billingrecon.features.billing.application.BillingPeriodCalculator;
import uk.gegc.billingrecon.features.billing.application.ReconciliationResult;
import uk.gegc.billingrecon.features.billing.domain.exception.SubscriptionNotFoundException;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;
import uk.gegc.billingrecon.features.billing.domain.model.Subscription;
import uk.gegc.billingrecon.features.billing.domain.model.SubscriptionStatus;
import uk.gegc.billingrecon.features.billing.domain.model.VerifiedCharge;
import uk.gegc.billingrecon.features.billing.testutils.InMemoryEntitlementStore;
import uk.gegc.billingrecon.features.billing.testutils.InMemoryPaymentStore;
import uk.gegc.billingrecon.features.billing.testutils.InMemorySubscriptionStore;
import uk.gegc.billingrecon.features.billing.testutils.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static uk.gegc.billingrecon.features.billing.testutils.BillingTestUtils.paystackCharge;

/**
 * Runs the reconciler with its real collaborators over in-memory stores.
 */
class SubscriptionReconcilerImplTest {

    private static final Instant START = Instant.parse("2024-03-10T12:00:00Z");

    private InMemorySubscriptionStore subscriptions;
    private InMemoryPaymentStore payments;
    private InMemoryEntitlementStore entitlements;
    private MutableClock clock;
    private SubscriptionReconcilerImpl reconciler;
    private UUID userId;

    @BeforeEach
    void setUp() {
        subscriptions = new InMemorySubscriptionStore();
        payments = new InMemoryPaymentStore();
        entitlements = new InMemoryEntitlementStore();
        clock = new MutableClock(START);
        reconciler = new SubscriptionReconcilerImpl(
                subscriptions,
                new PaymentLedgerWriterImpl(payments),
                new EntitlementUpdaterImpl(entitlements, subscriptions),
                new BillingPeriodCalculator(null, ZoneOffset.UTC),
                clock
        );
        userId = UUID.randomUUID();
    }

    @Nested
    @DisplayName("Successful charge")
    class SuccessfulChargeTests {

        @Test
        @DisplayName("Yearly recurring charge creates an active subscription and grants the plan")
        void yearlyRecurringCharge_createsActiveSubscription() {
            // Given
            VerifiedCharge charge = paystackCharge(userId, "ref_yearly")
                    .plan(PlanTier.BUSINESS)
                    .interval(BillingInterval.YEARLY)
                    .recurringPlanCode("PLN_business")
                    .subscriptionCode("SUB_abc")
                    .build();

            // When
            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(charge);

            // Then
            assertThat(result.flow()).isEqualTo(ReconciliationResult.Flow.SUBSCRIPTION);
            assertThat(result.entitlementGranted()).isTrue();
            Subscription row = subscriptions.findByCode("SUB_abc").orElseThrow();
            assertThat(row.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(row.isCancelAtPeriodEnd()).isFalse();
            assertThat(row.getCurrentPeriodStart()).isEqualTo(START);
            assertThat(row.getCurrentPeriodEnd()).isEqualTo(ZonedDateTime.ofInstant(START, ZoneOffset.UTC).plusYears(1).toInstant());
            assertThat(entitlements.findTier(userId)).contains(PlanTier.BUSINESS);
            assertThat(payments.all()).hasSize(1);
        }

        @Test
        @DisplayName("Recurring charge without an explicit code uses the reference as the code")
        void recurringChargeWithoutCode_usesReference() {
            VerifiedCharge charge = paystackCharge(userId, "ref_plain")
                    .recurringPlanCode("PLN_pro")
                    .build();

            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(charge);

            assertThat(result.subscriptionCode()).isEqualTo("ref_plain");
            assertThat(subscriptions.findByCode("ref_plain")).isPresent();
        }

        @Test
        @DisplayName("Paid trial without a recurring plan creates a trialing row keyed trial_<reference>")
        void paidTrial_createsTrialingRow() {
            // Given
            VerifiedCharge charge = paystackCharge(userId, "r1")
                    .interval(BillingInterval.TRIAL)
                    .build();

            // When
            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(charge);

            // Then
            assertThat(result.flow()).isEqualTo(ReconciliationResult.Flow.PAID_TRIAL);
            Subscription row = subscriptions.findByCode("trial_r1").orElseThrow();
            assertThat(row.getStatus()).isEqualTo(SubscriptionStatus.TRIALING);
            assertThat(row.isCancelAtPeriodEnd()).isTrue();
            assertThat(row.getCurrentPeriodEnd()).isEqualTo(START.plus(Duration.ofDays(7)));
            assertThat(entitlements.findTier(userId)).contains(PlanTier.PRO);
        }

        @Test
        @DisplayName("One-off charge records a payment but writes no subscription and grants nothing")
        void oneOffCharge_recordsPaymentOnly() {
            VerifiedCharge charge = paystackCharge(userId, "ref_once").build();

            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(charge);

            assertThat(result.flow()).isEqualTo(ReconciliationResult.Flow.ONE_OFF);
            assertThat(result.entitlementGranted()).isFalse();
            assertThat(subscriptions.size()).isZero();
            assertThat(payments.all()).hasSize(1);
            assertThat(entitlements.findTier(userId)).isEmpty();
        }

        @Test
        @DisplayName("Replaying the same event yields one subscription and one payment")
        void replayedEvent_isIdempotent() {
            VerifiedCharge charge = paystackCharge(userId, "ref_dup")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_dup")
                    .build();

            for (int i = 0; i < 5; i++) {
                reconciler.reconcileSuccessfulCharge(charge);
                clock.advance(Duration.ofMinutes(1));
            }

            assertThat(subscriptions.size()).isEqualTo(1);
            assertThat(payments.all()).hasSize(1);
            assertThat(subscriptions.findByCode("SUB_dup").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("A late replay of an applied charge keeps the period and the will-not-renew flag")
        void lateReplay_leavesRowUnchanged() {
            // Given
            VerifiedCharge charge = paystackCharge(userId, "ref_replay")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_replay")
                    .build();
            reconciler.reconcileSuccessfulCharge(charge);
            reconciler.markNonRenewing("SUB_replay");
            Subscription before = subscriptions.findByCode("SUB_replay").orElseThrow();
            Instant periodStart = before.getCurrentPeriodStart();
            Instant periodEnd = before.getCurrentPeriodEnd();
            clock.advance(Duration.ofDays(10));

            // When
            reconciler.reconcileSuccessfulCharge(charge);

            // Then
            Subscription after = subscriptions.findByCode("SUB_replay").orElseThrow();
            assertThat(after.getCurrentPeriodStart()).isEqualTo(periodStart);
            assertThat(after.getCurrentPeriodEnd()).isEqualTo(periodEnd);
            assertThat(after.isCancelAtPeriodEnd()).isTrue();
            assertThat(after.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
            assertThat(payments.all()).hasSize(1);
        }

        @Test
        @DisplayName("A renewal with a new reference still extends the period")
        void renewalWithNewReference_extendsPeriod() {
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_m1")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_renew")
                    .build());
            Instant firstEnd = subscriptions.findByCode("SUB_renew").orElseThrow().getCurrentPeriodEnd();
            clock.advance(Duration.ofDays(31));

            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_m2")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_renew")
                    .build());

            Subscription row = subscriptions.findByCode("SUB_renew").orElseThrow();
            assertThat(row.getCurrentPeriodEnd()).isAfter(firstEnd);
            assertThat(row.getLastChargeReference()).isEqualTo("ref_m2");
        }

        @Test
        @DisplayName("A retried older charge never moves the period end backwards")
        void olderRetry_keepsLaterPeriodEnd() {
            VerifiedCharge renewal = paystackCharge(userId, "ref_renew")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_order")
                    .build();
            clock.advance(Duration.ofDays(30));
            reconciler.reconcileSuccessfulCharge(renewal);
            Instant laterEnd = subscriptions.findByCode("SUB_order").orElseThrow().getCurrentPeriodEnd();

            clock.advance(Duration.ofDays(-30));
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_first")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_order")
                    .build());

            assertThat(subscriptions.findByCode("SUB_order").orElseThrow().getCurrentPeriodEnd()).isEqualTo(laterEnd);
        }

        @Test
        @DisplayName("A failed payment write does not abort the subscription write")
        void ledgerFailure_isSoft() {
            // Given
            payments.failWith(new DataAccessResourceFailureException("Table 'payments' doesn't exist"));
            VerifiedCharge charge = paystackCharge(userId, "ref_soft")
                    .recurringPlanCode("PLN_pro")
                    .build();

            // When
            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(charge);

            // Then
            assertThat(result.entitlementGranted()).isTrue();
            assertThat(subscriptions.findByCode("ref_soft")).isPresent();
            assertThat(entitlements.findTier(userId)).contains(PlanTier.PRO);
        }
    }

    @Nested
    @DisplayName("Entitlement after expiry")
    class ExpiryTests {

        @Test
        @DisplayName("A trial whose period has ended does not keep its tier after the paid plan is canceled")
        void expiredTrial_doesNotOutliveCanceledPlan() {
            // Given
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "r1")
                    .plan(PlanTier.BUSINESS)
                    .interval(BillingInterval.TRIAL)
                    .build());
            clock.advance(Duration.ofDays(30));
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "r2")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_1")
                    .build());
            clock.advance(Duration.ofDays(30));

            // When
            reconciler.cancel("SUB_1");

            // Then
            assertThat(subscriptions.findByCode("trial_r1").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.TRIALING);
            assertThat(entitlements.findTier(userId)).contains(PlanTier.FREE);
        }

        @Test
        @DisplayName("A trial still inside its period keeps its tier after the paid plan is canceled")
        void runningTrial_survivesCanceledPlan() {
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "r1")
                    .plan(PlanTier.BUSINESS)
                    .interval(BillingInterval.TRIAL)
                    .build());
            clock.advance(Duration.ofDays(1));
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "r2")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_1")
                    .build());
            clock.advance(Duration.ofDays(1));

            reconciler.cancel("SUB_1");

            assertThat(entitlements.findTier(userId)).contains(PlanTier.BUSINESS);
        }
    }

    @Nested
    @DisplayName("Lifecycle transitions")
    class LifecycleTests {

        @BeforeEach
        void activate() {
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_live")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_live")
                    .build());
            clock.advance(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("Cancel moves the row to canceled and resets the tier to free")
        void cancel_resetsTierToFree() {
            reconciler.cancel("SUB_live");

            assertThat(subscriptions.findByCode("SUB_live").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(entitlements.findTier(userId)).contains(PlanTier.FREE);
        }

        @Test
        @DisplayName("Cancel keeps the tier of another live subscription")
        void cancel_keepsOtherLivePlan() {
            reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_other")
                    .plan(PlanTier.BUSINESS)
                    .recurringPlanCode("PLN_business")
                    .subscriptionCode("SUB_other")
                    .build());
            clock.advance(Duration.ofMinutes(1));

            reconciler.cancel("SUB_live");

            assertThat(entitlements.findTier(userId)).contains(PlanTier.BUSINESS);
        }

        @Test
        @DisplayName("A stale success after cancellation does not resurrect the subscription")
        void staleSuccessAfterCancel_doesNotResurrect() {
            // Given
            reconciler.cancel("SUB_live");
            clock.advance(Duration.ofMinutes(1));

            // When
            ReconciliationResult result = reconciler.reconcileSuccessfulCharge(paystackCharge(userId, "ref_late")
                    .recurringPlanCode("PLN_pro")
                    .subscriptionCode("SUB_live")
                    .build());

            // Then
            assertThat(result.entitlementGranted()).isFalse();
            assertThat(subscriptions.findByCode("SUB_live").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
            assertThat(entitlements.findTier(userId)).contains(PlanTier.FREE);
        }

        @Test
        @DisplayName("Will-not-renew sets cancelAtPeriodEnd without changing status")
        void markNonRenewing_setsFlagOnly() {
            reconciler.markNonRenewing("SUB_live");

            Subscription row = subscriptions.findByCode("SUB_live").orElseThrow();
            assertThat(row.isCancelAtPeriodEnd()).isTrue();
            assertThat(row.getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }

        @Test
        @DisplayName("Failed payment moves the row to past_due and keeps the tier")
        void markPastDue_keepsTier() {
            reconciler.markPastDue("SUB_live");

            assertThat(subscriptions.findByCode("SUB_live").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.PAST_DUE);
            assertThat(entitlements.findTier(userId)).contains(PlanTier.PRO);
        }

        @Test
        @DisplayName("past_due never overwrites canceled")
        void markPastDue_afterCancel_isIgnored() {
            reconciler.cancel("SUB_live");

            reconciler.markPastDue("SUB_live");

            assertThat(subscriptions.findByCode("SUB_live").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.CANCELED);
        }

        @Test
        @DisplayName("Unknown subscription code is not found and mutates nothing")
        void unknownCode_throwsNotFound() {
            assertThatThrownBy(() -> reconciler.cancel("SUB_missing"))
                    .isInstanceOf(SubscriptionNotFoundException.class)
                    .hasMessageContaining("SUB_missing");
            assertThatThrownBy(() -> reconciler.markPastDue("SUB_missing"))
                    .isInstanceOf(SubscriptionNotFoundException.class);
            assertThatThrownBy(() -> reconciler.markNonRenewing("SUB_missing"))
                    .isInstanceOf(SubscriptionNotFoundException.class);

            assertThat(entitlements.findTier(userId)).contains(PlanTier.PRO);
            assertThat(subscriptions.findByCode("SUB_live").orElseThrow().getStatus()).isEqualTo(SubscriptionStatus.ACTIVE);
        }
    }
}
