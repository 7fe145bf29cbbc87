package uk.gegc.billingrecon.features.billing.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Computes the end of the billing period that starts at a given instant.
 * Calendar arithmetic runs in the configured zone so month ends clamp to the last day
 * (Jan 31 + 1 month is Feb 29 in a leap year).
 */
@Component
public class BillingPeriodCalculator {

    static final int DEFAULT_TRIAL_DAYS = 7;
    static final int MIN_TRIAL_DAYS = 1;
    static final int MAX_TRIAL_DAYS = 31;

    private final int trialDays;
    private final ZoneId zone;

    @Autowired
    public BillingPeriodCalculator(BillingProperties billingProperties, Clock clock) {
        this(billingProperties.getPaidTrial().getDays(), clock.getZone());
    }

    public BillingPeriodCalculator(Double configuredTrialDays, ZoneId zone) {
        this.trialDays = resolveTrialDays(configuredTrialDays);
        this.zone = zone;
    }

    public Instant computePeriodEnd(BillingInterval interval, Instant now) {
        ZonedDateTime start = now.atZone(zone);
        return switch (interval) {
            case MONTHLY -> start.plusMonths(1).toInstant();
            case YEARLY -> start.plusYears(1).toInstant();
            case TRIAL -> now.plus(Duration.ofDays(trialDays));
        };
    }

    public int trialDays() {
        return trialDays;
    }

    static int resolveTrialDays(Double configured) {
        if (configured == null || configured.isNaN() || configured.isInfinite()) {
            return DEFAULT_TRIAL_DAYS;
        }
        double floored = Math.floor(configured);
        return (int) Math.max(MIN_TRIAL_DAYS, Math.min(MAX_TRIAL_DAYS, floored));
    }
}
