package uk.gegc.billingrecon.features.billing.application;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.model.BillingInterval;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PlanTier;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Local price list in major units. Used to price checkout sessions and to check amounts
 * reported by providers that do not bill against a provider-side plan.
 */
@Component
public class PlanPricing {

    static final double DEFAULT_TRIAL_MULTIPLIER = 0.3;

    private static final Map<PlanTier, Map<CurrencyCode, BigDecimal>> MONTHLY = new EnumMap<>(PlanTier.class);

    static {
        MONTHLY.put(PlanTier.PRO, prices("9.99", "15000", "150", "1200", "180", "8.49", "9.49"));
        MONTHLY.put(PlanTier.BUSINESS, prices("29.99", "45000", "450", "3600", "540", "24.99", "27.99"));
    }

    private final BigDecimal yearlyMultiplier;
    private final BigDecimal trialMultiplier;

    @Autowired
    public PlanPricing(BillingProperties billingProperties) {
        this(billingProperties.getYearlyMultiplier(), billingProperties.getPaidTrial().getMultiplier());
    }

    public PlanPricing(double yearlyMultiplier, Double trialMultiplier) {
        this.yearlyMultiplier = BigDecimal.valueOf(yearlyMultiplier);
        this.trialMultiplier = BigDecimal.valueOf(resolveTrialMultiplier(trialMultiplier));
    }

    public BigDecimal priceFor(PlanTier plan, BillingInterval interval, CurrencyCode currency) {
        Map<CurrencyCode, BigDecimal> byCurrency = MONTHLY.get(plan);
        if (byCurrency == null) {
            throw new IllegalArgumentException("No price for plan " + plan.getCode());
        }
        BigDecimal monthly = byCurrency.get(currency);
        BigDecimal price = switch (interval) {
            case MONTHLY -> monthly;
            case YEARLY -> monthly.multiply(yearlyMultiplier);
            case TRIAL -> monthly.multiply(trialMultiplier);
        };
        return price.setScale(2, RoundingMode.HALF_UP);
    }

    static double resolveTrialMultiplier(Double configured) {
        if (configured == null || configured.isNaN() || configured.isInfinite()) {
            return DEFAULT_TRIAL_MULTIPLIER;
        }
        return Math.max(0.05, Math.min(1.0, configured));
    }

    private static Map<CurrencyCode, BigDecimal> prices(String usd, String ngn, String ghs, String kes,
                                                        String zar, String gbp, String eur) {
        Map<CurrencyCode, BigDecimal> map = new EnumMap<>(CurrencyCode.class);
        map.put(CurrencyCode.USD, new BigDecimal(usd));
        map.put(CurrencyCode.NGN, new BigDecimal(ngn));
        map.put(CurrencyCode.GHS, new BigDecimal(ghs));
        map.put(CurrencyCode.KES, new BigDecimal(kes));
        map.put(CurrencyCode.ZAR, new BigDecimal(zar));
        map.put(CurrencyCode.GBP, new BigDecimal(gbp));
        map.put(CurrencyCode.EUR, new BigDecimal(eur));
        return map;
    }
}
