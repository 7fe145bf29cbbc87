package uk.gegc.billingrecon.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Entitlement tiers. {@link #FREE} is never sold; it is what a user falls back to
 * when no live subscription remains.
 */
public enum PlanTier {
    FREE("free"),
    PRO("pro"),
    BUSINESS("business");

    private final String code;

    PlanTier(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isPaid() {
        return this != FREE;
    }

    public String displayName() {
        return Character.toUpperCase(code.charAt(0)) + code.substring(1) + " Plan";
    }

    public static Optional<PlanTier> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(tier -> tier.code.equals(normalized))
                .findFirst();
    }

    /**
     * Resolves a purchasable tier, rejecting {@code free} and unknown values.
     */
    public static Optional<PlanTier> paidFromCode(String value) {
        return fromCode(value).filter(PlanTier::isPaid);
    }
}
