package uk.gegc.billingrecon.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum BillingInterval {
    MONTHLY("monthly"),
    YEARLY("yearly"),
    TRIAL("trial");

    private final String code;

    BillingInterval(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Lenient parse used for checkout input and event metadata: anything that is not
     * {@code yearly} or {@code trial} is treated as monthly.
     */
    public static BillingInterval normalize(String value) {
        if (value == null) {
            return MONTHLY;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "yearly" -> YEARLY;
            case "trial" -> TRIAL;
            default -> MONTHLY;
        };
    }
}
