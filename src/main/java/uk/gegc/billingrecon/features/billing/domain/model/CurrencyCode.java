package uk.gegc.billingrecon.features.billing.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum CurrencyCode {
    USD,
    NGN,
    GHS,
    KES,
    ZAR,
    GBP,
    EUR;

    public static Optional<CurrencyCode> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(currency -> currency.name().equals(normalized))
                .findFirst();
    }
}
