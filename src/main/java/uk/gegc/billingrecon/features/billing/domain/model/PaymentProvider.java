package uk.gegc.billingrecon.features.billing.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Payment providers the engine accepts events from and issues checkout sessions with.
 */
public enum PaymentProvider {
    STRIPE("stripe", EnumSet.of(PaymentMethod.CARD)),
    PAYSTACK("paystack", EnumSet.of(PaymentMethod.CARD, PaymentMethod.MOBILE_MONEY)),
    FLUTTERWAVE("flutterwave", EnumSet.of(PaymentMethod.CARD, PaymentMethod.MOBILE_MONEY));

    private final String code;
    private final Set<PaymentMethod> supportedMethods;

    PaymentProvider(String code, Set<PaymentMethod> supportedMethods) {
        this.code = code;
        this.supportedMethods = supportedMethods;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean supports(PaymentMethod method) {
        return supportedMethods.contains(method);
    }

    public static Optional<PaymentProvider> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(provider -> provider.code.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    static PaymentProvider fromJson(String value) {
        return fromCode(value).orElse(null);
    }
}
