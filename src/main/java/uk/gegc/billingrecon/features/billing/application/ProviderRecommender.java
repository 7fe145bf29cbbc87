package uk.gegc.billingrecon.features.billing.application;

import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

@Component
public class ProviderRecommender {

    public PaymentProvider recommend(CurrencyCode currency) {
        return switch (currency) {
            case NGN, GHS, ZAR -> PaymentProvider.PAYSTACK;
            case USD, KES, GBP, EUR -> PaymentProvider.FLUTTERWAVE;
        };
    }
}
