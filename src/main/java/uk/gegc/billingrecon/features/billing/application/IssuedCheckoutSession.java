package uk.gegc.billingrecon.features.billing.application;

import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

public record IssuedCheckoutSession(PaymentProvider provider, String reference, String url, boolean testMode) {
}
