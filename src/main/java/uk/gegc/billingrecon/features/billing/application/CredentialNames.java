package uk.gegc.billingrecon.features.billing.application;

import java.util.List;

/**
 * Names under which provider credentials are looked up.
 */
public final class CredentialNames {

    public static final String STRIPE_SECRET_KEY = "STRIPE_SECRET_KEY";
    public static final String STRIPE_WEBHOOK_SECRET = "STRIPE_WEBHOOK_SECRET";
    public static final String PAYSTACK_SECRET_KEY = "PAYSTACK_SECRET_KEY";
    public static final String PAYSTACK_PLAN_CODE_PRO = "PAYSTACK_PLAN_CODE_PRO";
    public static final String PAYSTACK_PLAN_CODE_BUSINESS = "PAYSTACK_PLAN_CODE_BUSINESS";
    public static final String FLUTTERWAVE_SECRET_KEY = "FLUTTERWAVE_SECRET_KEY";

    /**
     * Accepted names for the Flutterwave webhook secret hash, in lookup order.
     */
    public static final List<String> FLUTTERWAVE_WEBHOOK_HASH = List.of(
            "FLW_SECRET_HASH",
            "FLUTTERWAVE_WEBHOOK_SECRET_HASH",
            "FLUTTERWAVE_SECRET_HASH"
    );

    private CredentialNames() {
    }
}
