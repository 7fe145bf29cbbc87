package uk.gegc.billingrecon.features.billing.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;
import uk.gegc.billingrecon.features.billing.domain.model.PaymentProvider;

import static org.assertj.core.api.Assertions.assertThat;

class CurrencyCountryDetectorTest {

    private final CurrencyCountryDetector detector = new CurrencyCountryDetector();

    @Test
    @DisplayName("Explicit country and currency win over headers")
    void explicitValues_win() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("cf-ipcountry", "NG");

        CurrencyCountryDetector.Detection detection = detector.detect(headers, "gh", "usd");

        assertThat(detection.countryCode()).isEqualTo("GH");
        assertThat(detection.currency()).isEqualTo(CurrencyCode.USD);
    }

    @Test
    @DisplayName("Edge geo header maps the country to its local currency")
    void geoHeader_mapsCurrency() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("cf-ipcountry", "KE");

        CurrencyCountryDetector.Detection detection = detector.detect(headers, null, null);

        assertThat(detection.countryCode()).isEqualTo("KE");
        assertThat(detection.currency()).isEqualTo(CurrencyCode.KES);
    }

    @Test
    @DisplayName("Unknown country markers are skipped")
    void unknownMarker_skipped() {
        HttpHeaders headers = new HttpHeaders();
        headers.add("x-country", "XX");
        headers.add("cf-ipcountry", "DE");

        CurrencyCountryDetector.Detection detection = detector.detect(headers, null, null);

        assertThat(detection.countryCode()).isEqualTo("DE");
        assertThat(detection.currency()).isEqualTo(CurrencyCode.EUR);
    }

    @Test
    @DisplayName("No signal defaults to US and USD")
    void noSignal_defaultsToUs() {
        CurrencyCountryDetector.Detection detection = detector.detect(new HttpHeaders(), "", "JPY");

        assertThat(detection.countryCode()).isEqualTo("US");
        assertThat(detection.currency()).isEqualTo(CurrencyCode.USD);
    }

    @Test
    @DisplayName("Recommender prefers the local aggregator for West African and South African currencies")
    void recommender_mapsCurrencies() {
        ProviderRecommender recommender = new ProviderRecommender();

        assertThat(recommender.recommend(CurrencyCode.NGN)).isEqualTo(PaymentProvider.PAYSTACK);
        assertThat(recommender.recommend(CurrencyCode.ZAR)).isEqualTo(PaymentProvider.PAYSTACK);
        assertThat(recommender.recommend(CurrencyCode.KES)).isEqualTo(PaymentProvider.FLUTTERWAVE);
        assertThat(recommender.recommend(CurrencyCode.USD)).isEqualTo(PaymentProvider.FLUTTERWAVE);
    }
}
