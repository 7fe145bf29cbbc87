package uk.gegc.billingrecon.features.billing.application;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import uk.gegc.billingrecon.features.billing.domain.model.CurrencyCode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves the buyer's country and checkout currency from explicit input or geo headers set by
 * the edge (Cloudflare, Vercel, or our own proxy).
 */
@Component
public class CurrencyCountryDetector {

    public record Detection(String countryCode, CurrencyCode currency) {
    }

    static final String DEFAULT_COUNTRY = "US";

    private static final List<String> COUNTRY_HEADERS = List.of(
            "x-checkout-country", "x-country", "cf-ipcountry", "x-vercel-ip-country");

    private static final Map<String, CurrencyCode> COUNTRY_CURRENCIES = Map.of(
            "NG", CurrencyCode.NGN,
            "GH", CurrencyCode.GHS,
            "KE", CurrencyCode.KES,
            "ZA", CurrencyCode.ZAR,
            "GB", CurrencyCode.GBP);

    private static final Set<String> EUROZONE = Set.of(
            "AT", "BE", "HR", "CY", "EE", "FI", "FR", "DE", "GR", "IE",
            "IT", "LV", "LT", "LU", "MT", "NL", "PT", "SK", "SI", "ES");

    public Detection detect(HttpHeaders headers, String explicitCountry, String explicitCurrency) {
        String country = normalizeCountry(explicitCountry);
        if (country == null && headers != null) {
            for (String header : COUNTRY_HEADERS) {
                country = normalizeCountry(headers.getFirst(header));
                if (country != null) {
                    break;
                }
            }
        }
        if (country == null) {
            country = DEFAULT_COUNTRY;
        }

        CurrencyCode currency = CurrencyCode.fromCode(explicitCurrency).orElse(currencyFor(country));
        return new Detection(country, currency);
    }

    public CurrencyCode currencyFor(String countryCode) {
        if (EUROZONE.contains(countryCode)) {
            return CurrencyCode.EUR;
        }
        return COUNTRY_CURRENCIES.getOrDefault(countryCode, CurrencyCode.USD);
    }

    private static String normalizeCountry(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim().toUpperCase(Locale.ROOT);
        // Cloudflare sends XX for unknown and T1 for Tor
        if (!trimmed.matches("[A-Z]{2}") || trimmed.equals("XX")) {
            return null;
        }
        return trimmed;
    }
}
