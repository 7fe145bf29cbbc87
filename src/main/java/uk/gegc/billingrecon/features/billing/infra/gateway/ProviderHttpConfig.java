package uk.gegc.billingrecon.features.billing.infra.gateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;

import java.net.http.HttpClient;

/**
 * HTTP clients for the Paystack and Flutterwave REST APIs, with bounded timeouts so a slow
 * provider fails the request instead of holding a webhook thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ProviderHttpConfig {

    private final BillingProperties billingProperties;

    @Bean
    public RestClient paystackRestClient() {
        return build(billingProperties.getPaystack().getBaseUrl());
    }

    @Bean
    public RestClient flutterwaveRestClient() {
        return build(billingProperties.getFlutterwave().getBaseUrl());
    }

    private RestClient build(String baseUrl) {
        BillingProperties.Verification verification = billingProperties.getVerification();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(verification.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(verification.getTimeout());

        log.info("Provider client for {} configured with connect timeout {} and read timeout {}",
                baseUrl, verification.getConnectTimeout(), verification.getTimeout());

        return RestClient.builder()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .requestInterceptor(loggingInterceptor())
                .build();
    }

    private ClientHttpRequestInterceptor loggingInterceptor() {
        return (request, body, execution) -> {
            long startTime = System.currentTimeMillis();
            log.debug("Provider request: {} {}", request.getMethod(), request.getURI().getPath());

            ClientHttpResponse response = execution.execute(request, body);

            log.debug("Provider response: {} {} - Status: {} - Duration: {}ms",
                    request.getMethod(),
                    request.getURI().getPath(),
                    response.getStatusCode(),
                    System.currentTimeMillis() - startTime);
            return response;
        };
    }
}
