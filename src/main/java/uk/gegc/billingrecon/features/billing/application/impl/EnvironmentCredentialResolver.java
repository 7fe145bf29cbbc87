package uk.gegc.billingrecon.features.billing.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.billingrecon.features.billing.application.BillingProperties;
import uk.gegc.billingrecon.features.billing.application.CredentialResolver;

import java.util.Optional;

/**
 * Resolves credentials from {@code billing.credentials.*} first, then from the environment
 * (system properties and environment variables under the raw name).
 */
@Component
@RequiredArgsConstructor
public class EnvironmentCredentialResolver implements CredentialResolver {

    private final BillingProperties billingProperties;
    private final Environment environment;

    @Override
    public Optional<String> resolve(String name) {
        String configured = billingProperties.getCredentials().get(name);
        if (StringUtils.hasText(configured)) {
            return Optional.of(configured.trim());
        }
        String fromEnvironment = environment.getProperty(name);
        if (StringUtils.hasText(fromEnvironment)) {
            return Optional.of(fromEnvironment.trim());
        }
        return Optional.empty();
    }
}
