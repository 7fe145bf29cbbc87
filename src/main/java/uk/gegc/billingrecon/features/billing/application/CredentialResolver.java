package uk.gegc.billingrecon.features.billing.application;

import java.util.List;
import java.util.Optional;

/**
 * Looks up provider credentials by name. Blank values are reported as absent.
 */
@FunctionalInterface
public interface CredentialResolver {

    Optional<String> resolve(String name);

    /**
     * First non-blank credential among {@code names}.
     */
    default Optional<String> resolveFirst(List<String> names) {
        for (String name : names) {
            Optional<String> value = resolve(name);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    default boolean isPresent(String name) {
        return resolve(name).isPresent();
    }
}
