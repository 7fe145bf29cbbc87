package uk.gegc.billingrecon.features.billing.api;

import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import uk.gegc.billingrecon.features.billing.domain.exception.CheckoutAuthenticationRequiredException;
import uk.gegc.billingrecon.shared.security.AuthenticatedUser;

import java.util.Optional;

/**
 * Utility class for extracting the caller from the security context in billing operations.
 */
public final class BillingSecurityUtils {

    private BillingSecurityUtils() {
    }

    /**
     * The signed-in user, or empty for anonymous and guest callers.
     */
    public static Optional<AuthenticatedUser> currentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication == null
                || authentication instanceof AnonymousAuthenticationToken
                || !authentication.isAuthenticated()) {
            return Optional.empty();
        }
        if (authentication.getPrincipal() instanceof AuthenticatedUser user) {
            return Optional.of(user);
        }
        return Optional.empty();
    }

    public static AuthenticatedUser requireCurrentUser() {
        return currentUser().orElseThrow(() ->
                new CheckoutAuthenticationRequiredException("Authentication is required"));
    }
}
