package uk.gegc.billingrecon.shared.security;

import java.security.Principal;
import java.util.UUID;

/**
 * Principal established from a validated bearer token.
 */
public record AuthenticatedUser(UUID id, String email) implements Principal {

    @Override
    public String getName() {
        return id.toString();
    }
}
