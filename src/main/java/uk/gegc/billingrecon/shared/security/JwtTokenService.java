package uk.gegc.billingrecon.shared.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Validates access tokens minted by the external auth service. Tokens carry the user id as
 * subject and, optionally, an {@code email} claim.
 */
@Slf4j
@Component
public class JwtTokenService {

    private static final String EMAIL_CLAIM = "email";

    private final SecretKey key;

    public JwtTokenService(@Value("${jwt.secret}") String base64secret) {
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64secret));
    }

    public Optional<Authentication> authenticate(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(key)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("JWT token missing subject");
                return Optional.empty();
            }

            AuthenticatedUser user = new AuthenticatedUser(UUID.fromString(subject), claims.get(EMAIL_CLAIM, String.class));
            return Optional.of(new UsernamePasswordAuthenticationToken(
                    user, null, List.of(new SimpleGrantedAuthority("ROLE_USER"))));
        } catch (ExpiredJwtException ex) {
            log.debug("JWT token is expired: {}", ex.getMessage());
        } catch (MalformedJwtException ex) {
            log.warn("Malformed JWT token received: {}", ex.getMessage());
        } catch (SignatureException ex) {
            log.warn("Invalid JWT signature detected: {}", ex.getMessage());
        } catch (IllegalArgumentException ex) {
            log.warn("JWT subject is not a user id: {}", ex.getMessage());
        } catch (JwtException ex) {
            log.error("Unexpected JWT exception: {}", ex.getMessage());
        }
        return Optional.empty();
    }
}
