package uk.gegc.billingrecon.shared.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;
import uk.gegc.billingrecon.shared.util.TrustedProxyUtil;

import java.io.IOException;

@Slf4j
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private final JwtTokenService jwtTokenService;
    private final TrustedProxyUtil trustedProxyUtil;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, TrustedProxyUtil trustedProxyUtil) {
        this.jwtTokenService = jwtTokenService;
        this.trustedProxyUtil = trustedProxyUtil;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response, @NonNull FilterChain filterChain) throws ServletException, IOException {
        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            String token = authHeader.substring(7);
            jwtTokenService.authenticate(token).ifPresentOrElse(
                    authentication -> SecurityContextHolder.getContext().setAuthentication(authentication),
                    () -> log.warn("Invalid JWT token received from IP: {}, URI: {}",
                            trustedProxyUtil.getClientIp(request), request.getRequestURI()));
        }

        filterChain.doFilter(request, response);
    }
}
