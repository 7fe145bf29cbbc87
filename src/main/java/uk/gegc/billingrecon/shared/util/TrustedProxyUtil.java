package uk.gegc.billingrecon.shared.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

@Component
public class TrustedProxyUtil {

    private final List<String> trustedProxies;
    private final boolean enableForwardedHeaders;

    public TrustedProxyUtil(
            @Value("${app.security.trusted-proxies:}") String trustedProxiesConfig,
            @Value("${app.security.enable-forwarded-headers:false}") boolean enableForwardedHeaders
    ) {
        this.enableForwardedHeaders = enableForwardedHeaders;
        this.trustedProxies = trustedProxiesConfig == null || trustedProxiesConfig.isBlank()
                ? List.of("127.0.0.1", "::1", "localhost")
                : Arrays.stream(trustedProxiesConfig.split(",")).map(String::trim).filter(s -> !s.isEmpty()).toList();
    }

    /**
     * Client IP for rate limiting and audit logs. {@code X-Forwarded-For} is honoured only
     * when forwarded headers are enabled and the direct peer is a trusted proxy.
     */
    public String getClientIp(HttpServletRequest request) {
        String remoteAddr = request.getRemoteAddr();
        if (!enableForwardedHeaders) {
            return remoteAddr;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor == null || forwardedFor.isBlank() || !isTrustedProxy(remoteAddr)) {
            return remoteAddr;
        }

        String clientIp = forwardedFor.split(",")[0].trim();
        return isValidIpAddress(clientIp) ? clientIp : remoteAddr;
    }

    private boolean isTrustedProxy(String ip) {
        return ip != null && trustedProxies.stream().anyMatch(ip::startsWith);
    }

    private boolean isValidIpAddress(String ip) {
        if (ip.isEmpty()) {
            return false;
        }
        String[] parts = ip.split("\\.");
        if (parts.length == 4) {
            try {
                for (String part : parts) {
                    int num = Integer.parseInt(part);
                    if (num < 0 || num > 255) {
                        return false;
                    }
                }
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
        return ip.contains(":") && ip.matches("^[0-9a-fA-F:]+$");
    }
}
