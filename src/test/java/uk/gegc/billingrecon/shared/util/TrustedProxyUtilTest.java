package uk.gegc.billingrecon.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

import static org.assertj.core.api.Assertions.assertThat;

class TrustedProxyUtilTest {

    private static MockHttpServletRequest request(String remoteAddr, String forwardedFor) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddr);
        if (forwardedFor != null) {
            request.addHeader("X-Forwarded-For", forwardedFor);
        }
        return request;
    }

    @Test
    @DisplayName("Forwarded header is ignored when disabled")
    void forwardedDisabled_usesPeer() {
        TrustedProxyUtil util = new TrustedProxyUtil("", false);

        assertThat(util.getClientIp(request("127.0.0.1", "203.0.113.7"))).isEqualTo("127.0.0.1");
    }

    @Test
    @DisplayName("First forwarded address is used behind a trusted proxy")
    void trustedProxy_usesForwarded() {
        TrustedProxyUtil util = new TrustedProxyUtil("10.0.", true);

        assertThat(util.getClientIp(request("10.0.4.2", "203.0.113.7, 10.0.4.2"))).isEqualTo("203.0.113.7");
    }

    @Test
    @DisplayName("Forwarded header from an untrusted peer is ignored")
    void untrustedPeer_usesPeer() {
        TrustedProxyUtil util = new TrustedProxyUtil("10.0.", true);

        assertThat(util.getClientIp(request("198.51.100.9", "203.0.113.7"))).isEqualTo("198.51.100.9");
    }

    @Test
    @DisplayName("Invalid forwarded address falls back to the peer")
    void invalidForwarded_usesPeer() {
        TrustedProxyUtil util = new TrustedProxyUtil("", true);

        assertThat(util.getClientIp(request("127.0.0.1", "999.1.1.1"))).isEqualTo("127.0.0.1");
    }
}
