package com.matcast.server.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

import com.matcast.server.model.Role;
import com.matcast.server.socket.Channel;

class HubHandshakeInterceptorTest {

    private static final String SECRET = "handshake-secret-for-tests-0123456789ab";

    private final JwtUtil jwt = new JwtUtil(SECRET, "", 60_000);
    private final HubHandshakeInterceptor interceptor = new HubHandshakeInterceptor(jwt, 3);

    private final Map<String, Object> attributes = new HashMap<>();
    private MockHttpServletResponse servletResponse;

    private boolean handshake(String path, String query, String clientIp) {
        MockHttpServletRequest req = new MockHttpServletRequest("GET", path);
        req.setQueryString(query);
        req.addHeader("X-Forwarded-For", clientIp);
        servletResponse = new MockHttpServletResponse();
        return interceptor.beforeHandshake(new ServletServerHttpRequest(req),
                new ServletServerHttpResponse(servletResponse), mock(WebSocketHandler.class), attributes);
    }

    @Test
    void channelFromPath() {
        assertThat(HubHandshakeInterceptor.channelFromPath("/ws/match/42")).isEqualTo(Channel.match("42"));
        assertThat(HubHandshakeInterceptor.channelFromPath("/ws/tournament/t-1"))
                .isEqualTo(Channel.tournament("t-1"));
        assertThat(HubHandshakeInterceptor.channelFromPath("/ws/room/42")).isNull();
        assertThat(HubHandshakeInterceptor.channelFromPath("/ws/match/bad%20id")).isNull();
        assertThat(HubHandshakeInterceptor.channelFromPath(null)).isNull();
    }

    @Test
    void refereeWithRefereeClaim() {
        String token = jwt.generateToken("u1", "Rita", "referee");

        assertThat(handshake("/ws/match/42", "token=" + token + "&role=referee", "10.0.0.1")).isTrue();

        assertThat(attributes.get(HubHandshakeInterceptor.ATTR_ROLE)).isEqualTo(Role.REFEREE);
        assertThat(attributes.get(HubHandshakeInterceptor.ATTR_CHANNEL)).isEqualTo(Channel.match("42"));
        assertThat(((HubIdentity) attributes.get(HubHandshakeInterceptor.ATTR_IDENTITY)).userId()).isEqualTo("u1");
    }

    @Test
    void askingForRefereeWithoutTheClaimGivesViewer() {
        String token = jwt.generateToken("u2", "Vic", "viewer");

        assertThat(handshake("/ws/match/42", "token=" + token + "&role=referee", "10.0.0.2")).isTrue();

        assertThat(attributes.get(HubHandshakeInterceptor.ATTR_ROLE)).isEqualTo(Role.VIEWER);
    }

    @Test
    void missingTokenIs401() {
        assertThat(handshake("/ws/match/42", null, "10.0.0.3")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
        assertThat(attributes).isEmpty();
    }

    @Test
    void invalidTokenIs401() {
        assertThat(handshake("/ws/match/42", "token=garbage", "10.0.0.4")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
    }

    @Test
    void unknownPathIs400() {
        String token = jwt.generateToken("u1", "Rita", "referee");

        assertThat(handshake("/ws/room/42", "token=" + token, "10.0.0.5")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(400);
    }

    @Test
    void tooManyHandshakesFromOneIpIs429() {
        String token = jwt.generateToken("u1", "Rita", "viewer");
        for (int i = 0; i < 3; i++) {
            assertThat(handshake("/ws/match/42", "token=" + token, "10.0.0.6")).isTrue();
        }

        assertThat(handshake("/ws/match/42", "token=" + token, "10.0.0.6")).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(429);

        assertThat(handshake("/ws/match/42", "token=" + token, "10.0.0.7")).isTrue();
    }
}
