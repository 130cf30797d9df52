package com.collabnote.backend.modules.realtime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.collabnote.backend.modules.auth.application.JwtTokenService;
import com.collabnote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.collabnote.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.collabnote.backend.modules.realtime.infrastructure.websocket.CollaborationHandshakeInterceptor;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.server.ServletServerHttpRequest;
import org.springframework.http.server.ServletServerHttpResponse;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.web.socket.WebSocketHandler;

class CollaborationHandshakeInterceptorTest {

    private JwtTokenService jwtTokenService;
    private CollaborationHandshakeInterceptor interceptor;
    private MockHttpServletResponse servletResponse;
    private Map<String, Object> attributes;

    @BeforeEach
    void setUp() {
        jwtTokenService = mock(JwtTokenService.class);
        interceptor = new CollaborationHandshakeInterceptor(jwtTokenService);
        servletResponse = new MockHttpServletResponse();
        attributes = new HashMap<>();
    }

    @Test
    void tokenFromQueryParameterAuthenticates() {
        when(jwtTokenService.parseAccessToken("abc")).thenReturn(parsed(4L));
        MockHttpServletRequest request = request("token=abc&workspaceId=9");

        boolean accepted = handshake(request);

        assertThat(accepted).isTrue();
        assertThat(attributes)
                .containsEntry(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 4L)
                .containsEntry(CollaborationHandshakeInterceptor.WORKSPACE_ID_ATTRIBUTE, 9L);
    }

    @Test
    void bearerHeaderTakesPrecedence() {
        when(jwtTokenService.parseAccessToken("header-token")).thenReturn(parsed(6L));
        MockHttpServletRequest request = request("token=ignored");
        request.addHeader("Authorization", "Bearer header-token");

        assertThat(handshake(request)).isTrue();
        assertThat(attributes).containsEntry(CollaborationHandshakeInterceptor.USER_ID_ATTRIBUTE, 6L);
    }

    @Test
    void invalidTokenRejectsUpgradeWith401() {
        when(jwtTokenService.parseAccessToken("expired")).thenThrow(new InvalidTokenException("Invalid access token", null));

        assertThat(handshake(request("token=expired"))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(401);
    }

    @Test
    void missingTokenOpensAnonymousConnectionWithoutWorkspace() {
        assertThat(handshake(request("workspaceId=9"))).isTrue();
        assertThat(attributes).isEmpty();
    }

    @Test
    void nonNumericWorkspaceIsRejected() {
        assertThat(handshake(request("workspaceId=abc"))).isFalse();
        assertThat(servletResponse.getStatus()).isEqualTo(400);
    }

    private boolean handshake(MockHttpServletRequest request) {
        return interceptor.beforeHandshake(
                new ServletServerHttpRequest(request),
                new ServletServerHttpResponse(servletResponse),
                mock(WebSocketHandler.class),
                attributes
        );
    }

    private static MockHttpServletRequest request(String query) {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/ws/collaboration");
        request.setQueryString(query);
        return request;
    }

    private static ParsedToken parsed(Long userId) {
        return new ParsedToken(userId, "user" + userId, List.of("USER"), OffsetDateTime.now(), OffsetDateTime.now().plusMinutes(5));
    }
}
