package com.collabnote.backend.modules.realtime.infrastructure.websocket;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.collabnote.backend.modules.auth.application.JwtTokenService;
import com.collabnote.backend.modules.auth.application.JwtTokenService.InvalidTokenException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

/**
 * Resolves the caller before the socket is upgraded. A token may come from the {@code Authorization}
 * header or the {@code token} query parameter; a bad token refuses the upgrade with 401, no token
 * yields an unauthenticated connection that can still send {@code auth} later.
 */
@Component
public class CollaborationHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ID_ATTRIBUTE = "collaboration.userId";
    public static final String WORKSPACE_ID_ATTRIBUTE = "collaboration.workspaceId";

    private static final Logger log = LoggerFactory.getLogger(CollaborationHandshakeInterceptor.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;

    public CollaborationHandshakeInterceptor(JwtTokenService jwtTokenService) {
        this.jwtTokenService = jwtTokenService;
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();

        String token = extractToken(request, query);
        Long userId = null;
        if (token != null) {
            try {
                userId = jwtTokenService.parseAccessToken(token).userId();
            } catch (InvalidTokenException ex) {
                log.debug("Handshake rejected from {}: {}", request.getRemoteAddress(), ex.getMessage());
                response.setStatusCode(HttpStatus.UNAUTHORIZED);
                return false;
            }
            attributes.put(USER_ID_ATTRIBUTE, userId);
        }

        String workspaceParam = decode(query.getFirst("workspaceId"));
        if (StringUtils.hasText(workspaceParam)) {
            Long workspaceId;
            try {
                workspaceId = Long.valueOf(workspaceParam.trim());
            } catch (NumberFormatException ex) {
                response.setStatusCode(HttpStatus.BAD_REQUEST);
                return false;
            }
            // workspace interest only counts once the caller is known
            if (userId != null) {
                attributes.put(WORKSPACE_ID_ATTRIBUTE, workspaceId);
            }
        }
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }

    private static String extractToken(ServerHttpRequest request, MultiValueMap<String, String> query) {
        String authorization = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        String token = decode(query.getFirst("token"));
        return StringUtils.hasText(token) ? token.trim() : null;
    }

    private static String decode(String value) {
        return value == null ? null : UriUtils.decode(value, StandardCharsets.UTF_8);
    }
}
