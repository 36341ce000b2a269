package com.routeclip.web.ws;

import com.routeclip.web.UserIdentity;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;
import java.util.Optional;

/**
 * Rejects the handshake with 401 unless the gateway forwarded a user id, in the
 * {@code X-User-Id} header or, for browser clients, the {@code userId} query parameter.
 */
@Component
public class UserIdHandshakeInterceptor implements HandshakeInterceptor {

    public static final String USER_ID_ATTR = "routeclip.userId";

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        Optional<Long> userId = UserIdentity.parse(request.getHeaders().getFirst(UserIdentity.USER_ID_HEADER));
        if (userId.isEmpty()) {
            String param = UriComponentsBuilder.fromUri(request.getURI()).build()
                    .getQueryParams().getFirst(UserIdentity.USER_ID_PARAM);
            userId = UserIdentity.parse(param);
        }
        if (userId.isEmpty()) {
            response.setStatusCode(HttpStatus.UNAUTHORIZED);
            return false;
        }
        attributes.put(USER_ID_ATTR, userId.get());
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
    }
}
