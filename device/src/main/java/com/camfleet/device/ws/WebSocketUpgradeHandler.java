package com.camfleet.device.ws;

import com.camfleet.core.error.ApiException;
import com.camfleet.core.util.JsonUtils;
import com.camfleet.device.http.AuthMiddleware;
import com.camfleet.device.http.HttpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.netty.http.server.HttpServerRequest;
import reactor.netty.http.server.HttpServerResponse;

/**
 * Authorizes a WebSocket upgrade with the same bearer rule as REST before accepting it.
 */
public class WebSocketUpgradeHandler {
    private static final Logger log = LoggerFactory.getLogger(WebSocketUpgradeHandler.class);

    private final AuthMiddleware auth;
    private final WebSocketHandler wsHandler;

    public WebSocketUpgradeHandler(AuthMiddleware auth, WebSocketHandler wsHandler) {
        this.auth = auth;
        this.wsHandler = wsHandler;
    }

    public Mono<Void> handle(HttpServerRequest req, HttpServerResponse res) {
        if (!auth.isAuthorized(req.requestHeaders().get("Authorization"))) {
            ApiException error = ApiException.unauthorized();
            log.warn("Rejecting WebSocket upgrade from {}: {}", req.remoteAddress(), error.getMessage());
            return res.status(error.getHttpStatus())
                    .header(HttpResult.CONTENT_TYPE, HttpResult.APPLICATION_JSON)
                    .header(HttpResult.ALLOW_ORIGIN, "*")
                    .sendString(Mono.just(JsonUtils.writeValueAsString(error.toErrorResponse())))
                    .then();
        }
        return res.sendWebsocket(wsHandler::handle);
    }
}
