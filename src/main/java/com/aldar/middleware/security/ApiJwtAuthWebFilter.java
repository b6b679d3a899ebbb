package com.aldar.middleware.security;

import com.aldar.middleware.config.AppAuthProperties;
import com.aldar.middleware.security.JwtPrincipalVerifier.JwtPrincipal;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

@Component
public class ApiJwtAuthWebFilter implements WebFilter {

    public static final String JWT_PRINCIPAL_ATTR = "APP_JWT_PRINCIPAL";

    private static final String AUTH_PREFIX = "Bearer ";

    private final AppAuthProperties authProperties;
    private final JwtPrincipalVerifier jwtVerifier;

    public ApiJwtAuthWebFilter(AppAuthProperties authProperties, JwtPrincipalVerifier jwtVerifier) {
        this.authProperties = authProperties;
        this.jwtVerifier = jwtVerifier;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!authProperties.isEnabled()) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        String protectedPrefix = StringUtils.hasText(authProperties.getPathPrefix()) ? authProperties.getPathPrefix() : "/api/";
        if (!StringUtils.hasText(path) || !path.startsWith(protectedPrefix)) {
            return chain.filter(exchange);
        }
        if (HttpMethod.OPTIONS.equals(exchange.getRequest().getMethod())) {
            return chain.filter(exchange);
        }

        String token = resolveBearerToken(exchange);
        JwtPrincipal principal = jwtVerifier.verify(token).orElse(null);
        if (principal == null) {
            return writeUnauthorized(exchange);
        }

        exchange.getAttributes().put(JWT_PRINCIPAL_ATTR, principal);
        return chain.filter(exchange);
    }

    /**
     * User id of the verified caller, or {@code null} when auth is disabled for the request.
     */
    public static String currentUserId(ServerWebExchange exchange) {
        Object principal = exchange.getAttribute(JWT_PRINCIPAL_ATTR);
        return principal instanceof JwtPrincipal jwtPrincipal ? jwtPrincipal.userId() : null;
    }

    private String resolveBearerToken(ServerWebExchange exchange) {
        String authorization = exchange.getRequest().getHeaders().getFirst("Authorization");
        if (!StringUtils.hasText(authorization) || !authorization.startsWith(AUTH_PREFIX)) {
            return null;
        }
        String token = authorization.substring(AUTH_PREFIX.length()).trim();
        return StringUtils.hasText(token) ? token : null;
    }

    private Mono<Void> writeUnauthorized(ServerWebExchange exchange) {
        byte[] body = "{\"code\":401,\"msg\":\"unauthorized\"}".getBytes(StandardCharsets.UTF_8);
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        return exchange.getResponse().writeWith(Mono.just(exchange.getResponse().bufferFactory().wrap(body)));
    }
}
